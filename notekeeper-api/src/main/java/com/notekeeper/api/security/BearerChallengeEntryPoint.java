package com.notekeeper.api.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.time.Clock;

/**
 * 401 for every unauthenticated request to a secured endpoint: missing, malformed, expired or
 * orphaned tokens all get the same challenge and body.
 */
public final class BearerChallengeEntryPoint implements AuthenticationEntryPoint {

  private final Clock clock;

  public BearerChallengeEntryPoint(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
      throws IOException {
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.getWriter().write(
        "{\"status\":\"error\",\"reason\":\"unauthenticated\",\"message\":\""
            + AuthGate.INVALID_CREDENTIALS + "\",\"ts\":\"" + clock.instant() + "\"}"
    );
  }
}
