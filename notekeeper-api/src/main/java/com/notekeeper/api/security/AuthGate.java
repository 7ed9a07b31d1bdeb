package com.notekeeper.api.security;

import com.notekeeper.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the bearer token of a request into a {@link CurrentUser}.
 *
 * The resource server filter extracts the token from the Authorization header and hands it here.
 * A bad signature, a malformed or expired token, and a token whose user no longer exists
 * all fail the same way, so callers cannot tell them apart.
 */
@Component
public class AuthGate implements AuthenticationProvider {

  private static final Logger log = LoggerFactory.getLogger(AuthGate.class);

  static final String INVALID_CREDENTIALS = "Could not validate credentials";

  private final TokenService tokens;
  private final UserRepository users;

  public AuthGate(TokenService tokens, UserRepository users) {
    this.tokens = tokens;
    this.users = users;
  }

  public CurrentUser resolve(String token) {
    String username = tokens.validate(token).orElseThrow(AuthGate::rejected);
    var user = users.findByUsername(username).orElseThrow(() -> {
      log.debug("Token subject has no user: {}", username);
      return rejected();
    });
    return CurrentUser.of(user);
  }

  @Override
  public Authentication authenticate(Authentication authentication) throws AuthenticationException {
    var bearer = (BearerTokenAuthenticationToken) authentication;
    CurrentUser user = resolve(bearer.getToken());

    var result = UsernamePasswordAuthenticationToken.authenticated(
        user,
        null,
        List.of(new SimpleGrantedAuthority("ROLE_USER"))
    );
    result.setDetails(bearer.getDetails());
    return result;
  }

  @Override
  public boolean supports(Class<?> authentication) {
    return BearerTokenAuthenticationToken.class.isAssignableFrom(authentication);
  }

  private static InvalidBearerTokenException rejected() {
    return new InvalidBearerTokenException(INVALID_CREDENTIALS);
  }
}
