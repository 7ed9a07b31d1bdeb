package com.notekeeper.api.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Issues and validates signed HS256 access tokens. The token subject is the username.
 *
 * Nothing is stored server side: a token is valid exactly while its signature checks out
 * and its exp lies in the future.
 */
@Service
public class TokenService {

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final Clock clock;
  private final String issuer;
  private final Duration defaultTtl;

  public TokenService(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, Clock clock, AuthProperties props) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.clock = clock;
    this.issuer = props.issuer();
    this.defaultTtl = props.accessTokenTtl();
  }

  public IssuedToken issue(String subject) {
    return issue(subject, defaultTtl);
  }

  public IssuedToken issue(String subject, Duration ttl) {
    if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject must not be blank");
    if (ttl == null || ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");

    // JWT timestamps carry whole seconds only
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant exp = now.plus(ttl);

    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .issuedAt(now)
        .expiresAt(exp)
        .subject(subject)
        .build();

    // Pin HS256 explicitly, NimbusJwtEncoder cannot pick a key for the default RS256 header.
    String value;
    try {
      value = jwtEncoder.encode(
          JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
      ).getTokenValue();
    } catch (JwtEncodingException e) {
      log.error("JWT encode failed (check notekeeper.auth.jwt-secret / issuer config)", e);
      throw e;
    }
    return new IssuedToken(value, exp, ChronoUnit.SECONDS.between(now, exp));
  }

  /**
   * @return the subject of a well-formed, correctly signed, unexpired token; empty otherwise.
   */
  public Optional<String> validate(String token) {
    if (token == null || token.isBlank()) return Optional.empty();
    try {
      Jwt jwt = jwtDecoder.decode(token);
      String subject = jwt.getSubject();
      if (subject == null || subject.isBlank()) {
        log.debug("Token rejected: no subject");
        return Optional.empty();
      }
      return Optional.of(subject);
    } catch (JwtException e) {
      log.debug("Token rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public record IssuedToken(String value, Instant expiresAt, long expiresInSeconds) {}
}
