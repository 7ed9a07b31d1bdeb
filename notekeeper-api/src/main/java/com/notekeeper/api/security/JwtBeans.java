package com.notekeeper.api.security;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.JWSAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;

@Configuration
public class JwtBeans {

  private static final Logger log = LoggerFactory.getLogger(JwtBeans.class);

  static final String DEV_SECRET = "dev-secret-change-me";

  private final Environment env;
  private final AuthProperties props;

  public JwtBeans(Environment env, AuthProperties props) {
    this.env = env;
    this.props = props;
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder(props.bcryptStrength());
  }

  @Bean
  public JwtEncoder jwtEncoder() {
    return encoder(signingKey(props.jwtSecret()));
  }

  @Bean
  public JwtDecoder jwtDecoder(Clock clock) {
    return decoder(signingKey(props.jwtSecret()), props.issuer(), clock);
  }

  static JwtEncoder encoder(byte[] keyBytes) {
    var jwk = new OctetSequenceKey.Builder(keyBytes)
        .algorithm(JWSAlgorithm.HS256)
        .keyID("notekeeper-hs256")
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  /**
   * HS256 decoder with zero clock skew: a token is rejected as soon as the clock passes its exp.
   * Tokens without an exp claim, or from another issuer, are rejected too.
   */
  static JwtDecoder decoder(byte[] keyBytes, String issuer, Clock clock) {
    var key = new SecretKeySpec(keyBytes, "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();

    var expiry = new JwtTimestampValidator(Duration.ZERO);
    expiry.setClock(clock);
    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
        expiry,
        new JwtClaimValidator<Instant>(JwtClaimNames.EXP, Objects::nonNull),
        new JwtIssuerValidator(issuer)
    ));
    return decoder;
  }

  /**
   * Accepts any configured secret string and derives a fixed 32-byte key (HS256 friendly).
   * A blank secret refuses to start unless the dev or test profile is active.
   */
  byte[] signingKey(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev", "test"))) {
        log.warn("notekeeper.auth.jwt-secret is empty; using the built-in development secret. Never run like this in production.");
        s = DEV_SECRET;
      } else {
        throw new IllegalStateException("notekeeper.auth.jwt-secret is empty. Set NOTEKEEPER_JWT_SECRET.");
      }
    }
    return deriveKey(s);
  }

  static byte[] deriveKey(String secret) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
