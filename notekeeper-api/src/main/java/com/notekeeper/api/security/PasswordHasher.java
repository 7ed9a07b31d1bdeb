package com.notekeeper.api.security;

import com.notekeeper.api.common.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * One-way salted password hashing (BCrypt, work factor from {@link AuthProperties#bcryptStrength()}).
 *
 * A stored hash that cannot be parsed is reported as a failed verification, never as an error.
 * BCrypt reads only the first {@link #MAX_BYTES} bytes, so longer UTF-8 input is refused by
 * {@link #hash} and never verifies.
 */
@Component
public class PasswordHasher {

  public static final int MAX_BYTES = 72;

  private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

  private final PasswordEncoder encoder;

  public PasswordHasher(PasswordEncoder encoder) {
    this.encoder = encoder;
  }

  public String hash(String plaintext) {
    if (plaintext == null) throw new IllegalArgumentException("password must not be null");
    if (!fits(plaintext)) {
      throw new InvalidArgumentException("password", "Password must be at most " + MAX_BYTES + " bytes");
    }
    return encoder.encode(plaintext);
  }

  public boolean verify(String plaintext, String storedHash) {
    if (plaintext == null || storedHash == null || storedHash.isBlank()) return false;
    if (!fits(plaintext)) return false;
    try {
      return encoder.matches(plaintext, storedHash);
    } catch (IllegalArgumentException e) {
      log.warn("Stored password hash could not be verified: {}", e.getMessage());
      return false;
    }
  }

  static boolean fits(String plaintext) {
    return plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_BYTES;
  }
}
