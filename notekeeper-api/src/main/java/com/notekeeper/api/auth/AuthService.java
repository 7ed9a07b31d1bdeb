package com.notekeeper.api.auth;

import com.notekeeper.api.common.ConflictException;
import com.notekeeper.api.common.InvalidCredentialsException;
import com.notekeeper.api.security.CurrentUser;
import com.notekeeper.api.security.PasswordHasher;
import com.notekeeper.api.security.TokenService;
import com.notekeeper.infrastructure.user.UserEntity;
import com.notekeeper.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration, credential checks and login.
 */
@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final UserRepository users;
  private final PasswordHasher passwords;
  private final TokenService tokens;
  private final Clock clock;

  public AuthService(UserRepository users, PasswordHasher passwords, TokenService tokens, Clock clock) {
    this.users = users;
    this.passwords = passwords;
    this.tokens = tokens;
    this.clock = clock;
  }

  /**
   * Creates a user. Fails with {@link ConflictException} if the username or the email is taken,
   * including when a concurrent registration wins the race to the unique constraint.
   */
  public CurrentUser register(String username, String email, String password) {
    String normalizedEmail = normalizeEmail(email);
    if (users.existsByUsernameOrEmail(username, normalizedEmail)) {
      log.warn("Registration rejected, username or email already registered: username={}", username);
      throw new ConflictException("Username or email already registered");
    }

    var entity = new UserEntity(
        UUID.randomUUID(),
        username,
        normalizedEmail,
        passwords.hash(password),
        clock.instant().truncatedTo(ChronoUnit.MICROS)
    );
    try {
      users.saveAndFlush(entity);
    } catch (DataIntegrityViolationException dup) {
      log.warn("Registration lost a uniqueness race: username={}", username);
      throw new ConflictException("Username or email already registered", dup);
    }

    log.info("User registered: username={} id={}", username, entity.getId());
    return CurrentUser.of(entity);
  }

  /**
   * @return the user when the username exists and the password matches; empty in every other case.
   */
  public Optional<CurrentUser> authenticate(String username, String password) {
    if (username == null || password == null) return Optional.empty();
    return users.findByUsername(username)
        .filter(u -> passwords.verify(password, u.getHashedPassword()))
        .map(CurrentUser::of);
  }

  public TokenService.IssuedToken login(String username, String password) {
    CurrentUser user = authenticate(username, password).orElseThrow(() -> {
      log.warn("Login rejected: username={}", username);
      return new InvalidCredentialsException();
    });
    var token = tokens.issue(user.username());
    log.info("Login ok: username={}", user.username());
    return token;
  }

  private static String normalizeEmail(String email) {
    if (email == null) return "";
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
