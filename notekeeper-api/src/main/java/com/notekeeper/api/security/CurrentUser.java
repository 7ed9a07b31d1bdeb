package com.notekeeper.api.security;

import com.notekeeper.infrastructure.user.UserEntity;

import java.time.Instant;
import java.util.UUID;

/**
 * The authenticated principal attached to a request by {@link AuthGate}.
 * Holds no credentials, so it is safe to keep in the SecurityContext and to log.
 */
public record CurrentUser(UUID id, String username, String email, Instant createdAt) {

  public static CurrentUser of(UserEntity user) {
    return new CurrentUser(user.getId(), user.getUsername(), user.getEmail(), user.getCreatedAt());
  }
}
