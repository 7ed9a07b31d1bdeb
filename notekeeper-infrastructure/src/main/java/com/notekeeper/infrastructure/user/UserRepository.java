package com.notekeeper.infrastructure.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<UserEntity, UUID> {

  Optional<UserEntity> findByUsername(String username);

  /** Single lookup used by registration: true if either the username or the email is taken. */
  boolean existsByUsernameOrEmail(String username, String email);
}
