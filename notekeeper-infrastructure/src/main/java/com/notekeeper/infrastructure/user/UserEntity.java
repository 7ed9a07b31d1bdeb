package com.notekeeper.infrastructure.user;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = "uk_users_username", columnNames = "username"),
    @UniqueConstraint(name = "uk_users_email", columnNames = "email")
})
public class UserEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "username", nullable = false, length = 64)
  private String username;

  @Column(name = "email", nullable = false, length = 128)
  private String email;

  @Column(name = "hashed_password", nullable = false, length = 100)
  private String hashedPassword;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(UUID id, String username, String email, String hashedPassword, Instant createdAt) {
    this.id = id;
    this.username = username;
    this.email = email;
    this.hashedPassword = hashedPassword;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getUsername() { return username; }
  public String getEmail() { return email; }
  public String getHashedPassword() { return hashedPassword; }
  public Instant getCreatedAt() { return createdAt; }
}
