package com.notekeeper.infrastructure.note;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notes", indexes = {
    @Index(name = "ix_notes_owner", columnList = "owner_id"),
    @Index(name = "ix_notes_owner_created", columnList = "owner_id, created_at")
})
public class NoteEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "content", columnDefinition = "text")
  private String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected NoteEntity() {}

  public NoteEntity(UUID id, UUID ownerId, String title, String content, Instant createdAt) {
    this.id = id;
    this.ownerId = ownerId;
    this.title = title;
    this.content = content;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() { return id; }
  public UUID getOwnerId() { return ownerId; }
  public String getTitle() { return title; }
  public String getContent() { return content; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setTitle(String title) { this.title = title; }
  public void setContent(String content) { this.content = content; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  @PrePersist
  void prePersist() {
    if (id == null) id = UUID.randomUUID();
    if (updatedAt == null) updatedAt = createdAt;
  }
}
