package com.notekeeper.infrastructure.note;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every query here is keyed by the owner id. Service code must not resolve a note by id alone.
 */
public interface NoteRepository extends JpaRepository<NoteEntity, UUID> {

  Optional<NoteEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

  List<NoteEntity> findByOwnerId(UUID ownerId, Pageable page);

  List<NoteEntity> findByOwnerIdAndTitleContainingIgnoreCase(UUID ownerId, String title, Pageable page);
}
