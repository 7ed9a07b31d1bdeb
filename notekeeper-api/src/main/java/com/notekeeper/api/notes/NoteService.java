package com.notekeeper.api.notes;

import com.notekeeper.api.common.NotFoundException;
import com.notekeeper.api.security.CurrentUser;
import com.notekeeper.infrastructure.note.NoteEntity;
import com.notekeeper.infrastructure.note.NoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Note operations, always scoped to the acting user.
 *
 * A note owned by somebody else is reported as {@link NotFoundException}, exactly like a missing one.
 */
@Service
public class NoteService {

  private static final Logger log = LoggerFactory.getLogger(NoteService.class);

  static final String NOT_FOUND = "Note not found";

  private final NoteRepository notes;
  private final Clock clock;

  public NoteService(NoteRepository notes, Clock clock) {
    this.notes = notes;
    this.clock = clock;
  }

  @Transactional
  public NoteEntity create(CurrentUser owner, String title, String content) {
    requireOwner(owner);
    var note = new NoteEntity(UUID.randomUUID(), owner.id(), title, content, now());
    notes.save(note);
    log.debug("Note created: id={} owner={}", note.getId(), owner.id());
    return note;
  }

  @Transactional(readOnly = true)
  public NoteEntity get(CurrentUser owner, UUID id) {
    requireOwner(owner);
    return requireOwned(owner, id);
  }

  /**
   * Applies only the fields present in the patch (null means "keep") and refreshes updatedAt.
   */
  @Transactional
  public NoteEntity update(CurrentUser owner, UUID id, NotePatch patch) {
    requireOwner(owner);
    NoteEntity note = requireOwned(owner, id);
    if (patch != null) {
      if (patch.title() != null) note.setTitle(patch.title());
      if (patch.content() != null) note.setContent(patch.content());
    }
    note.setUpdatedAt(now());
    notes.save(note);
    log.debug("Note updated: id={} owner={}", id, owner.id());
    return note;
  }

  @Transactional
  public void delete(CurrentUser owner, UUID id) {
    requireOwner(owner);
    NoteEntity note = requireOwned(owner, id);
    notes.delete(note);
    log.debug("Note deleted: id={} owner={}", id, owner.id());
  }

  @Transactional(readOnly = true)
  public List<NoteEntity> list(CurrentUser owner, NoteQuery query) {
    requireOwner(owner);
    NoteQuery q = query == null ? NoteQuery.defaults() : query;
    if (q.titleFilter() == null) {
      return notes.findByOwnerId(owner.id(), q.toPageable());
    }
    return notes.findByOwnerIdAndTitleContainingIgnoreCase(owner.id(), q.titleFilter(), q.toPageable());
  }

  private NoteEntity requireOwned(CurrentUser owner, UUID id) {
    if (id == null) throw new NotFoundException(NOT_FOUND);
    return notes.findByIdAndOwnerId(id, owner.id())
        .orElseThrow(() -> new NotFoundException(NOT_FOUND));
  }

  private static void requireOwner(CurrentUser owner) {
    if (owner == null || owner.id() == null) throw new IllegalStateException("No authenticated owner");
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  public record NotePatch(String title, String content) {}
}
