package com.notekeeper.api.notes;

import com.notekeeper.api.security.CurrentUser;
import com.notekeeper.infrastructure.note.NoteEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/notes")
public class NoteController {

  private final NoteService notes;

  public NoteController(NoteService notes) {
    this.notes = notes;
  }

  public record CreateNoteRequest(
      @NotBlank @Size(max = 200) String title,
      String content
  ) {}

  /** Partial update: omitted (or null) fields keep their current value. */
  public record UpdateNoteRequest(
      @Size(min = 1, max = 200) @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String title,
      String content
  ) {}

  public record NoteResponse(
      UUID id,
      String title,
      String content,
      UUID ownerId,
      Instant createdAt,
      Instant updatedAt
  ) {
    static NoteResponse of(NoteEntity n) {
      return new NoteResponse(n.getId(), n.getTitle(), n.getContent(), n.getOwnerId(), n.getCreatedAt(), n.getUpdatedAt());
    }
  }

  public record MessageResponse(String detail) {}

  @PostMapping
  public ResponseEntity<NoteResponse> create(@AuthenticationPrincipal CurrentUser user,
                                             @Valid @RequestBody CreateNoteRequest req) {
    var note = notes.create(user, req.title(), req.content());
    return ResponseEntity.status(HttpStatus.CREATED).body(NoteResponse.of(note));
  }

  @GetMapping
  public List<NoteResponse> list(@AuthenticationPrincipal CurrentUser user,
                                 @RequestParam(value = "q", required = false) String q,
                                 @RequestParam(value = "sort", required = false) String sort,
                                 @RequestParam(value = "limit", required = false) Integer limit) {
    return notes.list(user, NoteQuery.of(q, sort, limit)).stream()
        .map(NoteResponse::of)
        .toList();
  }

  @GetMapping("/{id}")
  public NoteResponse get(@AuthenticationPrincipal CurrentUser user, @PathVariable UUID id) {
    return NoteResponse.of(notes.get(user, id));
  }

  @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
  public NoteResponse update(@AuthenticationPrincipal CurrentUser user,
                             @PathVariable UUID id,
                             @Valid @RequestBody UpdateNoteRequest req) {
    var patch = new NoteService.NotePatch(req.title(), req.content());
    return NoteResponse.of(notes.update(user, id, patch));
  }

  @DeleteMapping("/{id}")
  public MessageResponse delete(@AuthenticationPrincipal CurrentUser user, @PathVariable UUID id) {
    notes.delete(user, id);
    return new MessageResponse("Note deleted");
  }
}
