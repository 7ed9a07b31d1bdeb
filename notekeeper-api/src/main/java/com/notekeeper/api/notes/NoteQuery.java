package com.notekeeper.api.notes;

import com.notekeeper.api.common.InvalidArgumentException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * Listing parameters after boundary checks: optional title filter, sort and a limit in [1, 100].
 * Out-of-range limits are rejected, not clamped.
 */
public record NoteQuery(String titleFilter, NoteSort sort, int limit) {

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  public NoteQuery {
    if (sort == null) sort = NoteSort.DEFAULT;
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new InvalidArgumentException("limit", "limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
    }
    if (titleFilter != null && titleFilter.isEmpty()) titleFilter = null;
  }

  public static NoteQuery of(String titleFilter, String sort, Integer limit) {
    return new NoteQuery(titleFilter, NoteSort.parse(sort), limit == null ? DEFAULT_LIMIT : limit);
  }

  public static NoteQuery defaults() {
    return new NoteQuery(null, NoteSort.DEFAULT, DEFAULT_LIMIT);
  }

  Pageable toPageable() {
    return PageRequest.of(0, limit, sort.toSort());
  }
}
