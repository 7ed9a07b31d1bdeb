package com.notekeeper.api.notes;

import com.notekeeper.api.common.InvalidArgumentException;
import org.springframework.data.domain.Sort;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Sort keys accepted by the list endpoint. A leading '-' means descending.
 * Equal keys are ordered by id in the same direction so paging is stable.
 */
public enum NoteSort {
  CREATED_ASC("created", "createdAt", Sort.Direction.ASC),
  CREATED_DESC("-created", "createdAt", Sort.Direction.DESC),
  TITLE_ASC("title", "title", Sort.Direction.ASC),
  TITLE_DESC("-title", "title", Sort.Direction.DESC);

  public static final NoteSort DEFAULT = CREATED_DESC;

  private final String key;
  private final String property;
  private final Sort.Direction direction;

  NoteSort(String key, String property, Sort.Direction direction) {
    this.key = key;
    this.property = property;
    this.direction = direction;
  }

  public String key() {
    return key;
  }

  public Sort toSort() {
    return Sort.by(direction, property).and(Sort.by(direction, "id"));
  }

  public static NoteSort parse(String raw) {
    if (raw == null || raw.isBlank()) return DEFAULT;
    String k = raw.trim();
    for (NoteSort s : values()) {
      if (s.key.equals(k)) return s;
    }
    throw new InvalidArgumentException("sort", "Unsupported sort '" + k + "', expected one of "
        + Arrays.stream(values()).map(NoteSort::key).collect(Collectors.joining(", ")));
  }
}
