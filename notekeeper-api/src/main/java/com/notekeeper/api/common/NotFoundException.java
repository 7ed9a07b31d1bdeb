package com.notekeeper.api.common;

/**
 * Resource is absent or belongs to someone else. The two cases are reported identically.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
