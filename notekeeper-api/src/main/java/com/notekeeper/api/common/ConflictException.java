package com.notekeeper.api.common;

/**
 * A uniqueness rule was violated (for example a username or email already registered).
 */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
