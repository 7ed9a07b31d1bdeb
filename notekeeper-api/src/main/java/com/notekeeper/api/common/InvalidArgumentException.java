package com.notekeeper.api.common;

public class InvalidArgumentException extends IllegalArgumentException {

  private final String field;

  public InvalidArgumentException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String field() {
    return field;
  }
}
