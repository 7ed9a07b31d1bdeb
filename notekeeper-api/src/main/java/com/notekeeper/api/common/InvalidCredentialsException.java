package com.notekeeper.api.common;

/**
 * Login failed. Carries no hint about whether the username exists.
 */
public class InvalidCredentialsException extends RuntimeException {

  public InvalidCredentialsException() {
    super("Incorrect username or password");
  }
}
