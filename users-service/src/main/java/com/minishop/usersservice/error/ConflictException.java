package com.minishop.usersservice.error;

/** A write would break a uniqueness rule; answered with 409. */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }
}
