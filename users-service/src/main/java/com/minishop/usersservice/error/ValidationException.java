package com.minishop.usersservice.error;

/** Missing or invalid client input; answered with 400. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
