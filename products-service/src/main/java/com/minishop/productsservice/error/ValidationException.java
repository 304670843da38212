package com.minishop.productsservice.error;

import lombok.Getter;

/** Missing or invalid client input; answered with 400. */
@Getter
public class ValidationException extends RuntimeException {

  private final String usage;

  public ValidationException(String message) {
    this(message, null);
  }

  public ValidationException(String message, String usage) {
    super(message);
    this.usage = usage;
  }
}
