package com.minishop.usersservice.error;

import lombok.Getter;

@Getter
public class UserNotFoundException extends RuntimeException {

  private final Object userId;

  public UserNotFoundException(Object userId) {
    super("User not found with id: " + userId);
    this.userId = userId;
  }
}
