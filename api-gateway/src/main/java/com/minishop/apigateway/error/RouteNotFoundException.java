package com.minishop.apigateway.error;

import lombok.Getter;

@Getter
public class RouteNotFoundException extends RuntimeException {

  private final String path;

  public RouteNotFoundException(String path) {
    super("No route for " + path);
    this.path = path;
  }
}
