package com.minishop.apigateway.route;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.http.HttpMethod;

/**
 * One row of the routing table: requests for {@code method} on {@code pattern} go to {@code
 * targetTemplate} on {@code backend}. {@code action} names the operation in failure messages
 * ("Failed to fetch users") and {@code notFoundError} replaces a backend 404 body.
 */
@Getter
@ToString
@AllArgsConstructor
public class GatewayRoute {
  private final HttpMethod method;
  private final String pattern;
  private final Backend backend;
  private final String targetTemplate;
  private final String action;
  private final String notFoundError;
}
