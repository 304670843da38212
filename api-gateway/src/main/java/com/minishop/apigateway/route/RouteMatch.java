package com.minishop.apigateway.route;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RouteMatch {
  private final GatewayRoute route;
  private final String targetPath; // template with path variables filled in
}
