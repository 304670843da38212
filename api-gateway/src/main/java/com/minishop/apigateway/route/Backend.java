package com.minishop.apigateway.route;

/** The services the gateway forwards to. */
public enum Backend {
  USERS,
  PRODUCTS
}
