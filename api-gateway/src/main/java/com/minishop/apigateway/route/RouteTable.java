package com.minishop.apigateway.route;

import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Every route the gateway proxies. Anything not listed here is answered with 404. */
@Component
public class RouteTable {

  private static final String USER_NOT_FOUND = "User not found";
  private static final String PRODUCT_NOT_FOUND = "Product not found";

  private final PathMatcher pathMatcher = new AntPathMatcher();
  private final List<GatewayRoute> routes;

  public RouteTable() {
    List<GatewayRoute> table = new ArrayList<>();
    table.add(
        route(
            HttpMethod.GET,
            "/api/users",
            Backend.USERS,
            "/users",
            "fetch users",
            USER_NOT_FOUND));
    table.add(
        route(
            HttpMethod.GET,
            "/api/users/{id}",
            Backend.USERS,
            "/users/{id}",
            "fetch user",
            USER_NOT_FOUND));
    table.add(
        route(
            HttpMethod.POST,
            "/api/users",
            Backend.USERS,
            "/users",
            "create user",
            USER_NOT_FOUND));
    table.add(
        route(
            HttpMethod.PUT,
            "/api/users/{id}",
            Backend.USERS,
            "/users/{id}",
            "update user",
            USER_NOT_FOUND));
    table.add(
        route(
            HttpMethod.DELETE,
            "/api/users/{id}",
            Backend.USERS,
            "/users/{id}",
            "delete user",
            USER_NOT_FOUND));

    table.add(
        route(
            HttpMethod.GET,
            "/api/products",
            Backend.PRODUCTS,
            "/products",
            "fetch products",
            PRODUCT_NOT_FOUND));
    table.add(
        route(
            HttpMethod.GET,
            "/api/products/{id}",
            Backend.PRODUCTS,
            "/products/{id}",
            "fetch product",
            PRODUCT_NOT_FOUND));
    table.add(
        route(
            HttpMethod.POST,
            "/api/products",
            Backend.PRODUCTS,
            "/products",
            "create product",
            PRODUCT_NOT_FOUND));
    table.add(
        route(
            HttpMethod.PUT,
            "/api/products/{id}",
            Backend.PRODUCTS,
            "/products/{id}",
            "update product",
            PRODUCT_NOT_FOUND));
    table.add(
        route(
            HttpMethod.DELETE,
            "/api/products/{id}",
            Backend.PRODUCTS,
            "/products/{id}",
            "delete product",
            PRODUCT_NOT_FOUND));
    this.routes = Collections.unmodifiableList(table);
  }

  public List<GatewayRoute> getRoutes() {
    return routes;
  }

  public Optional<RouteMatch> match(HttpMethod method, String path) {
    for (GatewayRoute route : routes) {
      if (route.getMethod().equals(method) && pathMatcher.match(route.getPattern(), path)) {
        Map<String, String> variables =
            pathMatcher.extractUriTemplateVariables(route.getPattern(), path);
        return Optional.of(new RouteMatch(route, expand(route.getTargetTemplate(), variables)));
      }
    }
    return Optional.empty();
  }

  private static String expand(String template, Map<String, String> variables) {
    String expanded = template;
    for (Map.Entry<String, String> variable : variables.entrySet()) {
      expanded = expanded.replace("{" + variable.getKey() + "}", variable.getValue());
    }
    return expanded;
  }

  private static GatewayRoute route(
      HttpMethod method,
      String pattern,
      Backend backend,
      String target,
      String action,
      String notFoundError) {
    return new GatewayRoute(method, pattern, backend, target, action, notFoundError);
  }
}
