package com.minishop.apigateway.service;

import com.minishop.apigateway.client.BackendClient;
import com.minishop.apigateway.error.RouteNotFoundException;
import com.minishop.apigateway.error.UpstreamException;
import com.minishop.apigateway.route.GatewayRoute;
import com.minishop.apigateway.route.RouteMatch;
import com.minishop.apigateway.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Proxies a client request through the routing table. Successful backend responses are relayed
 * untouched; a backend 404 becomes a generic not-found body and every other failure a 500 naming
 * the operation that failed.
 */
@Service
public class GatewayService {

  private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

  private final RouteTable routeTable;
  private final BackendClient backendClient;

  @Autowired
  public GatewayService(RouteTable routeTable, BackendClient backendClient) {
    this.routeTable = routeTable;
    this.backendClient = backendClient;
  }

  public Mono<ResponseEntity<Object>> proxy(
      HttpMethod method, String path, String rawQuery, String body, String requestId) {
    Optional<RouteMatch> match = routeTable.match(method, path);
    if (match.isEmpty()) {
      return Mono.error(new RouteNotFoundException(path));
    }
    GatewayRoute route = match.get().getRoute();
    String targetPath = match.get().getTargetPath();
    log.info("Forwarding {} {} to {} {}", method, path, route.getBackend(), targetPath);

    return backendClient
        .forward(route.getBackend(), method, targetPath, rawQuery, body, requestId)
        .map(GatewayService::relay)
        .onErrorResume(UpstreamException.class, e -> Mono.just(translate(route, e)));
  }

  private static ResponseEntity<Object> relay(ResponseEntity<String> response) {
    return ResponseEntity.status(response.getStatusCode())
        .contentType(MediaType.APPLICATION_JSON)
        .body(response.getBody());
  }

  private static ResponseEntity<Object> translate(GatewayRoute route, UpstreamException e) {
    Map<String, Object> body = new LinkedHashMap<>();
    if (e.isNotFound()) {
      body.put("error", route.getNotFoundError());
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }
    log.error("Failed to {}: {}", route.getAction(), e.getMessage());
    body.put("error", "Failed to " + route.getAction());
    body.put("message", e.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
