package com.minishop.apigateway.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ServiceInfoController {

  private final Clock clock;

  @Autowired
  public ServiceInfoController(Clock clock) {
    this.clock = clock;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("service", "api-gateway");
    health.put("timestamp", Instant.now(clock).toString());
    health.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
    return health;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("health", "/health");
    endpoints.put("users", "/api/users");
    endpoints.put("products", "/api/products");

    Map<String, Object> info = new LinkedHashMap<>();
    info.put("message", "API Gateway - Microservices Architecture");
    info.put("version", "1.0.0");
    info.put("endpoints", endpoints);
    return info;
  }
}
