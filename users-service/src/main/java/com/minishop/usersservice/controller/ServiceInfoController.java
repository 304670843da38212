package com.minishop.usersservice.controller;

import com.minishop.usersservice.service.UserService;
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

  static final String SERVICE_NAME = "users-service";

  private final UserService userService;
  private final Clock clock;

  @Autowired
  public ServiceInfoController(UserService userService, Clock clock) {
    this.userService = userService;
    this.clock = clock;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("service", SERVICE_NAME);
    health.put("timestamp", Instant.now(clock).toString());
    health.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
    health.put("totalUsers", userService.countUsers());
    return health;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("health", "/health");
    endpoints.put("users", "/users");
    endpoints.put("userById", "/users/:id");
    endpoints.put("stats", "/stats/users");

    Map<String, Object> info = new LinkedHashMap<>();
    info.put("message", "Users Service - User Management Microservice");
    info.put("version", "1.0.0");
    info.put("endpoints", endpoints);
    return info;
  }
}
