package com.minishop.productsservice.controller;

import com.minishop.productsservice.service.ProductService;
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

  static final String SERVICE_NAME = "products-service";

  private final ProductService productService;
  private final Clock clock;

  @Autowired
  public ServiceInfoController(ProductService productService, Clock clock) {
    this.productService = productService;
    this.clock = clock;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("service", SERVICE_NAME);
    health.put("timestamp", Instant.now(clock).toString());
    health.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
    health.put("totalProducts", productService.countProducts());
    return health;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("health", "/health");
    endpoints.put("products", "/products");
    endpoints.put("productById", "/products/:id");
    endpoints.put("productStock", "/products/:id/stock");
    endpoints.put("categories", "/categories");
    endpoints.put("search", "/search?q=");
    endpoints.put("stats", "/stats/products");

    Map<String, Object> info = new LinkedHashMap<>();
    info.put("message", "Products Service - Product Catalog Microservice");
    info.put("version", "1.0.0");
    info.put("endpoints", endpoints);
    return info;
  }
}
