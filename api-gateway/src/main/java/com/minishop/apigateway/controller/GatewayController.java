package com.minishop.apigateway.controller;

import com.minishop.apigateway.filter.RequestIdFilter;
import com.minishop.apigateway.service.GatewayService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Single entry point for /api/**; which backend gets the call is decided by the route table. */
@RestController
public class GatewayController {

  private final GatewayService gatewayService;

  @Autowired
  public GatewayController(GatewayService gatewayService) {
    this.gatewayService = gatewayService;
  }

  @RequestMapping("/api/**")
  public Mono<ResponseEntity<Object>> proxy(
      HttpServletRequest request, @RequestBody(required = false) String body) {
    return gatewayService.proxy(
        HttpMethod.valueOf(request.getMethod()),
        request.getRequestURI(),
        request.getQueryString(),
        body,
        MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
  }
}
