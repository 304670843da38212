package com.minishop.apigateway.error;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GatewayExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

  @ExceptionHandler(RouteNotFoundException.class)
  public ResponseEntity<Map<String, Object>> routeNotFound(RouteNotFoundException ex) {
    return notFound(ex.getPath());
  }

  @ExceptionHandler({
    NoHandlerFoundException.class,
    NoResourceFoundException.class,
    HttpRequestMethodNotSupportedException.class
  })
  public ResponseEntity<Map<String, Object>> noHandler(HttpServletRequest request) {
    return notFound(request.getRequestURI());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> internal(Exception ex) {
    log.error("Unhandled error: {}", ex.getMessage(), ex);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Internal server error");
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private static ResponseEntity<Map<String, Object>> notFound(String path) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Not found");
    body.put("path", path);
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
  }
}
