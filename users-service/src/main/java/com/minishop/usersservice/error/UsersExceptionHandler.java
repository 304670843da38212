package com.minishop.usersservice.error;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class UsersExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(UsersExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> validation(ValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<Map<String, Object>> conflict(ConflictException ex) {
    log.warn("Rejecting write: {}", ex.getMessage());
    return error(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<Map<String, Object>> userNotFound(UserNotFoundException ex) {
    return userNotFoundBody(ex.getUserId());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> malformedId(MethodArgumentTypeMismatchException ex) {
    return userNotFoundBody(ex.getValue());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadableBody(HttpMessageNotReadableException ex) {
    log.warn("Rejecting unreadable request body: {}", ex.getMessage());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Invalid request body");
    body.put("message", ex.getMostSpecificCause().getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> unsupportedBody(
      HttpMediaTypeNotSupportedException ex) {
    log.warn("Rejecting request body: {}", ex.getMessage());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Invalid request body");
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler({
    NoHandlerFoundException.class,
    NoResourceFoundException.class,
    HttpRequestMethodNotSupportedException.class
  })
  public ResponseEntity<Map<String, Object>> routeNotFound(HttpServletRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Not found");
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> internal(Exception ex) {
    log.error("Unhandled error: {}", ex.getMessage(), ex);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Internal server error");
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", message);
    return ResponseEntity.status(status).body(body);
  }

  private static ResponseEntity<Map<String, Object>> userNotFoundBody(Object userId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "User not found");
    body.put("userId", userId);
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
  }
}
