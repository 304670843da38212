package com.minishop.usersservice.controller;

import com.minishop.usersservice.dto.UserListResponse;
import com.minishop.usersservice.dto.UserRequest;
import com.minishop.usersservice.dto.UserResponse;
import com.minishop.usersservice.dto.UserStats;
import com.minishop.usersservice.model.User;
import com.minishop.usersservice.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class UserController {

  private static final Logger log = LoggerFactory.getLogger(UserController.class);

  private final UserService userService;

  @Autowired
  public UserController(UserService userService) {
    this.userService = userService;
  }

  // GET /users?role=admin&limit=2
  @GetMapping("/users")
  public ResponseEntity<UserListResponse> getUsers(
      @RequestParam(required = false) String role,
      @RequestParam(required = false) String limit) {
    return ResponseEntity.ok(UserListResponse.of(userService.getUsers(role, parseLimit(limit))));
  }

  @GetMapping("/users/{id}")
  public ResponseEntity<User> getUserById(@PathVariable Long id) {
    log.info("Getting user with id {}", id);
    return ResponseEntity.ok(userService.getUserById(id));
  }

  @PostMapping("/users")
  public ResponseEntity<UserResponse> createUser(@RequestBody UserRequest request) {
    User createdUser = userService.createUser(request);
    return new ResponseEntity<>(
        new UserResponse("User created successfully", createdUser), HttpStatus.CREATED);
  }

  @PutMapping("/users/{id}")
  public ResponseEntity<UserResponse> updateUser(
      @PathVariable Long id, @RequestBody(required = false) UserRequest request) {
    log.info("Updating user with id {}", id);
    User updatedUser = userService.updateUser(id, request != null ? request : new UserRequest());
    return ResponseEntity.ok(new UserResponse("User updated successfully", updatedUser));
  }

  @DeleteMapping("/users/{id}")
  public ResponseEntity<UserResponse> deleteUser(@PathVariable Long id) {
    User deletedUser = userService.deleteUser(id);
    return ResponseEntity.ok(new UserResponse("User deleted successfully", deletedUser));
  }

  @GetMapping("/stats/users")
  public ResponseEntity<UserStats> getStats() {
    return ResponseEntity.ok(userService.getStats());
  }

  // Non-numeric or negative means no limit
  private static Integer parseLimit(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int limit = Integer.parseInt(value.trim());
      return limit >= 0 ? limit : null;
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric limit '{}'", value);
      return null;
    }
  }
}
