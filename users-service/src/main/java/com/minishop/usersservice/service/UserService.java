package com.minishop.usersservice.service;

import com.minishop.usersservice.dto.UserRequest;
import com.minishop.usersservice.dto.UserStats;
import com.minishop.usersservice.error.UserNotFoundException;
import com.minishop.usersservice.error.ValidationException;
import com.minishop.usersservice.model.User;
import com.minishop.usersservice.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  static final int RECENT_USERS = 5;

  private final UserRepository userRepository;

  @Autowired
  public UserService(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  /** Users with exactly {@code role} (all when {@code null}), truncated to {@code limit}. */
  public List<User> getUsers(String role, Integer limit) {
    Stream<User> users = userRepository.findAll().stream();
    if (role != null && !role.isEmpty()) {
      users = users.filter(u -> role.equals(u.getRole()));
    }
    if (limit != null && limit >= 0) {
      users = users.limit(limit);
    }
    return users.collect(Collectors.toList());
  }

  public User getUserById(Long id) {
    return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
  }

  public User createUser(UserRequest request) {
    if (isBlank(request.getName()) || isBlank(request.getEmail())) {
      throw new ValidationException("Name and email are required");
    }
    User user =
        User.builder()
            .name(request.getName())
            .email(request.getEmail())
            .role(isBlank(request.getRole()) ? User.DEFAULT_ROLE : request.getRole())
            .build();
    User created = userRepository.save(user);
    log.info("User created with id {}", created.getId());
    return created;
  }

  /** Overwrites the supplied fields. A supplied field must not be blank. */
  public User updateUser(Long id, UserRequest request) {
    if (userRepository.findById(id).isEmpty()) {
      throw new UserNotFoundException(id);
    }
    rejectBlank(request.getName(), "Name");
    rejectBlank(request.getEmail(), "Email");
    rejectBlank(request.getRole(), "Role");

    return userRepository
        .update(
            id,
            existing -> {
              if (request.getName() != null) existing.setName(request.getName());
              if (request.getEmail() != null) existing.setEmail(request.getEmail());
              if (request.getRole() != null) existing.setRole(request.getRole());
            })
        .orElseThrow(() -> new UserNotFoundException(id));
  }

  public User deleteUser(Long id) {
    User deleted = userRepository.deleteById(id).orElseThrow(() -> new UserNotFoundException(id));
    log.info("User {} deleted", id);
    return deleted;
  }

  public UserStats getStats() {
    List<User> users = userRepository.findAll();
    long admins = users.stream().filter(u -> "admin".equals(u.getRole())).count();
    long regular = users.stream().filter(u -> User.DEFAULT_ROLE.equals(u.getRole())).count();

    List<User> recent =
        new ArrayList<>(users.subList(Math.max(0, users.size() - RECENT_USERS), users.size()));
    Collections.reverse(recent);

    return new UserStats(users.size(), new UserStats.RoleCounts(admins, regular), recent);
  }

  public int countUsers() {
    return userRepository.count();
  }

  private static void rejectBlank(String value, String field) {
    if (value != null && value.isBlank()) {
      throw new ValidationException(field + " must not be empty");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
