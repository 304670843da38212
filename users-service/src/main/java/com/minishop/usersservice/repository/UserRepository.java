package com.minishop.usersservice.repository;

import com.minishop.usersservice.error.ConflictException;
import com.minishop.usersservice.model.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory user directory. Keeps users in insertion order, enforces email uniqueness and assigns
 * IDs from a counter that never goes back, so deleted IDs are not handed out again.
 *
 * <p>All access is serialized on the repository instance. Records leave the repository as copies.
 */
@Repository
public class UserRepository {

  private static final String DUPLICATE_EMAIL = "User with this email already exists";

  private final Clock clock;
  private final Map<Long, User> users = new LinkedHashMap<>();
  private long nextId;

  @Autowired
  public UserRepository(Clock clock) {
    this.clock = clock;
    for (User user : seedUsers()) {
      users.put(user.getId(), user);
    }
    this.nextId = users.keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
  }

  public synchronized List<User> findAll() {
    List<User> all = new ArrayList<>(users.size());
    for (User user : users.values()) {
      all.add(user.copy());
    }
    return all;
  }

  public synchronized Optional<User> findById(Long id) {
    return Optional.ofNullable(users.get(id)).map(User::copy);
  }

  /**
   * Stores a new user under the next ID.
   *
   * @throws ConflictException if another user already has the same email
   */
  public synchronized User save(User user) {
    requireUniqueEmail(user.getEmail(), null);
    User stored = user.copy();
    stored.setId(nextId++);
    stored.setCreatedAt(Instant.now(clock));
    stored.setUpdatedAt(null);
    users.put(stored.getId(), stored);
    return stored.copy();
  }

  /**
   * Applies {@code changes} and stamps {@code updatedAt}. The changes are made on a copy and only
   * stored once the email is known to be unique, so a conflicting update leaves the user untouched.
   *
   * @throws ConflictException if the new email belongs to a different user
   */
  public synchronized Optional<User> update(Long id, Consumer<User> changes) {
    User stored = users.get(id);
    if (stored == null) {
      return Optional.empty();
    }
    User updated = stored.copy();
    changes.accept(updated);
    requireUniqueEmail(updated.getEmail(), id);
    updated.setUpdatedAt(Instant.now(clock));
    users.put(id, updated);
    return Optional.of(updated.copy());
  }

  public synchronized Optional<User> deleteById(Long id) {
    return Optional.ofNullable(users.remove(id));
  }

  public synchronized int count() {
    return users.size();
  }

  private void requireUniqueEmail(String email, Long ownerId) {
    for (User user : users.values()) {
      if (user.getEmail().equals(email) && !Objects.equals(user.getId(), ownerId)) {
        throw new ConflictException(DUPLICATE_EMAIL);
      }
    }
  }

  private static List<User> seedUsers() {
    List<User> seed = new ArrayList<>();
    seed.add(seedUser(1L, "John Doe", "john.doe@example.com", "admin", "2024-01-01"));
    seed.add(seedUser(2L, "Jane Smith", "jane.smith@example.com", "user", "2024-01-15"));
    seed.add(seedUser(3L, "Bob Johnson", "bob.johnson@example.com", "user", "2024-02-01"));
    return seed;
  }

  private static User seedUser(Long id, String name, String email, String role, String createdOn) {
    return User.builder()
        .id(id)
        .name(name)
        .email(email)
        .role(role)
        .createdAt(Instant.parse(createdOn + "T00:00:00Z"))
        .build();
  }
}
