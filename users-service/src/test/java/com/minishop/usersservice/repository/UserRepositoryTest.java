package com.minishop.usersservice.repository;

import com.minishop.usersservice.error.ConflictException;
import com.minishop.usersservice.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UserRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private UserRepository userRepository;

  @BeforeEach
  void setup() {
    userRepository = new UserRepository(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void shouldStartWithSeedUsers() {
    assertThat(userRepository.findAll())
        .extracting(User::getEmail)
        .containsExactly(
            "john.doe@example.com", "jane.smith@example.com", "bob.johnson@example.com");
  }

  @Test
  void save_shouldAssignIncreasingIdsEvenAfterDeletes() {
    User alice = userRepository.save(newUser("Alice", "alice@example.com"));
    userRepository.deleteById(alice.getId());
    userRepository.deleteById(3L);

    User carol = userRepository.save(newUser("Carol", "carol@example.com"));

    assertThat(alice.getId()).isEqualTo(4L);
    assertThat(carol.getId()).isEqualTo(5L);
    assertThat(carol.getCreatedAt()).isEqualTo(NOW);
  }

  @Test
  void save_shouldRejectDuplicateEmailWithoutStoring() {
    assertThatThrownBy(() -> userRepository.save(newUser("Johnny", "john.doe@example.com")))
        .isInstanceOf(ConflictException.class)
        .hasMessage("User with this email already exists");
    assertThat(userRepository.count()).isEqualTo(3);
  }

  @Test
  void update_shouldRejectEmailOfAnotherUserAndKeepRecordIntact() {
    assertThatThrownBy(
            () ->
                userRepository.update(
                    2L,
                    u -> {
                      u.setName("Renamed");
                      u.setEmail("bob.johnson@example.com");
                    }))
        .isInstanceOf(ConflictException.class);

    User jane = userRepository.findById(2L).orElseThrow();
    assertThat(jane.getName()).isEqualTo("Jane Smith");
    assertThat(jane.getUpdatedAt()).isNull();
  }

  @Test
  void update_shouldAllowKeepingOwnEmail() {
    User updated =
        userRepository.update(2L, u -> u.setEmail("jane.smith@example.com")).orElseThrow();

    assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void update_shouldKeepInsertionOrder() {
    userRepository.update(1L, u -> u.setRole("user"));

    assertThat(userRepository.findAll()).extracting(User::getId).containsExactly(1L, 2L, 3L);
  }

  private User newUser(String name, String email) {
    return User.builder().name(name).email(email).role(User.DEFAULT_ROLE).build();
  }
}
