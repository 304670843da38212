package com.minishop.usersservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User {

  public static final String DEFAULT_ROLE = "user";

  private Long id;

  private String name;

  private String email; // unique across all users

  private String role;

  private Instant createdAt;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Instant updatedAt;

  public User copy() {
    return toBuilder().build();
  }
}
