package com.minishop.usersservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of POST and PUT on /users. {@code null} means the field was not supplied. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRequest {
  private String name;
  private String email;
  private String role;
}
