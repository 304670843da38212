package com.minishop.usersservice.dto;

import com.minishop.usersservice.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserListResponse {
  private int count;
  private List<User> users;

  public static UserListResponse of(List<User> users) {
    return new UserListResponse(users.size(), users);
  }
}
