package com.minishop.usersservice.dto;

import com.minishop.usersservice.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserStats {
  private int total;
  private RoleCounts byRole;
  private List<User> recentUsers; // newest first

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RoleCounts {
    private long admin;
    private long user;
  }
}
