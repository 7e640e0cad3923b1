package com.school.kanban.api.dto;

public class UpdateUserRequest {
  public String username;
  public String email;
  // Superusers only.
  public Boolean active;
}
