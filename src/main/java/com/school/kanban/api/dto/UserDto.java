package com.school.kanban.api.dto;

// Public view of a user as seen by other board members.
public class UserDto {
  public Long id;
  public String username;
  public String email;
}
