package com.school.kanban.api.dto;

public class UpdateMeRequest {
  public String username;
  public String email;
}
