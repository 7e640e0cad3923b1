package com.school.kanban.api.dto;

public class MeResponse {
  public Long id;
  public String subject;
  public String username;
  public String email;
  public boolean superuser;
}
