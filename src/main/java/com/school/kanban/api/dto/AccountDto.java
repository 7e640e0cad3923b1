package com.school.kanban.api.dto;

import java.time.Instant;

// Full account view, returned to the account holder and to superusers.
public class AccountDto {
  public Long id;
  public String subject;
  public String username;
  public String email;
  public boolean superuser;
  public boolean active;
  public Instant createdAt;
}
