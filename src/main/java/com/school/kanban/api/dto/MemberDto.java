package com.school.kanban.api.dto;

import com.school.kanban.model.BoardRole;

import java.time.Instant;

public class MemberDto {
  public Long userId;
  public String username;
  public String email;
  public BoardRole role;
  public Instant createdAt;
}
