package com.school.kanban.api.dto;

import com.school.kanban.model.BoardRole;

import java.time.Instant;

public class BoardDto {
  public Long id;
  public String title;
  public String description;
  public Long ownerUserId;
  // Effective role of the caller, null when rendered for an event.
  public BoardRole role;
  public Instant createdAt;
  public Instant updatedAt;
}
