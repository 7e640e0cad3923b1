package com.school.kanban.api.dto;

import java.time.Instant;

public class CommentDto {
  public Long id;
  public Long cardId;
  public Long authorUserId;
  public String authorUsername;
  public String text;
  public Instant createdAt;
  public Instant updatedAt;
}
