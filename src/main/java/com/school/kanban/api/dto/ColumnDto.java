package com.school.kanban.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

public class ColumnDto {
  public Long id;
  public Long boardId;
  public String title;
  public int position;
  public Instant createdAt;
  public Instant updatedAt;

  // Only filled in the board detail view.
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public List<CardDto> cards;
}
