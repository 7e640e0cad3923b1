package com.school.kanban.api.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class CardDto {
  public Long id;
  public Long columnId;
  public Long boardId;
  public String title;
  public String description;
  public String color;
  public int position;
  public boolean completed;
  public Instant deadline;
  public List<Long> assigneeIds = new ArrayList<>();
  public List<Long> tagIds = new ArrayList<>();
  public Instant createdAt;
  public Instant updatedAt;
}
