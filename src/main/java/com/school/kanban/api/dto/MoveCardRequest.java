package com.school.kanban.api.dto;

public class MoveCardRequest {
  public Long columnId;
  public Integer position;
}
