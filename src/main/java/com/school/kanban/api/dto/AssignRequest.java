package com.school.kanban.api.dto;

public class AssignRequest {
  public Long userId;
}
