package com.school.kanban.api.dto;

public class ColumnRequest {
  public String title;
  public Integer position;
}
