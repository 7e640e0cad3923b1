package com.school.kanban.api.dto;

public class BoardRequest {
  public String title;
  public String description;
}
