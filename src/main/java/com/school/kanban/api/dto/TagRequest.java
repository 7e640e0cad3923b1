package com.school.kanban.api.dto;

public class TagRequest {
  public String name;
  public String color;
}
