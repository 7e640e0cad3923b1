package com.school.kanban.api.dto;

public class TagDto {
  public Long id;
  public Long boardId;
  public String name;
  public String color;
}
