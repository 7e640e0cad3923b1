package com.school.kanban.api.dto;

public class CommentRequest {
  public String text;
}
