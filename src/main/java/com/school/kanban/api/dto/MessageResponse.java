package com.school.kanban.api.dto;

public class MessageResponse {
  public String message;

  public MessageResponse() {}

  public MessageResponse(String message) { this.message = message; }
}
