package com.school.kanban.api.dto;

public class RemoveMemberRequest {
  public Long userId;
}
