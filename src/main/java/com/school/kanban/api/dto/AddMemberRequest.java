package com.school.kanban.api.dto;

import com.school.kanban.model.BoardRole;

// Used by both add-user (userId) and add-user-by-email (email).
public class AddMemberRequest {
  public Long userId;
  public String email;
  public BoardRole role;
}
