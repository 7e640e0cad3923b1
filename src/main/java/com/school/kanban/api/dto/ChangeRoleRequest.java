package com.school.kanban.api.dto;

import com.school.kanban.model.BoardRole;

public class ChangeRoleRequest {
  public Long userId;
  public BoardRole role;
}
