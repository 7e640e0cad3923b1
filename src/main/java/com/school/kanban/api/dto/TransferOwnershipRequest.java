package com.school.kanban.api.dto;

public class TransferOwnershipRequest {
  public Long newOwnerId;
}
