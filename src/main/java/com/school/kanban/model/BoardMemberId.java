package com.school.kanban.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class BoardMemberId implements Serializable {
  @Column(name = "board_id", nullable = false)
  public Long boardId;

  @Column(name = "user_id", nullable = false)
  public Long userId;

  public BoardMemberId() {}

  public BoardMemberId(Long boardId, Long userId) {
    this.boardId = boardId;
    this.userId = userId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BoardMemberId that)) return false;
    return Objects.equals(boardId, that.boardId) && Objects.equals(userId, that.userId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(boardId, userId);
  }
}
