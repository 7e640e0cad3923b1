package com.school.kanban.realtime;

import com.school.kanban.api.dto.CardDto;

import java.time.Instant;

public final class TestCards {

  private TestCards() {}

  public static CardDto card(long id, long boardId, long columnId, String title) {
    CardDto c = new CardDto();
    c.id = id;
    c.boardId = boardId;
    c.columnId = columnId;
    c.title = title;
    c.position = 0;
    c.createdAt = Instant.parse("2024-05-01T10:00:00Z");
    c.updatedAt = c.createdAt;
    return c;
  }
}
