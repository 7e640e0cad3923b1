package com.school.kanban.realtime.message;

import java.util.HashMap;
import java.util.Map;

// Closed set of server-to-client event names.
public enum BoardEventType {
  BOARD_UPDATED("board_updated"),
  BOARD_DELETED("board_deleted"),
  COLUMN_CREATED("column_created"),
  COLUMN_UPDATED("column_updated"),
  COLUMN_DELETED("column_deleted"),
  COLUMNS_REORDERED("columns_reordered"),
  CARD_CREATED("card_created"),
  CARD_UPDATED("card_updated"),
  CARD_DELETED("card_deleted"),
  CARD_MOVED("card_moved"),
  CARD_DEADLINE_UPDATED("card_deadline_updated"),
  USER_ADDED("user_added"),
  USER_REMOVED("user_removed"),
  USER_ROLE_CHANGED("user_role_changed"),
  COMMENT_ADDED("comment_added"),
  COMMENT_UPDATED("comment_updated"),
  COMMENT_DELETED("comment_deleted"),
  PING("ping"),
  PONG("pong"),
  ERROR("error");

  private static final Map<String, BoardEventType> BY_WIRE = new HashMap<>();

  static {
    for (BoardEventType t : values()) BY_WIRE.put(t.wire, t);
  }

  private final String wire;

  BoardEventType(String wire) {
    this.wire = wire;
  }

  public String wire() { return wire; }

  public boolean isControl() {
    return this == PING || this == PONG || this == ERROR;
  }

  // Null for names outside the set.
  public static BoardEventType fromWire(String name) {
    return name == null ? null : BY_WIRE.get(name);
  }
}
