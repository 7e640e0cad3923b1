package com.school.kanban.realtime.message;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Required top-level data keys per event type.
 * Types without an entry (ping, pong, error) are not checked.
 */
public final class EventValidator {

  private static final Map<BoardEventType, List<String>> REQUIRED = new EnumMap<>(BoardEventType.class);

  static {
    REQUIRED.put(BoardEventType.BOARD_UPDATED, List.of("board_id", "board"));
    REQUIRED.put(BoardEventType.BOARD_DELETED, List.of("board_id"));
    REQUIRED.put(BoardEventType.COLUMN_CREATED, List.of("board_id", "column"));
    REQUIRED.put(BoardEventType.COLUMN_UPDATED, List.of("board_id", "column"));
    REQUIRED.put(BoardEventType.COLUMN_DELETED, List.of("board_id", "column_id"));
    REQUIRED.put(BoardEventType.COLUMNS_REORDERED, List.of("columns"));
    REQUIRED.put(BoardEventType.CARD_CREATED, List.of("board_id", "card"));
    REQUIRED.put(BoardEventType.CARD_UPDATED, List.of("board_id", "card"));
    REQUIRED.put(BoardEventType.CARD_DELETED, List.of("board_id", "card_id"));
    REQUIRED.put(BoardEventType.CARD_MOVED, List.of("board_id", "card", "from_column_id", "to_column_id"));
    REQUIRED.put(BoardEventType.CARD_DEADLINE_UPDATED, List.of("board_id", "card_id", "deadline"));
    REQUIRED.put(BoardEventType.USER_ADDED, List.of("board_id", "user"));
    REQUIRED.put(BoardEventType.USER_REMOVED, List.of("board_id", "user_id"));
    REQUIRED.put(BoardEventType.USER_ROLE_CHANGED, List.of("board_id", "user_id", "role"));
    REQUIRED.put(BoardEventType.COMMENT_ADDED, List.of("board_id", "card_id", "comment"));
    REQUIRED.put(BoardEventType.COMMENT_UPDATED, List.of("board_id", "card_id", "comment"));
    REQUIRED.put(BoardEventType.COMMENT_DELETED, List.of("board_id", "card_id", "comment_id"));
  }

  private EventValidator() {}

  public static void validate(BoardEvent event) {
    validate(event.type(), event.data());
  }

  public static void validate(BoardEventType type, Map<String, Object> data) {
    List<String> required = REQUIRED.get(type);
    if (required == null) return;
    for (String key : required) {
      if (data == null || !data.containsKey(key)) throw new InvalidEventException(type, key);
    }
  }

  public static List<String> requiredFields(BoardEventType type) {
    return REQUIRED.getOrDefault(type, List.of());
  }
}
