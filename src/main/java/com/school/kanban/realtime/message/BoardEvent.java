package com.school.kanban.realtime.message;

import com.school.kanban.api.dto.BoardDto;
import com.school.kanban.api.dto.CardDto;
import com.school.kanban.api.dto.ColumnDto;
import com.school.kanban.api.dto.CommentDto;
import com.school.kanban.api.dto.UserDto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An outbound board event. One variant per event type; {@link Control} is the only
 * untyped variant and is limited to ping, pong and error.
 *
 * <p>Components are boxed so that a caller forgetting one shows up as a missing key
 * in {@link #data()}, which {@link EventValidator} rejects before anything is sent.
 */
public sealed interface BoardEvent {

  BoardEventType type();

  Map<String, Object> data();

  record BoardUpdated(Long boardId, BoardDto board) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.BOARD_UPDATED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "board", board); }
  }

  record BoardDeleted(Long boardId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.BOARD_DELETED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId); }
  }

  record ColumnCreated(Long boardId, ColumnDto column) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COLUMN_CREATED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "column", column); }
  }

  record ColumnUpdated(Long boardId, ColumnDto column) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COLUMN_UPDATED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "column", column); }
  }

  record ColumnDeleted(Long boardId, Long columnId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COLUMN_DELETED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "column_id", columnId); }
  }

  record ColumnsReordered(Long boardId, List<ColumnDto> columns) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COLUMNS_REORDERED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "columns", columns); }
  }

  record CardCreated(Long boardId, CardDto card) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.CARD_CREATED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "card", card); }
  }

  record CardUpdated(Long boardId, CardDto card) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.CARD_UPDATED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "card", card); }
  }

  record CardDeleted(Long boardId, Long cardId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.CARD_DELETED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "card_id", cardId); }
  }

  record CardMoved(Long boardId, CardDto card, Long fromColumnId, Long toColumnId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.CARD_MOVED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "card", card,
          "from_column_id", fromColumnId, "to_column_id", toColumnId);
    }
  }

  record CardDeadlineUpdated(Long boardId, Long cardId, Instant deadline) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.CARD_DEADLINE_UPDATED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "card_id", cardId, "deadline", deadline);
    }
  }

  record UserAdded(Long boardId, UserDto user) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.USER_ADDED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "user", user); }
  }

  record UserRemoved(Long boardId, Long userId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.USER_REMOVED; }
    public Map<String, Object> data() { return EventData.of("board_id", boardId, "user_id", userId); }
  }

  record UserRoleChanged(Long boardId, Long userId, String role) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.USER_ROLE_CHANGED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "user_id", userId, "role", role);
    }
  }

  record CommentAdded(Long boardId, Long cardId, CommentDto comment) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COMMENT_ADDED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "card_id", cardId, "comment", comment);
    }
  }

  record CommentUpdated(Long boardId, Long cardId, CommentDto comment) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COMMENT_UPDATED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "card_id", cardId, "comment", comment);
    }
  }

  record CommentDeleted(Long boardId, Long cardId, Long commentId) implements BoardEvent {
    public BoardEventType type() { return BoardEventType.COMMENT_DELETED; }
    public Map<String, Object> data() {
      return EventData.of("board_id", boardId, "card_id", cardId, "comment_id", commentId);
    }
  }

  record Control(BoardEventType type, Map<String, Object> data) implements BoardEvent {
    public Control {
      if (type == null || !type.isControl()) {
        throw new IllegalArgumentException("Control events are limited to ping, pong and error, got " + type);
      }
      data = data == null ? Map.of() : Map.copyOf(data);
    }
  }
}
