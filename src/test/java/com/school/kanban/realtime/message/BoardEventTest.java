package com.school.kanban.realtime.message;

import com.school.kanban.api.dto.CardDto;
import com.school.kanban.api.dto.ColumnDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoardEventTest {

  @Test
  @DisplayName("card_moved without from_column_id is rejected with a descriptive message")
  void cardMoved_missingFromColumn() {
    BoardEvent event = new BoardEvent.CardMoved(3L, new CardDto(), null, 31L);

    assertThat(event.data()).doesNotContainKey("from_column_id");
    assertThatThrownBy(() -> EventValidator.validate(event))
        .isInstanceOf(InvalidEventException.class)
        .hasMessage("Missing required field 'from_column_id' for event 'card_moved'");
  }

  @Test
  @DisplayName("a fully populated card_moved passes and keeps its keys")
  void cardMoved_complete() {
    BoardEvent event = new BoardEvent.CardMoved(3L, new CardDto(), 30L, 31L);

    assertThatCode(() -> EventValidator.validate(event)).doesNotThrowAnyException();
    assertThat(event.data()).containsOnlyKeys("board_id", "card", "from_column_id", "to_column_id");
    assertThat(event.type().wire()).isEqualTo("card_moved");
  }

  @Test
  @DisplayName("columns_reordered only needs the column list")
  void columnsReordered_onlyNeedsColumns() {
    assertThatCode(() -> EventValidator.validate(BoardEventType.COLUMNS_REORDERED,
        Map.of("columns", List.of(new ColumnDto())))).doesNotThrowAnyException();
  }

  @Test
  @DisplayName("card_deadline_updated requires the deadline")
  void deadlineUpdated_requiresDeadline() {
    assertThatThrownBy(() -> EventValidator.validate(new BoardEvent.CardDeadlineUpdated(3L, 5L, null)))
        .isInstanceOf(InvalidEventException.class)
        .hasMessageContaining("'deadline'");
    assertThatCode(() -> EventValidator.validate(new BoardEvent.CardDeadlineUpdated(3L, 5L, Instant.now())))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("user_role_changed carries board, user and role")
  void userRoleChanged_data() {
    BoardEvent event = new BoardEvent.UserRoleChanged(2L, 8L, "admin");

    assertThat(event.data()).containsEntry("board_id", 2L).containsEntry("user_id", 8L).containsEntry("role", "admin");
  }

  @Test
  @DisplayName("control events are limited to ping, pong and error and skip validation")
  void control_limitedToControlTypes() {
    assertThatThrownBy(() -> new BoardEvent.Control(BoardEventType.CARD_CREATED, Map.of()))
        .isInstanceOf(IllegalArgumentException.class);

    BoardEvent pong = new BoardEvent.Control(BoardEventType.PONG, null);
    assertThat(pong.data()).isEmpty();
    assertThatCode(() -> EventValidator.validate(pong)).doesNotThrowAnyException();
    assertThat(EventValidator.requiredFields(BoardEventType.ERROR)).isEmpty();
  }

  @Test
  @DisplayName("wire names resolve back to their types")
  void fromWire() {
    assertThat(BoardEventType.fromWire("comment_deleted")).isEqualTo(BoardEventType.COMMENT_DELETED);
    assertThat(BoardEventType.fromWire("tag_created")).isNull();
    assertThat(BoardEventType.fromWire(null)).isNull();
  }

  @Test
  @DisplayName("error messages put message before code")
  void serverMessage_error() {
    ServerMessage error = ServerMessage.error("Access denied to this board", 403);

    assertThat(error.event()).isEqualTo("error");
    assertThat(error.data().keySet()).containsExactly("message", "code");
    assertThat(ServerMessage.pong().data()).isEmpty();
  }
}
