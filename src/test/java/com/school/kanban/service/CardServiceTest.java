package com.school.kanban.service;

import com.school.kanban.model.BoardColumn;
import com.school.kanban.model.Card;
import com.school.kanban.repo.BoardMemberRepository;
import com.school.kanban.repo.CardRepository;
import com.school.kanban.repo.ColumnRepository;
import com.school.kanban.repo.CommentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardServiceTest {

  @Mock private CardRepository cards;
  @Mock private ColumnRepository columns;
  @Mock private CommentRepository comments;
  @Mock private BoardMemberRepository members;
  @Mock private PermissionService perms;

  @InjectMocks
  private CardService service;

  private static BoardColumn column(long id, long boardId) {
    BoardColumn c = new BoardColumn();
    c.id = id;
    c.boardId = boardId;
    return c;
  }

  private static Card card(long id, long columnId, int position) {
    Card c = new Card();
    c.id = id;
    c.columnId = columnId;
    c.position = position;
    c.title = "card " + id;
    c.createdAt = Instant.parse("2024-05-01T10:00:00Z");
    c.updatedAt = c.createdAt;
    return c;
  }

  @Test
  @DisplayName("moving within a column renumbers the column")
  void move_sameColumn() {
    Card a = card(100, 20, 0);
    Card b = card(101, 20, 1);
    Card c = card(102, 20, 2);
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(cards.findById(100L)).thenReturn(a);
    when(cards.listForColumn(20L)).thenReturn(List.of(a, b, c));

    CardService.MoveResult result = service.move(null, 10L, 20L, 100L, 20L, 2);

    assertThat(result.fromColumnId()).isEqualTo(20L);
    assertThat(b.position).isZero();
    assertThat(c.position).isEqualTo(1);
    assertThat(a.position).isEqualTo(2);
    assertThat(result.card().position).isEqualTo(2);
  }

  @Test
  @DisplayName("moving across columns compacts the source and opens a gap in the target")
  void move_acrossColumns() {
    Card a = card(100, 20, 1);
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(columns.findById(21L)).thenReturn(column(21, 10));
    when(cards.findById(100L)).thenReturn(a);
    when(cards.maxPosition(21L)).thenReturn(1);

    CardService.MoveResult result = service.move(null, 10L, 20L, 100L, 21L, 5);

    verify(cards).compactAfter(eq(20L), eq(1), any(Instant.class));
    verify(cards).shiftDown(eq(21L), eq(2), any(Instant.class));
    assertThat(a.columnId).isEqualTo(21L);
    assertThat(a.position).isEqualTo(2);
    assertThat(result.fromColumnId()).isEqualTo(20L);
    assertThat(result.card().columnId).isEqualTo(21L);
    assertThat(result.card().boardId).isEqualTo(10L);
  }

  @Test
  @DisplayName("a target column on another board is not found")
  void move_rejectsForeignColumn() {
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(columns.findById(99L)).thenReturn(column(99, 11));
    when(cards.findById(100L)).thenReturn(card(100, 20, 0));

    assertThatThrownBy(() -> service.move(null, 10L, 20L, 100L, 99L, 0))
        .isInstanceOf(ServiceExceptions.NotFoundException.class)
        .hasMessage("Column not found");
  }

  @Test
  @DisplayName("reorder must name every card of the column once")
  void reorder_validatesOrder() {
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(cards.listForColumn(20L)).thenReturn(List.of(card(100, 20, 0), card(101, 20, 1)));

    assertThatThrownBy(() -> service.reorder(null, 10L, 20L, List.of(101L)))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
  }

  @Test
  @DisplayName("reorder assigns positions in the given order")
  void reorder_assignsPositions() {
    Card a = card(100, 20, 0);
    Card b = card(101, 20, 1);
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(cards.listForColumn(20L)).thenReturn(List.of(a, b));

    var result = service.reorder(null, 10L, 20L, List.of(101L, 100L));

    assertThat(b.position).isZero();
    assertThat(a.position).isEqualTo(1);
    assertThat(result).extracting(d -> d.id).containsExactly(101L, 100L);
  }

  @Test
  @DisplayName("assignees must be board members")
  void assign_requiresMembership() {
    when(columns.findById(20L)).thenReturn(column(20, 10));
    when(cards.findById(100L)).thenReturn(card(100, 20, 0));

    assertThatThrownBy(() -> service.assign(null, 10L, 20L, 100L, 8L))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("User is not a member of this board");
  }
}
