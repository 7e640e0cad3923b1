package com.school.kanban.service;

import com.school.kanban.api.dto.ColumnDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.BoardColumn;
import com.school.kanban.model.Card;
import com.school.kanban.repo.CardRepository;
import com.school.kanban.repo.ColumnRepository;
import com.school.kanban.repo.CommentRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@ApplicationScoped
public class ColumnService {

  @Inject ColumnRepository columns;
  @Inject CardRepository cards;
  @Inject CommentRepository comments;
  @Inject PermissionService perms;

  static ColumnDto toDto(BoardColumn c) {
    ColumnDto d = new ColumnDto();
    d.id = c.id;
    d.boardId = c.boardId;
    d.title = c.title;
    d.position = c.position;
    d.createdAt = c.createdAt;
    d.updatedAt = c.updatedAt;
    return d;
  }

  // Deletes the column, its cards and their comments.
  static void deleteWithCards(BoardColumn col, CardRepository cards, CommentRepository comments) {
    for (Card card : cards.listForColumn(col.id)) {
      comments.deleteForCard(card.id);
      cards.delete(card);
    }
    col.delete();
  }

  @Transactional
  public ColumnDto create(AppUser actor, Long boardId, String title, Integer position) {
    perms.requireModify(boardId, actor);
    title = requireTitle(title);

    Instant now = Instant.now();
    int max = columns.maxPosition(boardId);
    int pos;
    if (position == null || position > max) {
      pos = max + 1;
    } else {
      if (position < 0) throw new ServiceExceptions.BadRequestException("position must be >= 0");
      pos = position;
      for (BoardColumn other : columns.listForBoard(boardId)) {
        if (other.position >= pos) {
          other.position++;
          other.updatedAt = now;
        }
      }
    }

    BoardColumn c = new BoardColumn();
    c.boardId = boardId;
    c.title = title;
    c.position = pos;
    c.createdAt = now;
    c.updatedAt = now;
    columns.persist(c);
    return toDto(c);
  }

  @Transactional
  public List<ColumnDto> list(AppUser actor, Long boardId) {
    perms.requireRead(boardId, actor);
    return columns.listForBoard(boardId).stream().map(ColumnService::toDto).collect(Collectors.toList());
  }

  @Transactional
  public ColumnDto get(AppUser actor, Long boardId, Long columnId) {
    perms.requireRead(boardId, actor);
    return toDto(requireColumn(boardId, columnId));
  }

  @Transactional
  public ColumnDto update(AppUser actor, Long boardId, Long columnId, String title, Integer position) {
    perms.requireModify(boardId, actor);
    BoardColumn c = requireColumn(boardId, columnId);
    if (title != null) c.title = requireTitle(title);
    if (position != null) {
      if (position < 0) throw new ServiceExceptions.BadRequestException("position must be >= 0");
      c.position = position;
    }
    c.updatedAt = Instant.now();
    return toDto(c);
  }

  // Remaining columns are renumbered from zero.
  @Transactional
  public void delete(AppUser actor, Long boardId, Long columnId) {
    perms.requireModify(boardId, actor);
    BoardColumn c = requireColumn(boardId, columnId);
    deleteWithCards(c, cards, comments);

    Instant now = Instant.now();
    int i = 0;
    for (BoardColumn other : columns.listForBoard(boardId)) {
      if (other.id.equals(columnId)) continue;
      if (other.position != i) {
        other.position = i;
        other.updatedAt = now;
      }
      i++;
    }
  }

  /**
   * Assigns positions 0..n-1 following the given order.
   * The order must name every column of the board exactly once.
   */
  @Transactional
  public List<ColumnDto> reorder(AppUser actor, Long boardId, List<Long> order) {
    perms.requireModify(boardId, actor);
    if (order == null || order.isEmpty()) throw new ServiceExceptions.BadRequestException("column_order required");

    List<BoardColumn> existing = columns.listForBoard(boardId);
    Map<Long, BoardColumn> byId = existing.stream().collect(Collectors.toMap(c -> c.id, Function.identity()));
    if (new HashSet<>(order).size() != order.size() || !byId.keySet().equals(new HashSet<>(order))) {
      throw new ServiceExceptions.BadRequestException("column_order must list every column of the board exactly once");
    }

    Instant now = Instant.now();
    for (int i = 0; i < order.size(); i++) {
      BoardColumn c = byId.get(order.get(i));
      if (c.position != i) {
        c.position = i;
        c.updatedAt = now;
      }
    }
    return order.stream().map(byId::get).map(ColumnService::toDto).collect(Collectors.toList());
  }

  BoardColumn requireColumn(Long boardId, Long columnId) {
    BoardColumn c = columns.findById(columnId);
    if (c == null || !c.boardId.equals(boardId)) throw new ServiceExceptions.NotFoundException("Column not found");
    return c;
  }

  private static String requireTitle(String title) {
    if (title == null || title.isBlank()) throw new ServiceExceptions.BadRequestException("title required");
    return title.trim();
  }
}
