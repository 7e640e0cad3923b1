package com.school.kanban.service;

import com.school.kanban.api.dto.CardDto;
import com.school.kanban.api.dto.CardRequest;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.BoardColumn;
import com.school.kanban.model.Card;
import com.school.kanban.repo.BoardMemberRepository;
import com.school.kanban.repo.CardRepository;
import com.school.kanban.repo.ColumnRepository;
import com.school.kanban.repo.CommentRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

// Business logic for cards: CRUD, moves, ordering, deadlines and assignees.
@ApplicationScoped
public class CardService {

  private static final Logger LOG = Logger.getLogger(CardService.class);

  static final Pattern COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

  @Inject CardRepository cards;
  @Inject ColumnRepository columns;
  @Inject CommentRepository comments;
  @Inject BoardMemberRepository members;
  @Inject PermissionService perms;

  // Result of a move; the source column is needed by the card_moved event.
  public record MoveResult(CardDto card, Long fromColumnId) {}

  static CardDto toDto(Card c, Long boardId) {
    CardDto d = new CardDto();
    d.id = c.id;
    d.columnId = c.columnId;
    d.boardId = boardId;
    d.title = c.title;
    d.description = c.description;
    d.color = c.color;
    d.position = c.position;
    d.completed = c.completed;
    d.deadline = c.deadline;
    d.assigneeIds = new ArrayList<>(c.assigneeIds);
    d.tagIds = new ArrayList<>(c.tagIds);
    d.createdAt = c.createdAt;
    d.updatedAt = c.updatedAt;
    return d;
  }

  @Transactional
  public CardDto create(AppUser actor, Long boardId, Long columnId, CardRequest req) {
    perms.requireModify(boardId, actor);
    requireColumn(boardId, columnId);
    if (req == null || req.title == null || req.title.isBlank()) {
      throw new ServiceExceptions.BadRequestException("title required");
    }

    Instant now = Instant.now();
    int max = cards.maxPosition(columnId);
    int pos;
    if (req.position == null || req.position > max) {
      pos = max + 1;
    } else {
      if (req.position < 0) throw new ServiceExceptions.BadRequestException("position must be >= 0");
      pos = req.position;
      cards.shiftDown(columnId, pos, now);
    }

    Card c = new Card();
    c.columnId = columnId;
    c.title = req.title.trim();
    c.description = req.description;
    c.color = validColor(req.color);
    c.position = pos;
    c.completed = req.completed != null && req.completed;
    c.deadline = req.deadline;
    c.createdAt = now;
    c.updatedAt = now;
    cards.persist(c);
    return toDto(c, boardId);
  }

  @Transactional
  public List<CardDto> list(AppUser actor, Long boardId, Long columnId) {
    perms.requireRead(boardId, actor);
    requireColumn(boardId, columnId);
    return cards.listForColumn(columnId).stream().map(c -> toDto(c, boardId)).collect(Collectors.toList());
  }

  @Transactional
  public CardDto get(AppUser actor, Long boardId, Long columnId, Long cardId) {
    perms.requireRead(boardId, actor);
    return toDto(requireCard(boardId, columnId, cardId), boardId);
  }

  // Position changes go through move and reorder.
  @Transactional
  public CardDto update(AppUser actor, Long boardId, Long columnId, Long cardId, CardRequest req) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    if (req == null) throw new ServiceExceptions.BadRequestException("body required");

    if (req.title != null) {
      if (req.title.isBlank()) throw new ServiceExceptions.BadRequestException("title must not be blank");
      c.title = req.title.trim();
    }
    if (req.description != null) c.description = req.description;
    if (req.color != null) c.color = validColor(req.color);
    if (req.deadline != null) c.deadline = req.deadline;
    if (req.completed != null) c.completed = req.completed;
    c.updatedAt = Instant.now();
    return toDto(c, boardId);
  }

  @Transactional
  public void delete(AppUser actor, Long boardId, Long columnId, Long cardId) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    int pos = c.position;
    comments.deleteForCard(c.id);
    cards.delete(c);
    cards.flush();
    cards.compactAfter(columnId, pos, Instant.now());
  }

  /**
   * Moves a card to a column and position on the same board.
   * Cards at or after the target position shift down and the source column is compacted.
   */
  @Transactional
  public MoveResult move(AppUser actor, Long boardId, Long columnId, Long cardId, Long targetColumnId, Integer position) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    if (targetColumnId == null) throw new ServiceExceptions.BadRequestException("column_id required");
    requireColumn(boardId, targetColumnId);
    if (position != null && position < 0) throw new ServiceExceptions.BadRequestException("position must be >= 0");

    Long from = c.columnId;
    Instant now = Instant.now();

    if (from.equals(targetColumnId)) {
      List<Card> ordered = new ArrayList<>(cards.listForColumn(from));
      ordered.removeIf(other -> other.id.equals(c.id));
      int pos = position == null ? ordered.size() : Math.min(position, ordered.size());
      ordered.add(pos, c);
      renumber(ordered, now);
    } else {
      int oldPos = c.position;
      int max = cards.maxPosition(targetColumnId);
      int pos = position == null ? max + 1 : Math.min(position, max + 1);
      cards.compactAfter(from, oldPos, now);
      cards.shiftDown(targetColumnId, pos, now);
      c.columnId = targetColumnId;
      c.position = pos;
      c.updatedAt = now;
    }

    LOG.debugf("Card %d moved from column %d to column %d", c.id, from, targetColumnId);
    return new MoveResult(toDto(c, boardId), from);
  }

  // The order must name every card of the column exactly once.
  @Transactional
  public List<CardDto> reorder(AppUser actor, Long boardId, Long columnId, List<Long> order) {
    perms.requireModify(boardId, actor);
    requireColumn(boardId, columnId);
    if (order == null || order.isEmpty()) throw new ServiceExceptions.BadRequestException("card_order required");

    Map<Long, Card> byId = cards.listForColumn(columnId).stream()
        .collect(Collectors.toMap(c -> c.id, Function.identity()));
    if (new HashSet<>(order).size() != order.size() || !byId.keySet().equals(new HashSet<>(order))) {
      throw new ServiceExceptions.BadRequestException("card_order must list every card of the column exactly once");
    }

    List<Card> ordered = order.stream().map(byId::get).collect(Collectors.toList());
    renumber(ordered, Instant.now());
    return ordered.stream().map(c -> toDto(c, boardId)).collect(Collectors.toList());
  }

  @Transactional
  public CardDto setDeadline(AppUser actor, Long boardId, Long columnId, Long cardId, Instant deadline) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    c.deadline = deadline;
    c.updatedAt = Instant.now();
    return toDto(c, boardId);
  }

  @Transactional
  public CardDto toggleCompleted(AppUser actor, Long boardId, Long columnId, Long cardId) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    c.completed = !c.completed;
    c.updatedAt = Instant.now();
    return toDto(c, boardId);
  }

  @Transactional
  public CardDto assign(AppUser actor, Long boardId, Long columnId, Long cardId, Long userId) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    if (userId == null) throw new ServiceExceptions.BadRequestException("user_id required");
    if (members.findMember(boardId, userId) == null) {
      throw new ServiceExceptions.BadRequestException("User is not a member of this board");
    }
    if (!c.assigneeIds.add(userId)) {
      throw new ServiceExceptions.BadRequestException("User is already assigned to this card");
    }
    c.updatedAt = Instant.now();
    return toDto(c, boardId);
  }

  @Transactional
  public CardDto unassign(AppUser actor, Long boardId, Long columnId, Long cardId, Long userId) {
    perms.requireModify(boardId, actor);
    Card c = requireCard(boardId, columnId, cardId);
    if (!c.assigneeIds.remove(userId)) {
      throw new ServiceExceptions.NotFoundException("User is not assigned to this card");
    }
    c.updatedAt = Instant.now();
    return toDto(c, boardId);
  }

  Card requireCard(Long boardId, Long columnId, Long cardId) {
    requireColumn(boardId, columnId);
    Card c = cards.findById(cardId);
    if (c == null || !c.columnId.equals(columnId)) throw new ServiceExceptions.NotFoundException("Card not found");
    return c;
  }

  private BoardColumn requireColumn(Long boardId, Long columnId) {
    BoardColumn col = columns.findById(columnId);
    if (col == null || !col.boardId.equals(boardId)) throw new ServiceExceptions.NotFoundException("Column not found");
    return col;
  }

  private static void renumber(List<Card> ordered, Instant now) {
    for (int i = 0; i < ordered.size(); i++) {
      Card c = ordered.get(i);
      if (c.position != i) {
        c.position = i;
        c.updatedAt = now;
      }
    }
  }

  private static String validColor(String color) {
    if (color == null || color.isBlank()) return null;
    if (!COLOR.matcher(color).matches()) throw new ServiceExceptions.BadRequestException("color must be #RRGGBB");
    return color;
  }
}
