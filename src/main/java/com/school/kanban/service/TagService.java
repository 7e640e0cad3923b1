package com.school.kanban.service;

import com.school.kanban.api.dto.TagDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.BoardColumn;
import com.school.kanban.model.Card;
import com.school.kanban.model.Tag;
import com.school.kanban.repo.CardRepository;
import com.school.kanban.repo.ColumnRepository;
import com.school.kanban.repo.TagRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

// Board-scoped tags. Tag changes are not broadcast.
@ApplicationScoped
public class TagService {

  @Inject TagRepository tags;
  @Inject CardRepository cards;
  @Inject ColumnRepository columns;
  @Inject PermissionService perms;

  static TagDto toDto(Tag t) {
    TagDto d = new TagDto();
    d.id = t.id;
    d.boardId = t.boardId;
    d.name = t.name;
    d.color = t.color;
    return d;
  }

  @Transactional
  public TagDto create(AppUser actor, Long boardId, String name, String color) {
    perms.requireModify(boardId, actor);
    Tag t = new Tag();
    t.boardId = boardId;
    t.name = requireName(name);
    t.color = validColor(color);
    tags.persist(t);
    return toDto(t);
  }

  @Transactional
  public List<TagDto> list(AppUser actor, Long boardId) {
    perms.requireRead(boardId, actor);
    return tags.listForBoard(boardId).stream().map(TagService::toDto).collect(Collectors.toList());
  }

  @Transactional
  public TagDto update(AppUser actor, Long boardId, Long tagId, String name, String color) {
    perms.requireModify(boardId, actor);
    Tag t = requireTag(boardId, tagId);
    if (name != null) t.name = requireName(name);
    if (color != null) t.color = validColor(color);
    return toDto(t);
  }

  // Also detaches the tag from every card carrying it.
  @Transactional
  public void delete(AppUser actor, Long boardId, Long tagId) {
    perms.requireModify(boardId, actor);
    Tag t = requireTag(boardId, tagId);
    Instant now = Instant.now();
    for (Card c : cards.listTaggedWith(tagId)) {
      c.tagIds.remove(tagId);
      c.updatedAt = now;
    }
    tags.delete(t);
  }

  @Transactional
  public void assignToCard(AppUser actor, Long boardId, Long tagId, Long cardId) {
    perms.requireModify(boardId, actor);
    requireTag(boardId, tagId);
    Card c = requireBoardCard(boardId, cardId);
    if (!c.tagIds.add(tagId)) throw new ServiceExceptions.BadRequestException("Tag is already assigned to this card");
    c.updatedAt = Instant.now();
  }

  @Transactional
  public void removeFromCard(AppUser actor, Long boardId, Long tagId, Long cardId) {
    perms.requireModify(boardId, actor);
    requireTag(boardId, tagId);
    Card c = requireBoardCard(boardId, cardId);
    if (!c.tagIds.remove(tagId)) throw new ServiceExceptions.NotFoundException("Tag is not assigned to this card");
    c.updatedAt = Instant.now();
  }

  private Tag requireTag(Long boardId, Long tagId) {
    Tag t = tags.findById(tagId);
    if (t == null || !t.boardId.equals(boardId)) throw new ServiceExceptions.NotFoundException("Tag not found");
    return t;
  }

  // Tag and card must share the board.
  private Card requireBoardCard(Long boardId, Long cardId) {
    Card c = cards.findById(cardId);
    if (c == null) throw new ServiceExceptions.NotFoundException("Card not found");
    BoardColumn col = columns.findById(c.columnId);
    if (col == null || !col.boardId.equals(boardId)) {
      throw new ServiceExceptions.BadRequestException("Card does not belong to this board");
    }
    return c;
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) throw new ServiceExceptions.BadRequestException("name required");
    name = name.trim();
    if (name.length() > 50) throw new ServiceExceptions.BadRequestException("name must be at most 50 characters");
    return name;
  }

  private static String validColor(String color) {
    if (color == null || color.isBlank()) return null;
    if (!CardService.COLOR.matcher(color).matches()) {
      throw new ServiceExceptions.BadRequestException("color must be #RRGGBB");
    }
    return color;
  }
}
