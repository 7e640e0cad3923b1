package com.school.kanban.service;

import com.school.kanban.api.dto.CommentDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.Comment;
import com.school.kanban.repo.AppUserRepository;
import com.school.kanban.repo.CommentRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@ApplicationScoped
public class CommentService {

  @Inject CommentRepository comments;
  @Inject AppUserRepository users;
  @Inject CardService cardService;
  @Inject PermissionService perms;

  static CommentDto toDto(Comment c, AppUser author) {
    CommentDto d = new CommentDto();
    d.id = c.id;
    d.cardId = c.cardId;
    d.authorUserId = c.authorUserId;
    d.authorUsername = author == null ? null : author.username;
    d.text = c.text;
    d.createdAt = c.createdAt;
    d.updatedAt = c.updatedAt;
    return d;
  }

  // Any board member may comment.
  @Transactional
  public CommentDto add(AppUser actor, Long boardId, Long columnId, Long cardId, String text) {
    perms.requireRead(boardId, actor);
    cardService.requireCard(boardId, columnId, cardId);
    text = requireText(text);

    Comment c = new Comment();
    c.cardId = cardId;
    c.authorUserId = actor.id;
    c.text = text;
    c.createdAt = Instant.now();
    c.updatedAt = c.createdAt;
    comments.persist(c);
    return toDto(c, actor);
  }

  @Transactional
  public List<CommentDto> list(AppUser actor, Long boardId, Long columnId, Long cardId) {
    perms.requireRead(boardId, actor);
    cardService.requireCard(boardId, columnId, cardId);
    return comments.listForCard(cardId).stream()
        .map(c -> toDto(c, users.findById(c.authorUserId)))
        .collect(Collectors.toList());
  }

  @Transactional
  public CommentDto update(AppUser actor, Long boardId, Long columnId, Long cardId, Long commentId, String text) {
    perms.requireRead(boardId, actor);
    Comment c = requireComment(boardId, columnId, cardId, commentId);
    if (!c.authorUserId.equals(actor.id)) {
      throw new ServiceExceptions.ForbiddenException("Only the author can edit a comment");
    }
    c.text = requireText(text);
    c.updatedAt = Instant.now();
    return toDto(c, actor);
  }

  // Authors may delete their own comments, ADMIN and OWNER any comment.
  @Transactional
  public void delete(AppUser actor, Long boardId, Long columnId, Long cardId, Long commentId) {
    perms.requireRead(boardId, actor);
    PermissionService.Access access = perms.accessFor(boardId, actor);
    Comment c = requireComment(boardId, columnId, cardId, commentId);
    if (!c.authorUserId.equals(actor.id) && !access.canModify()) {
      throw new ServiceExceptions.ForbiddenException("Only the author or a board admin can delete a comment");
    }
    comments.delete(c);
  }

  private Comment requireComment(Long boardId, Long columnId, Long cardId, Long commentId) {
    cardService.requireCard(boardId, columnId, cardId);
    Comment c = comments.findById(commentId);
    if (c == null || !c.cardId.equals(cardId)) throw new ServiceExceptions.NotFoundException("Comment not found");
    return c;
  }

  private static String requireText(String text) {
    if (text == null || text.isBlank()) throw new ServiceExceptions.BadRequestException("text required");
    return text.trim();
  }
}
