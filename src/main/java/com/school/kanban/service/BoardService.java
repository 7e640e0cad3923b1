package com.school.kanban.service;

import com.school.kanban.api.dto.BoardDetailDto;
import com.school.kanban.api.dto.BoardDto;
import com.school.kanban.api.dto.ColumnDto;
import com.school.kanban.api.dto.MemberDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.Board;
import com.school.kanban.model.BoardColumn;
import com.school.kanban.model.BoardMember;
import com.school.kanban.model.BoardMemberId;
import com.school.kanban.model.BoardRole;
import com.school.kanban.model.Card;
import com.school.kanban.repo.AppUserRepository;
import com.school.kanban.repo.BoardMemberRepository;
import com.school.kanban.repo.BoardRepository;
import com.school.kanban.repo.CardRepository;
import com.school.kanban.repo.ColumnRepository;
import com.school.kanban.repo.CommentRepository;
import com.school.kanban.repo.TagRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

// Business logic for boards and their memberships.
@ApplicationScoped
public class BoardService {

  private static final Logger LOG = Logger.getLogger(BoardService.class);

  @Inject BoardRepository boards;
  @Inject BoardMemberRepository members;
  @Inject ColumnRepository columns;
  @Inject CardRepository cards;
  @Inject CommentRepository comments;
  @Inject TagRepository tags;
  @Inject AppUserRepository users;
  @Inject PermissionService perms;

  static BoardDto toDto(Board b, BoardRole role) {
    BoardDto d = new BoardDto();
    fill(d, b, role);
    return d;
  }

  private static void fill(BoardDto d, Board b, BoardRole role) {
    d.id = b.id;
    d.title = b.title;
    d.description = b.description;
    d.ownerUserId = b.ownerUserId;
    d.role = role;
    d.createdAt = b.createdAt;
    d.updatedAt = b.updatedAt;
  }

  private static MemberDto toMemberDto(BoardMember m, AppUser u) {
    MemberDto d = new MemberDto();
    d.userId = m.id.userId;
    d.role = m.role;
    d.createdAt = m.createdAt;
    if (u != null) {
      d.username = u.username;
      d.email = u.email;
    }
    return d;
  }

  @Transactional
  public BoardDto create(AppUser actor, String title, String description) {
    title = requireTitle(title);

    Board b = new Board();
    b.title = title;
    b.description = description;
    b.ownerUserId = actor.id;
    b.createdAt = Instant.now();
    b.updatedAt = b.createdAt;
    boards.persist(b);

    addMembership(b.id, actor.id, BoardRole.OWNER);
    LOG.infof("Board %d created by user %d", b.id, actor.id);
    return toDto(b, BoardRole.OWNER);
  }

  @Transactional
  // Retrieve boards the actor belongs to; elevated identities see every board.
  public List<BoardDto> list(AppUser actor) {
    List<Board> found = actor.superuser ? boards.listAllOrdered() : boards.listForMember(actor.id);
    return found.stream()
        .map(b -> toDto(b, perms.accessFor(b.id, actor).role()))
        .collect(Collectors.toList());
  }

  @Transactional
  public BoardDetailDto get(AppUser actor, Long boardId) {
    Board b = perms.requireRead(boardId, actor);

    BoardDetailDto d = new BoardDetailDto();
    fill(d, b, perms.accessFor(boardId, actor).role());
    for (BoardColumn col : columns.listForBoard(boardId)) {
      ColumnDto c = ColumnService.toDto(col);
      c.cards = cards.listForColumn(col.id).stream()
          .map(card -> CardService.toDto(card, boardId))
          .collect(Collectors.toList());
      d.columns.add(c);
    }
    d.tags = tags.listForBoard(boardId).stream().map(TagService::toDto).collect(Collectors.toList());
    return d;
  }

  @Transactional
  public BoardDto update(AppUser actor, Long boardId, String title, String description) {
    Board b = perms.requireModify(boardId, actor);
    if (title != null) b.title = requireTitle(title);
    if (description != null) b.description = description;
    b.updatedAt = Instant.now();
    return toDto(b, perms.accessFor(boardId, actor).role());
  }

  /**
   * Deletes the board with everything on it.
   * Only the owner (or an elevated identity) may do this.
   */
  @Transactional
  public void delete(AppUser actor, Long boardId) {
    Board b = perms.requireOwner(boardId, actor, "Only the board owner can delete the board");

    for (BoardColumn col : columns.listForBoard(boardId)) {
      ColumnService.deleteWithCards(col, cards, comments);
    }
    tags.deleteForBoard(boardId);
    members.deleteForBoard(boardId);
    boards.delete(b);
    LOG.infof("Board %d deleted by user %d", boardId, actor.id);
  }

  @Transactional
  public List<MemberDto> members(AppUser actor, Long boardId) {
    perms.requireRead(boardId, actor);
    return members.listForBoard(boardId).stream()
        .map(m -> toMemberDto(m, users.findById(m.id.userId)))
        .collect(Collectors.toList());
  }

  @Transactional
  public MemberDto addMember(AppUser actor, Long boardId, Long userId, String email, BoardRole role) {
    perms.requireOwner(boardId, actor, "Only the board owner can add users to the board");

    AppUser target;
    if (userId != null) {
      target = users.findById(userId);
    } else if (email != null && !email.isBlank()) {
      target = users.findByEmail(email.trim());
    } else {
      throw new ServiceExceptions.BadRequestException("user_id or email required");
    }
    if (target == null) throw new ServiceExceptions.NotFoundException("User not found");

    if (role == null) role = BoardRole.MEMBER;
    if (role == BoardRole.OWNER) {
      throw new ServiceExceptions.BadRequestException("Use transfer-ownership to make a user the owner");
    }
    if (members.findMember(boardId, target.id) != null) {
      throw new ServiceExceptions.BadRequestException("User is already a member of this board");
    }

    BoardMember m = addMembership(boardId, target.id, role);
    LOG.infof("User %d added to board %d as %s", target.id, boardId, role);
    return toMemberDto(m, target);
  }

  @Transactional
  public void removeMember(AppUser actor, Long boardId, Long userId) {
    Board b = perms.requireOwner(boardId, actor, "Only the board owner can remove users from the board");
    if (userId == null) throw new ServiceExceptions.BadRequestException("user_id required");
    if (b.ownerUserId.equals(userId)) {
      throw new ServiceExceptions.BadRequestException("Owners cannot remove themselves. Transfer ownership first.");
    }

    BoardMember m = members.findMember(boardId, userId);
    if (m == null) throw new ServiceExceptions.NotFoundException("User is not a member of this board");
    dropMembership(m);
    LOG.infof("User %d removed from board %d", userId, boardId);
  }

  // A non-owner member removes themselves from the board.
  @Transactional
  public void leave(AppUser actor, Long boardId) {
    Board b = boards.findById(boardId);
    if (b == null) throw new ServiceExceptions.NotFoundException("Board not found");

    BoardMember m = members.findMember(boardId, actor.id);
    if (m == null) throw new ServiceExceptions.BadRequestException("You are not a member of this board");
    if (m.role == BoardRole.OWNER || b.ownerUserId.equals(actor.id)) {
      throw new ServiceExceptions.BadRequestException("Board owners cannot leave directly. Transfer ownership first.");
    }

    dropMembership(m);
    LOG.infof("User %d left board %d", actor.id, boardId);
  }

  // Deletes the membership row and unassigns the user from the board's cards.
  private void dropMembership(BoardMember m) {
    members.delete(m);
    Instant now = Instant.now();
    for (Card card : cards.listForBoard(m.id.boardId)) {
      if (card.assigneeIds.remove(m.id.userId)) card.updatedAt = now;
    }
  }

  /**
   * Changes a member's role.
   * - members cannot change roles
   * - admins cannot promote to owner, nor touch admins or the owner
   * - owners cannot demote themselves
   */
  @Transactional
  public MemberDto changeRole(AppUser actor, Long boardId, Long userId, BoardRole newRole) {
    perms.requireOwner(boardId, actor, "Only the board owner can change user roles");
    if (userId == null || newRole == null) {
      throw new ServiceExceptions.BadRequestException("user_id and role required");
    }

    PermissionService.Access acting = perms.accessFor(boardId, actor);
    BoardMember target = members.findMember(boardId, userId);
    if (target == null) throw new ServiceExceptions.BadRequestException("Target user is not a member of this board");

    checkEscalation(acting, actor.id, target, newRole);

    target.role = newRole;
    LOG.infof("User %d role on board %d changed to %s by user %d", userId, boardId, newRole, actor.id);
    return toMemberDto(target, users.findById(userId));
  }

  static void checkEscalation(PermissionService.Access acting, Long actorId, BoardMember target, BoardRole newRole) {
    switch (acting) {
      case NONE:
        throw new ServiceExceptions.ForbiddenException("You don't have access to this board");
      case MEMBER:
        throw new ServiceExceptions.BadRequestException("Members cannot change user roles");
      case ADMIN:
        if (newRole == BoardRole.OWNER) {
          throw new ServiceExceptions.BadRequestException("Admins can't promote users to Owner");
        }
        if (target.role == BoardRole.ADMIN || target.role == BoardRole.OWNER) {
          throw new ServiceExceptions.BadRequestException("Admins can't change the role of other admins or the owner");
        }
        break;
      case OWNER:
        if (target.id.userId.equals(actorId) && newRole != BoardRole.OWNER) {
          throw new ServiceExceptions.BadRequestException("Owners can't demote themselves");
        }
        break;
    }
  }

  // Previous owner stays on the board as ADMIN.
  @Transactional
  public void transferOwnership(AppUser actor, Long boardId, Long newOwnerId) {
    Board b = perms.requireOwner(boardId, actor, "Only the board owner can transfer ownership");
    if (newOwnerId == null) throw new ServiceExceptions.BadRequestException("new_owner_id required");
    if (b.ownerUserId.equals(newOwnerId)) {
      throw new ServiceExceptions.BadRequestException("User already owns this board");
    }
    if (users.findById(newOwnerId) == null) throw new ServiceExceptions.NotFoundException("User not found");

    Long previousOwner = b.ownerUserId;
    BoardMember next = members.findMember(boardId, newOwnerId);
    if (next == null) {
      addMembership(boardId, newOwnerId, BoardRole.OWNER);
    } else {
      next.role = BoardRole.OWNER;
    }

    BoardMember prev = members.findMember(boardId, previousOwner);
    if (prev == null) {
      addMembership(boardId, previousOwner, BoardRole.ADMIN);
    } else {
      prev.role = BoardRole.ADMIN;
    }

    b.ownerUserId = newOwnerId;
    b.updatedAt = Instant.now();
    LOG.infof("Board %d ownership transferred from user %d to user %d", boardId, previousOwner, newOwnerId);
  }

  private BoardMember addMembership(Long boardId, Long userId, BoardRole role) {
    BoardMember m = new BoardMember();
    m.id = new BoardMemberId(boardId, userId);
    m.role = role;
    m.createdAt = Instant.now();
    members.persist(m);
    return m;
  }

  private static String requireTitle(String title) {
    if (title == null || title.isBlank()) throw new ServiceExceptions.BadRequestException("title required");
    title = title.trim();
    if (title.length() > 255) throw new ServiceExceptions.BadRequestException("title must be at most 255 characters");
    return title;
  }
}
