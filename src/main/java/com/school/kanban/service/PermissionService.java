package com.school.kanban.service;

import com.school.kanban.model.AppUser;
import com.school.kanban.model.Board;
import com.school.kanban.model.BoardMember;
import com.school.kanban.model.BoardRole;
import com.school.kanban.repo.BoardMemberRepository;
import com.school.kanban.repo.BoardRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class PermissionService {

  @Inject BoardRepository boards;
  @Inject BoardMemberRepository members;

  public enum Access {
    NONE,
    MEMBER,
    ADMIN,
    OWNER;

    public boolean canRead() { return this != NONE; }
    public boolean canModify() { return this == ADMIN || this == OWNER; }

    public static Access of(BoardRole role) {
      return role == null ? NONE : Access.valueOf(role.name());
    }

    public BoardRole role() {
      return this == NONE ? null : BoardRole.valueOf(name());
    }
  }

  /**
   * Effective access of a user on a board.
   * - Elevated identities are OWNER on every existing board.
   * - Everyone else gets the role of their membership row, or NONE.
   */
  public Access accessFor(Long boardId, Long userId, boolean elevated) {
    Board board = boards.findById(boardId);
    if (board == null) return Access.NONE;
    if (elevated) return Access.OWNER;

    BoardMember m = members.findMember(boardId, userId);
    return m == null ? Access.NONE : Access.of(m.role);
  }

  public Access accessFor(Long boardId, AppUser user) {
    return accessFor(boardId, user.id, user.superuser);
  }

  // Board must exist and the user must hold any role on it.
  public Board requireRead(Long boardId, AppUser user) {
    Board board = requireBoard(boardId);
    if (!accessFor(boardId, user).canRead()) throw new ServiceExceptions.ForbiddenException("No access to this board");
    return board;
  }

  public Board requireModify(Long boardId, AppUser user) {
    Board board = requireBoard(boardId);
    Access access = accessFor(boardId, user);
    if (!access.canRead()) throw new ServiceExceptions.ForbiddenException("No access to this board");
    if (!access.canModify()) throw new ServiceExceptions.ForbiddenException("Need ADMIN or OWNER on this board");
    return board;
  }

  // Owner checks go against the board row, elevated identities pass.
  public Board requireOwner(Long boardId, AppUser user, String message) {
    Board board = requireBoard(boardId);
    if (user.superuser || board.ownerUserId.equals(user.id)) return board;
    throw new ServiceExceptions.ForbiddenException(message);
  }

  private Board requireBoard(Long boardId) {
    Board board = boards.findById(boardId);
    if (board == null) throw new ServiceExceptions.NotFoundException("Board not found");
    return board;
  }
}
