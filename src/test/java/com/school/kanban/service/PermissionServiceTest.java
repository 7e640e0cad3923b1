package com.school.kanban.service;

import com.school.kanban.model.AppUser;
import com.school.kanban.model.Board;
import com.school.kanban.model.BoardMember;
import com.school.kanban.model.BoardMemberId;
import com.school.kanban.model.BoardRole;
import com.school.kanban.repo.BoardMemberRepository;
import com.school.kanban.repo.BoardRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PermissionServiceTest {

  @Mock
  private BoardRepository boards;

  @Mock
  private BoardMemberRepository members;

  @InjectMocks
  private PermissionService perms;

  private static Board board(long id, long ownerId) {
    Board b = new Board();
    b.id = id;
    b.ownerUserId = ownerId;
    return b;
  }

  private static BoardMember member(long boardId, long userId, BoardRole role) {
    BoardMember m = new BoardMember();
    m.id = new BoardMemberId(boardId, userId);
    m.role = role;
    return m;
  }

  private static AppUser user(long id, boolean superuser) {
    AppUser u = new AppUser();
    u.id = id;
    u.superuser = superuser;
    return u;
  }

  @Test
  @DisplayName("a missing board grants nothing, even to elevated identities")
  void accessFor_missingBoard() {
    when(boards.findById(3L)).thenReturn(null);

    assertThat(perms.accessFor(3L, 7L, true)).isEqualTo(PermissionService.Access.NONE);
  }

  @Test
  @DisplayName("elevated identities are OWNER without a membership row")
  void accessFor_elevatedIsOwner() {
    when(boards.findById(3L)).thenReturn(board(3, 1));

    assertThat(perms.accessFor(3L, 7L, true)).isEqualTo(PermissionService.Access.OWNER);
    verify(members, never()).findMember(anyLong(), anyLong());
  }

  @Test
  @DisplayName("members get the role of their row")
  void accessFor_membershipRow() {
    when(boards.findById(3L)).thenReturn(board(3, 1));
    when(members.findMember(3L, 7L)).thenReturn(member(3, 7, BoardRole.ADMIN));

    assertThat(perms.accessFor(3L, 7L, false)).isEqualTo(PermissionService.Access.ADMIN);
  }

  @Test
  @DisplayName("users without a membership row get NONE")
  void accessFor_noRow() {
    when(boards.findById(3L)).thenReturn(board(3, 1));

    assertThat(perms.accessFor(3L, 8L, false)).isEqualTo(PermissionService.Access.NONE);
  }

  @Test
  @DisplayName("read and modify follow the role")
  void access_capabilities() {
    assertThat(PermissionService.Access.MEMBER.canRead()).isTrue();
    assertThat(PermissionService.Access.MEMBER.canModify()).isFalse();
    assertThat(PermissionService.Access.ADMIN.canModify()).isTrue();
    assertThat(PermissionService.Access.NONE.canRead()).isFalse();
    assertThat(PermissionService.Access.NONE.role()).isNull();
  }

  @Test
  @DisplayName("requireModify rejects plain members")
  void requireModify_rejectsMember() {
    when(boards.findById(3L)).thenReturn(board(3, 1));
    when(members.findMember(3L, 7L)).thenReturn(member(3, 7, BoardRole.MEMBER));

    assertThatThrownBy(() -> perms.requireModify(3L, user(7, false)))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class);
  }

  @Test
  @DisplayName("requireRead on a missing board is a 404")
  void requireRead_missingBoard() {
    when(boards.findById(3L)).thenReturn(null);

    assertThatThrownBy(() -> perms.requireRead(3L, user(7, false)))
        .isInstanceOf(ServiceExceptions.NotFoundException.class)
        .hasMessage("Board not found");
  }

  @Test
  @DisplayName("requireOwner passes the owner and elevated identities only")
  void requireOwner() {
    when(boards.findById(3L)).thenReturn(board(3, 1));

    assertThat(perms.requireOwner(3L, user(1, false), "nope").id).isEqualTo(3L);
    assertThat(perms.requireOwner(3L, user(9, true), "nope").id).isEqualTo(3L);
    assertThatThrownBy(() -> perms.requireOwner(3L, user(2, false), "Only the board owner can do that"))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class)
        .hasMessage("Only the board owner can do that");
  }
}
