package com.school.kanban.service;

import com.school.kanban.model.AppUser;
import com.school.kanban.model.Board;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BoardServiceTest {

  @Mock private BoardRepository boards;
  @Mock private BoardMemberRepository members;
  @Mock private ColumnRepository columns;
  @Mock private CardRepository cards;
  @Mock private CommentRepository comments;
  @Mock private TagRepository tags;
  @Mock private AppUserRepository users;
  @Mock private PermissionService perms;

  @InjectMocks
  private BoardService service;

  private static BoardMember member(long boardId, long userId, BoardRole role) {
    BoardMember m = new BoardMember();
    m.id = new BoardMemberId(boardId, userId);
    m.role = role;
    return m;
  }

  private static AppUser user(long id) {
    AppUser u = new AppUser();
    u.id = id;
    u.username = "user" + id;
    return u;
  }

  private static Board board(long id, long ownerId) {
    Board b = new Board();
    b.id = id;
    b.ownerUserId = ownerId;
    return b;
  }

  // ========================================
  // ROLE ESCALATION RULES
  // ========================================

  @Test
  @DisplayName("members cannot change roles")
  void escalation_memberCannotChangeRoles() {
    assertThatThrownBy(() -> BoardService.checkEscalation(PermissionService.Access.MEMBER, 5L,
        member(1, 6, BoardRole.MEMBER), BoardRole.ADMIN))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("Members cannot change user roles");
  }

  @Test
  @DisplayName("admins cannot promote to owner nor touch admins")
  void escalation_adminLimits() {
    assertThatThrownBy(() -> BoardService.checkEscalation(PermissionService.Access.ADMIN, 5L,
        member(1, 6, BoardRole.MEMBER), BoardRole.OWNER))
        .hasMessage("Admins can't promote users to Owner");
    assertThatThrownBy(() -> BoardService.checkEscalation(PermissionService.Access.ADMIN, 5L,
        member(1, 6, BoardRole.ADMIN), BoardRole.MEMBER))
        .hasMessage("Admins can't change the role of other admins or the owner");
    assertThatCode(() -> BoardService.checkEscalation(PermissionService.Access.ADMIN, 5L,
        member(1, 6, BoardRole.MEMBER), BoardRole.ADMIN))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("owners cannot demote themselves")
  void escalation_ownerCannotDemoteSelf() {
    assertThatThrownBy(() -> BoardService.checkEscalation(PermissionService.Access.OWNER, 5L,
        member(1, 5, BoardRole.OWNER), BoardRole.ADMIN))
        .hasMessage("Owners can't demote themselves");
    assertThatCode(() -> BoardService.checkEscalation(PermissionService.Access.OWNER, 5L,
        member(1, 6, BoardRole.ADMIN), BoardRole.MEMBER))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("changeRole updates the target's role")
  void changeRole_updatesRole() {
    AppUser owner = user(5);
    BoardMember target = member(1, 6, BoardRole.MEMBER);
    when(perms.requireOwner(eq(1L), eq(owner), anyString())).thenReturn(board(1, 5));
    when(perms.accessFor(1L, owner)).thenReturn(PermissionService.Access.OWNER);
    when(members.findMember(1L, 6L)).thenReturn(target);
    when(users.findById(6L)).thenReturn(user(6));

    var dto = service.changeRole(owner, 1L, 6L, BoardRole.ADMIN);

    assertThat(target.role).isEqualTo(BoardRole.ADMIN);
    assertThat(dto.role).isEqualTo(BoardRole.ADMIN);
    assertThat(dto.username).isEqualTo("user6");
  }

  // ========================================
  // MEMBERSHIP
  // ========================================

  @Test
  @DisplayName("transferOwnership promotes the new owner and demotes the previous one to admin")
  void transferOwnership_swapsRoles() {
    AppUser owner = user(5);
    Board b = board(1, 5);
    BoardMember previous = member(1, 5, BoardRole.OWNER);
    BoardMember next = member(1, 6, BoardRole.MEMBER);
    when(perms.requireOwner(eq(1L), eq(owner), anyString())).thenReturn(b);
    when(users.findById(6L)).thenReturn(user(6));
    when(members.findMember(1L, 6L)).thenReturn(next);
    when(members.findMember(1L, 5L)).thenReturn(previous);

    service.transferOwnership(owner, 1L, 6L);

    assertThat(b.ownerUserId).isEqualTo(6L);
    assertThat(next.role).isEqualTo(BoardRole.OWNER);
    assertThat(previous.role).isEqualTo(BoardRole.ADMIN);
  }

  @Test
  @DisplayName("the owner cannot be removed from their board")
  void removeMember_rejectsOwner() {
    AppUser owner = user(5);
    when(perms.requireOwner(eq(1L), eq(owner), anyString())).thenReturn(board(1, 5));

    assertThatThrownBy(() -> service.removeMember(owner, 1L, 5L))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
    verify(members, never()).delete(any(BoardMember.class));
  }

  @Test
  @DisplayName("adding an existing member is rejected")
  void addMember_rejectsDuplicate() {
    AppUser owner = user(5);
    when(perms.requireOwner(eq(1L), eq(owner), anyString())).thenReturn(board(1, 5));
    when(users.findById(6L)).thenReturn(user(6));
    when(members.findMember(1L, 6L)).thenReturn(member(1, 6, BoardRole.MEMBER));

    assertThatThrownBy(() -> service.addMember(owner, 1L, 6L, null, BoardRole.ADMIN))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("User is already a member of this board");
  }

  @Test
  @DisplayName("owner role can only be handed over by transfer")
  void addMember_rejectsOwnerRole() {
    AppUser owner = user(5);
    when(perms.requireOwner(eq(1L), eq(owner), anyString())).thenReturn(board(1, 5));
    when(users.findById(6L)).thenReturn(user(6));

    assertThatThrownBy(() -> service.addMember(owner, 1L, 6L, null, BoardRole.OWNER))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
  }

  // ========================================
  // LEAVING A BOARD
  // ========================================

  @Test
  @DisplayName("a member leaving drops the membership and their card assignments")
  void leave_memberDropsMembership() {
    AppUser me = user(6);
    BoardMember mine = member(1, 6, BoardRole.MEMBER);
    Card assigned = new Card();
    assigned.assigneeIds.add(6L);
    assigned.assigneeIds.add(7L);
    when(boards.findById(1L)).thenReturn(board(1, 5));
    when(members.findMember(1L, 6L)).thenReturn(mine);
    when(cards.listForBoard(1L)).thenReturn(List.of(assigned));

    service.leave(me, 1L);

    verify(members).delete(mine);
    assertThat(assigned.assigneeIds).containsExactly(7L);
  }

  @Test
  @DisplayName("the owner must transfer ownership before leaving")
  void leave_rejectsOwner() {
    AppUser owner = user(5);
    when(boards.findById(1L)).thenReturn(board(1, 5));
    when(members.findMember(1L, 5L)).thenReturn(member(1, 5, BoardRole.OWNER));

    assertThatThrownBy(() -> service.leave(owner, 1L))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("Board owners cannot leave directly. Transfer ownership first.");
    verify(members, never()).delete(any(BoardMember.class));
  }

  @Test
  @DisplayName("a user who is not on the board cannot leave it")
  void leave_rejectsNonMember() {
    AppUser stranger = user(9);
    when(boards.findById(1L)).thenReturn(board(1, 5));
    when(members.findMember(1L, 9L)).thenReturn(null);

    assertThatThrownBy(() -> service.leave(stranger, 1L))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("You are not a member of this board");
    verify(cards, never()).listForBoard(anyLong());
  }

  @Test
  @DisplayName("leaving a missing board is a 404")
  void leave_missingBoard() {
    when(boards.findById(1L)).thenReturn(null);

    assertThatThrownBy(() -> service.leave(user(6), 1L))
        .isInstanceOf(ServiceExceptions.NotFoundException.class);
  }
}
