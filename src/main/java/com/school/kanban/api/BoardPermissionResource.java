package com.school.kanban.api;

import com.school.kanban.api.dto.*;
import com.school.kanban.model.AppUser;
import com.school.kanban.model.BoardRole;
import com.school.kanban.realtime.BoardEventDispatcher;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.BoardService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

// Membership and role management of one board.
@Path("/api/v1/boards/{boardId}/permissions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BoardPermissionResource {

  @Inject AuthService auth;
  @Inject BoardService boards;
  @Inject BoardEventDispatcher events;

  @GET
  @Path("/members")
  public List<MemberDto> members(@PathParam("boardId") Long boardId) {
    return boards.members(auth.upsertCurrentUser(), boardId);
  }

  @POST
  @Path("/add-user")
  public MemberDto addUser(@PathParam("boardId") Long boardId, AddMemberRequest req) {
    if (req == null || req.userId == null) throw new BadRequestException("user_id required");
    return add(boardId, req.userId, null, req.role);
  }

  @POST
  @Path("/add-user-by-email")
  public MemberDto addUserByEmail(@PathParam("boardId") Long boardId, AddMemberRequest req) {
    if (req == null || req.email == null || req.email.isBlank()) throw new BadRequestException("email required");
    return add(boardId, null, req.email, req.role);
  }

  private MemberDto add(Long boardId, Long userId, String email, BoardRole role) {
    MemberDto member = boards.addMember(auth.upsertCurrentUser(), boardId, userId, email, role);
    UserDto user = new UserDto();
    user.id = member.userId;
    user.username = member.username;
    user.email = member.email;
    events.userAdded(boardId, user);
    return member;
  }

  @POST
  @Path("/remove-user")
  public MessageResponse removeUser(@PathParam("boardId") Long boardId, RemoveMemberRequest req) {
    if (req == null || req.userId == null) throw new BadRequestException("user_id required");
    boards.removeMember(auth.upsertCurrentUser(), boardId, req.userId);
    events.userRemoved(boardId, req.userId);
    return new MessageResponse("User removed from board");
  }

  @POST
  @Path("/leave")
  public MessageResponse leave(@PathParam("boardId") Long boardId) {
    AppUser me = auth.upsertCurrentUser();
    boards.leave(me, boardId);
    events.userRemoved(boardId, me.id);
    return new MessageResponse("You have successfully left the board");
  }

  @POST
  @Path("/change-role")
  public MemberDto changeRole(@PathParam("boardId") Long boardId, ChangeRoleRequest req) {
    if (req == null) throw new BadRequestException("body required");
    MemberDto member = boards.changeRole(auth.upsertCurrentUser(), boardId, req.userId, req.role);
    events.userRoleChanged(boardId, member.userId, member.role);
    return member;
  }

  @POST
  @Path("/transfer-ownership")
  public MessageResponse transferOwnership(@PathParam("boardId") Long boardId, TransferOwnershipRequest req) {
    if (req == null || req.newOwnerId == null) throw new BadRequestException("new_owner_id required");
    boards.transferOwnership(auth.upsertCurrentUser(), boardId, req.newOwnerId);
    events.userRoleChanged(boardId, req.newOwnerId, BoardRole.OWNER);
    return new MessageResponse("Ownership transferred successfully");
  }
}
