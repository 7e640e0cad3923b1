package com.school.kanban.api;

import com.school.kanban.api.dto.*;
import com.school.kanban.model.AppUser;
import com.school.kanban.realtime.BoardEventDispatcher;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.BoardService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/v1/boards")
@Produces(MediaType.APPLICATION_JSON)
public class BoardResource {

  @Inject AuthService auth;
  @Inject BoardService boards;
  @Inject BoardEventDispatcher events;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(BoardRequest req) {
    if (req == null) throw new BadRequestException("body required");
    AppUser me = auth.upsertCurrentUser();
    BoardDto board = boards.create(me, req.title, req.description);
    return Response.status(Response.Status.CREATED).entity(board).build();
  }

  @GET
  public List<BoardDto> list() {
    return boards.list(auth.upsertCurrentUser());
  }

  @GET
  @Path("/{boardId}")
  public BoardDetailDto get(@PathParam("boardId") Long boardId) {
    return boards.get(auth.upsertCurrentUser(), boardId);
  }

  @PUT
  @Path("/{boardId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public BoardDto update(@PathParam("boardId") Long boardId, BoardRequest req) {
    if (req == null) throw new BadRequestException("body required");
    BoardDto board = boards.update(auth.upsertCurrentUser(), boardId, req.title, req.description);
    events.boardUpdated(boardId, board);
    return board;
  }

  @DELETE
  @Path("/{boardId}")
  public Response delete(@PathParam("boardId") Long boardId) {
    boards.delete(auth.upsertCurrentUser(), boardId);
    events.boardDeleted(boardId);
    return Response.noContent().build();
  }
}
