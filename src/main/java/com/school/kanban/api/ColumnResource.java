package com.school.kanban.api;

import com.school.kanban.api.dto.*;
import com.school.kanban.realtime.BoardEventDispatcher;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.ColumnService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/v1/boards/{boardId}/columns")
@Produces(MediaType.APPLICATION_JSON)
public class ColumnResource {

  @Inject AuthService auth;
  @Inject ColumnService columns;
  @Inject BoardEventDispatcher events;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(@PathParam("boardId") Long boardId, ColumnRequest req) {
    if (req == null) throw new BadRequestException("body required");
    ColumnDto column = columns.create(auth.upsertCurrentUser(), boardId, req.title, req.position);
    events.columnCreated(boardId, column);
    return Response.status(Response.Status.CREATED).entity(column).build();
  }

  @GET
  public List<ColumnDto> list(@PathParam("boardId") Long boardId) {
    return columns.list(auth.upsertCurrentUser(), boardId);
  }

  @PUT
  @Path("/reorder")
  @Consumes(MediaType.APPLICATION_JSON)
  public List<ColumnDto> reorder(@PathParam("boardId") Long boardId, ColumnOrderRequest req) {
    if (req == null) throw new BadRequestException("body required");
    List<ColumnDto> ordered = columns.reorder(auth.upsertCurrentUser(), boardId, req.columnOrder);
    events.columnsReordered(boardId, ordered);
    return ordered;
  }

  @GET
  @Path("/{columnId}")
  public ColumnDto get(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId) {
    return columns.get(auth.upsertCurrentUser(), boardId, columnId);
  }

  @PUT
  @Path("/{columnId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public ColumnDto update(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId, ColumnRequest req) {
    if (req == null) throw new BadRequestException("body required");
    ColumnDto column = columns.update(auth.upsertCurrentUser(), boardId, columnId, req.title, req.position);
    events.columnUpdated(boardId, column);
    return column;
  }

  @DELETE
  @Path("/{columnId}")
  public Response delete(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId) {
    columns.delete(auth.upsertCurrentUser(), boardId, columnId);
    events.columnDeleted(boardId, columnId);
    return Response.noContent().build();
  }
}
