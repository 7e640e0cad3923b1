package com.school.kanban.api;

import com.school.kanban.api.dto.CommentDto;
import com.school.kanban.api.dto.CommentRequest;
import com.school.kanban.realtime.BoardEventDispatcher;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.CommentService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/v1/boards/{boardId}/columns/{columnId}/cards/{cardId}/comments")
@Produces(MediaType.APPLICATION_JSON)
public class CommentResource {

  @Inject AuthService auth;
  @Inject CommentService comments;
  @Inject BoardEventDispatcher events;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response add(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                      @PathParam("cardId") Long cardId, CommentRequest req) {
    if (req == null) throw new BadRequestException("body required");
    CommentDto comment = comments.add(auth.upsertCurrentUser(), boardId, columnId, cardId, req.text);
    events.commentAdded(boardId, cardId, comment);
    return Response.status(Response.Status.CREATED).entity(comment).build();
  }

  @GET
  public List<CommentDto> list(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                               @PathParam("cardId") Long cardId) {
    return comments.list(auth.upsertCurrentUser(), boardId, columnId, cardId);
  }

  @PUT
  @Path("/{commentId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public CommentDto update(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                           @PathParam("cardId") Long cardId, @PathParam("commentId") Long commentId,
                           CommentRequest req) {
    if (req == null) throw new BadRequestException("body required");
    CommentDto comment = comments.update(auth.upsertCurrentUser(), boardId, columnId, cardId, commentId, req.text);
    events.commentUpdated(boardId, cardId, comment);
    return comment;
  }

  @DELETE
  @Path("/{commentId}")
  public Response delete(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                         @PathParam("cardId") Long cardId, @PathParam("commentId") Long commentId) {
    comments.delete(auth.upsertCurrentUser(), boardId, columnId, cardId, commentId);
    events.commentDeleted(boardId, cardId, commentId);
    return Response.noContent().build();
  }
}
