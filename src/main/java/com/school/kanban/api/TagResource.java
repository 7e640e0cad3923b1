package com.school.kanban.api;

import com.school.kanban.api.dto.TagDto;
import com.school.kanban.api.dto.TagRequest;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.TagService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/v1/boards/{boardId}/tags")
@Produces(MediaType.APPLICATION_JSON)
public class TagResource {

  @Inject AuthService auth;
  @Inject TagService tags;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(@PathParam("boardId") Long boardId, TagRequest req) {
    if (req == null) throw new BadRequestException("body required");
    TagDto tag = tags.create(auth.upsertCurrentUser(), boardId, req.name, req.color);
    return Response.status(Response.Status.CREATED).entity(tag).build();
  }

  @GET
  public List<TagDto> list(@PathParam("boardId") Long boardId) {
    return tags.list(auth.upsertCurrentUser(), boardId);
  }

  @PUT
  @Path("/{tagId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public TagDto update(@PathParam("boardId") Long boardId, @PathParam("tagId") Long tagId, TagRequest req) {
    if (req == null) throw new BadRequestException("body required");
    return tags.update(auth.upsertCurrentUser(), boardId, tagId, req.name, req.color);
  }

  @DELETE
  @Path("/{tagId}")
  public Response delete(@PathParam("boardId") Long boardId, @PathParam("tagId") Long tagId) {
    tags.delete(auth.upsertCurrentUser(), boardId, tagId);
    return Response.noContent().build();
  }

  @POST
  @Path("/{tagId}/cards/{cardId}")
  public Response assign(@PathParam("boardId") Long boardId, @PathParam("tagId") Long tagId,
                         @PathParam("cardId") Long cardId) {
    tags.assignToCard(auth.upsertCurrentUser(), boardId, tagId, cardId);
    return Response.noContent().build();
  }

  @DELETE
  @Path("/{tagId}/cards/{cardId}")
  public Response unassign(@PathParam("boardId") Long boardId, @PathParam("tagId") Long tagId,
                           @PathParam("cardId") Long cardId) {
    tags.removeFromCard(auth.upsertCurrentUser(), boardId, tagId, cardId);
    return Response.noContent().build();
  }
}
