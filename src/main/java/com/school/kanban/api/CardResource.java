package com.school.kanban.api;

import com.school.kanban.api.dto.*;
import com.school.kanban.model.AppUser;
import com.school.kanban.realtime.BoardEventDispatcher;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.CardService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/v1/boards/{boardId}/columns/{columnId}/cards")
@Produces(MediaType.APPLICATION_JSON)
public class CardResource {

  @Inject AuthService auth;
  @Inject CardService cards;
  @Inject BoardEventDispatcher events;

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId, CardRequest req) {
    CardDto card = cards.create(auth.upsertCurrentUser(), boardId, columnId, req);
    events.cardCreated(boardId, card);
    return Response.status(Response.Status.CREATED).entity(card).build();
  }

  @GET
  public List<CardDto> list(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId) {
    return cards.list(auth.upsertCurrentUser(), boardId, columnId);
  }

  @PUT
  @Path("/reorder")
  @Consumes(MediaType.APPLICATION_JSON)
  public List<CardDto> reorder(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                               CardOrderRequest req) {
    if (req == null) throw new BadRequestException("body required");
    List<CardDto> ordered = cards.reorder(auth.upsertCurrentUser(), boardId, columnId, req.cardOrder);
    for (CardDto card : ordered) events.cardUpdated(boardId, card);
    return ordered;
  }

  @GET
  @Path("/{cardId}")
  public CardDto get(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                     @PathParam("cardId") Long cardId) {
    return cards.get(auth.upsertCurrentUser(), boardId, columnId, cardId);
  }

  @PUT
  @Path("/{cardId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public CardDto update(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                        @PathParam("cardId") Long cardId, CardRequest req) {
    CardDto card = cards.update(auth.upsertCurrentUser(), boardId, columnId, cardId, req);
    events.cardUpdated(boardId, card);
    return card;
  }

  @DELETE
  @Path("/{cardId}")
  public Response delete(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                         @PathParam("cardId") Long cardId) {
    cards.delete(auth.upsertCurrentUser(), boardId, columnId, cardId);
    events.cardDeleted(boardId, cardId);
    return Response.noContent().build();
  }

  @PUT
  @Path("/{cardId}/move")
  @Consumes(MediaType.APPLICATION_JSON)
  public CardDto move(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                      @PathParam("cardId") Long cardId, MoveCardRequest req) {
    if (req == null) throw new BadRequestException("body required");
    CardService.MoveResult moved = cards.move(auth.upsertCurrentUser(), boardId, columnId, cardId, req.columnId, req.position);
    events.cardMoved(boardId, moved.card(), moved.fromColumnId(), moved.card().columnId);
    return moved.card();
  }

  @PUT
  @Path("/{cardId}/deadline")
  @Consumes(MediaType.APPLICATION_JSON)
  public CardDto deadline(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                          @PathParam("cardId") Long cardId, DeadlineRequest req) {
    if (req == null) throw new BadRequestException("body required");
    CardDto card = cards.setDeadline(auth.upsertCurrentUser(), boardId, columnId, cardId, req.deadline);
    if (card.deadline == null) {
      events.cardUpdated(boardId, card);
    } else {
      events.cardDeadlineUpdated(boardId, cardId, card.deadline);
    }
    return card;
  }

  @POST
  @Path("/{cardId}/toggle-completed")
  public CardDto toggleCompleted(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                                 @PathParam("cardId") Long cardId) {
    CardDto card = cards.toggleCompleted(auth.upsertCurrentUser(), boardId, columnId, cardId);
    events.cardUpdated(boardId, card);
    return card;
  }

  @POST
  @Path("/{cardId}/assign")
  @Consumes(MediaType.APPLICATION_JSON)
  public CardDto assign(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                        @PathParam("cardId") Long cardId, AssignRequest req) {
    if (req == null) throw new BadRequestException("body required");
    AppUser me = auth.upsertCurrentUser();
    CardDto card = cards.assign(me, boardId, columnId, cardId, req.userId);
    events.cardUpdated(boardId, card);
    return card;
  }

  @DELETE
  @Path("/{cardId}/assign/{userId}")
  public CardDto unassign(@PathParam("boardId") Long boardId, @PathParam("columnId") Long columnId,
                          @PathParam("cardId") Long cardId, @PathParam("userId") Long userId) {
    CardDto card = cards.unassign(auth.upsertCurrentUser(), boardId, columnId, cardId, userId);
    events.cardUpdated(boardId, card);
    return card;
  }
}
