package com.school.kanban.api;

import com.school.kanban.api.dto.AccountDto;
import com.school.kanban.api.dto.UpdateUserRequest;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.UserService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

// Account administration; the caller's own account or any account for superusers.
@Path("/api/v1/users")
@Produces(MediaType.APPLICATION_JSON)
public class AccountResource {

  @Inject AuthService auth;
  @Inject UserService accounts;

  @GET
  public List<AccountDto> list(@QueryParam("skip") @DefaultValue("0") int skip,
                               @QueryParam("limit") @DefaultValue("100") int limit) {
    return accounts.list(auth.upsertCurrentUser(), skip, limit);
  }

  @GET
  @Path("/{userId}")
  public AccountDto get(@PathParam("userId") Long userId) {
    return accounts.get(auth.upsertCurrentUser(), userId);
  }

  @PATCH
  @Path("/{userId}")
  @Consumes(MediaType.APPLICATION_JSON)
  public AccountDto update(@PathParam("userId") Long userId, UpdateUserRequest req) {
    if (req == null) throw new BadRequestException("body required");
    return accounts.update(auth.upsertCurrentUser(), userId, req.username, req.email, req.active);
  }

  @DELETE
  @Path("/{userId}")
  public Response deactivate(@PathParam("userId") Long userId) {
    accounts.deactivate(auth.upsertCurrentUser(), userId);
    return Response.noContent().build();
  }
}
