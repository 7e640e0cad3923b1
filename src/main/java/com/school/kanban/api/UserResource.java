package com.school.kanban.api;

import com.school.kanban.api.dto.MeResponse;
import com.school.kanban.api.dto.UpdateMeRequest;
import com.school.kanban.service.AuthService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

@Path("/api/v1/me")
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

  @Inject AuthService auth;

  @GET
  public MeResponse me() {
    return auth.me();
  }

  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  public MeResponse update(UpdateMeRequest req) {
    if (req == null) throw new BadRequestException("body required");
    return auth.updateMe(req.username, req.email);
  }
}
