package com.school.kanban.api;

import com.school.kanban.service.ServiceExceptions;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

public class ExceptionMappers {

  public static class ErrorBody {
    public String error;
    public ErrorBody(String error) { this.error = error; }
  }

  static Response error(int status, String msg) {
    return Response.status(status).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(msg)).build();
  }

  @Provider
  public static class NotFoundMapper implements ExceptionMapper<ServiceExceptions.NotFoundException> {
    @Override
    public Response toResponse(ServiceExceptions.NotFoundException e) {
      String msg = e.getMessage();
      if (msg == null || msg.isBlank()) msg = "not_found";
      return error(404, msg);
    }
  }

  @Provider
  public static class ForbiddenMapper implements ExceptionMapper<ServiceExceptions.ForbiddenException> {
    @Override
    public Response toResponse(ServiceExceptions.ForbiddenException e) {
      return error(403, e.getMessage());
    }
  }

  @Provider
  public static class BadRequestMapper implements ExceptionMapper<ServiceExceptions.BadRequestException> {
    @Override
    public Response toResponse(ServiceExceptions.BadRequestException e) {
      return error(400, e.getMessage());
    }
  }

  @Provider
  public static class ConflictMapper implements ExceptionMapper<ServiceExceptions.ConflictException> {
    @Override
    public Response toResponse(ServiceExceptions.ConflictException e) {
      return error(409, e.getMessage());
    }
  }

  @Provider
  public static class UnauthorizedMapper implements ExceptionMapper<ServiceExceptions.UnauthorizedException> {
    @Override
    public Response toResponse(ServiceExceptions.UnauthorizedException e) {
      return error(401, e.getMessage());
    }
  }
}
