package com.school.kanban.service;

// Domain failures raised by the services and mapped to HTTP statuses in the api layer.
public final class ServiceExceptions {

  private ServiceExceptions() {}

  public static class NotFoundException extends RuntimeException {
    public NotFoundException(String msg) { super(msg); }
  }

  public static class ForbiddenException extends RuntimeException {
    public ForbiddenException(String msg) { super(msg); }
  }

  public static class BadRequestException extends RuntimeException {
    public BadRequestException(String msg) { super(msg); }
  }

  public static class ConflictException extends RuntimeException {
    public ConflictException(String msg) { super(msg); }
  }

  public static class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String msg) { super(msg); }
  }
}
