package com.school.kanban.realtime;

public class AuthenticationFailedException extends Exception {

  public AuthenticationFailedException(String message) {
    super(message);
  }

  public AuthenticationFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
