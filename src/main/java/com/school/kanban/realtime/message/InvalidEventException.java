package com.school.kanban.realtime.message;

// Raised when an outbound event's data lacks a key its type requires.
public class InvalidEventException extends RuntimeException {

  private final BoardEventType type;
  private final String missingField;

  public InvalidEventException(BoardEventType type, String missingField) {
    super("Missing required field '" + missingField + "' for event '" + type.wire() + "'");
    this.type = type;
    this.missingField = missingField;
  }

  public BoardEventType type() { return type; }

  public String missingField() { return missingField; }
}
