package com.school.kanban.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

// Role of a member on a board. Lowercase on the wire, uppercase in the database.
public enum BoardRole {
  MEMBER,
  ADMIN,
  OWNER;

  public boolean canModify() {
    return this == ADMIN || this == OWNER;
  }

  @JsonValue
  public String wire() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static BoardRole fromWire(String value) {
    if (value == null) return null;
    try {
      return valueOf(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown role: " + value, e);
    }
  }
}
