package com.school.kanban.realtime.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

// Outbound envelope: {"event": ..., "data": {...}}.
@JsonPropertyOrder({"event", "data"})
public record ServerMessage(String event, Map<String, Object> data) {

  public static ServerMessage of(BoardEvent e) {
    return new ServerMessage(e.type().wire(), e.data());
  }

  public static ServerMessage ping(String message) {
    return new ServerMessage(BoardEventType.PING.wire(), Map.of("message", message));
  }

  public static ServerMessage pong() {
    return new ServerMessage(BoardEventType.PONG.wire(), Map.of());
  }

  // Keeps message before code on the wire.
  public static ServerMessage error(String message, int code) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", message);
    data.put("code", code);
    return new ServerMessage(BoardEventType.ERROR.wire(), data);
  }
}
