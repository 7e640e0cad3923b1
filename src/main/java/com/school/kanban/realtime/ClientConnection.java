package com.school.kanban.realtime;

/**
 * One live client socket as seen by the notification core.
 */
public interface ClientConnection {

  // Stable for the lifetime of the socket.
  String id();

  String remoteAddress();

  /**
   * Writes one text frame. Throws when the underlying transport is gone.
   */
  void sendText(String text);

  void close(int code, String reason);
}
