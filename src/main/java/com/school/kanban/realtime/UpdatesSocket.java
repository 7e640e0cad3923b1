package com.school.kanban.realtime;

import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;

// General stream: the client subscribes to boards explicitly.
@WebSocket(path = "/api/v1/ws/updates")
public class UpdatesSocket {

  @Inject SocketSessionHandler handler;

  @OnOpen
  public void onOpen(WebSocketConnection connection) {
    WebSocketClientConnection client = new WebSocketClientConnection(connection);
    handler.openGeneral(client, client.queryParam("token"));
  }

  @OnTextMessage
  public void onMessage(String message, WebSocketConnection connection) {
    handler.onMessage(connection.id(), message);
  }

  @OnClose
  public void onClose(WebSocketConnection connection) {
    handler.onClose(connection.id());
  }
}
