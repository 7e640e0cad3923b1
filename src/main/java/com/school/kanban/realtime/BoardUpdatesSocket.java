package com.school.kanban.realtime;

import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;

// Stream of one board, subscribed on connect. Only ping is accepted afterwards.
@WebSocket(path = "/api/v1/ws/board/{boardId}")
public class BoardUpdatesSocket {

  @Inject SocketSessionHandler handler;

  @OnOpen
  public void onOpen(WebSocketConnection connection) {
    WebSocketClientConnection client = new WebSocketClientConnection(connection);
    handler.openBoardScoped(client, client.queryParam("token"), client.pathParam("boardId"));
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
