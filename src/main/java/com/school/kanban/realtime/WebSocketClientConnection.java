package com.school.kanban.realtime;

import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.HandshakeRequest;
import io.quarkus.websockets.next.WebSocketConnection;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

// ClientConnection backed by a websockets-next connection.
public class WebSocketClientConnection implements ClientConnection {

  private final WebSocketConnection connection;

  public WebSocketClientConnection(WebSocketConnection connection) {
    this.connection = connection;
  }

  @Override
  public String id() {
    return connection.id();
  }

  @Override
  public String remoteAddress() {
    HandshakeRequest request = connection.handshakeRequest();
    return peerAddress(request.header("X-Forwarded-For"), request.header("X-Real-IP"),
        request.host(), request.port());
  }

  // First forwarded hop, then the proxy's real-ip header, then the host the upgrade was addressed to.
  static String peerAddress(String forwardedFor, String realIp, String host, int port) {
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) return first;
    }
    if (realIp != null && !realIp.isBlank()) return realIp.trim();
    if (host != null && !host.isBlank()) return port > 0 ? host + ":" + port : host;
    return "unknown";
  }

  @Override
  public void sendText(String text) {
    if (!connection.isOpen()) throw new IllegalStateException("connection " + connection.id() + " is closed");
    connection.sendTextAndAwait(text);
  }

  @Override
  public void close(int code, String reason) {
    if (connection.isClosed()) return;
    connection.closeAndAwait(new CloseReason(code, reason));
  }

  // Value of a query parameter of the upgrade request, or null.
  public String queryParam(String name) {
    String query = connection.handshakeRequest().query();
    if (query == null || query.isEmpty()) return null;
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
        return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  public String pathParam(String name) {
    return connection.pathParam(name);
  }
}
