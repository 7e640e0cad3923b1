package com.school.kanban.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.school.kanban.realtime.message.ServerMessage;
import com.school.kanban.service.PermissionService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message loop shared by the general and the board-scoped socket endpoints.
 *
 * <p>A session goes CONNECTING, AUTHENTICATING, ACTIVE, then CLOSING and CLOSED.
 * Failures stay on the connection that caused them.
 */
@ApplicationScoped
public class SocketSessionHandler {

  private static final Logger LOG = Logger.getLogger(SocketSessionHandler.class);

  static final int POLICY_VIOLATION = 1008;
  static final int INTERNAL_ERROR = 1011;

  // Client telemetry that is acknowledged and otherwise ignored.
  static final Set<String> ACKNOWLEDGED_EVENTS = Set.of("card_moved", "column_updated", "columns_reordered");

  private final ConnectionManager manager;
  private final IdentityVerifier identity;
  private final PermissionService perms;
  private final ObjectMapper mapper;

  private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();

  @Inject
  public SocketSessionHandler(ConnectionManager manager, IdentityVerifier identity,
                              PermissionService perms, ObjectMapper mapper) {
    this.manager = manager;
    this.identity = identity;
    this.perms = perms;
    this.mapper = mapper;
  }

  @ActivateRequestContext
  public void openGeneral(ClientConnection connection, String token) {
    ClientSession session = register(connection, null);
    AuthenticatedUser user = authenticate(session, token);
    if (user == null) return;

    try {
      session.activate(user);
      manager.connect(connection, user.userId());
      send(session, ServerMessage.ping("Connected to the updates stream"));
    } catch (RuntimeException e) {
      failOpen(session, e);
    }
  }

  /**
   * Opens a session bound to one board: the user is subscribed on success and the
   * connection is closed with a policy violation when they have no access.
   */
  @ActivateRequestContext
  public void openBoardScoped(ClientConnection connection, String token, String boardIdParam) {
    Long boardId = parseBoardId(boardIdParam);
    ClientSession session = register(connection, boardId);
    if (boardId == null) {
      LOG.warnf("Rejected board socket from %s: invalid board id '%s'", connection.remoteAddress(), boardIdParam);
      reject(session, ServerMessage.error("Invalid board id", 400), POLICY_VIOLATION, "Invalid board id");
      return;
    }

    AuthenticatedUser user = authenticate(session, token);
    if (user == null) return;

    try {
      PermissionService.Access access = perms.accessFor(boardId, user.userId(), user.elevated());
      if (!access.canRead()) {
        LOG.warnf("User %d denied access to board %d", user.userId(), boardId);
        reject(session, ServerMessage.error("Access denied to this board", 403), POLICY_VIOLATION, "Access denied");
        return;
      }

      session.activate(user);
      manager.connect(connection, user.userId());
      manager.setBoardAccess(user.userId(), boardId, true);
      manager.subscribeToBoard(user.userId(), boardId);
      send(session, ServerMessage.ping("Connected to board " + boardId + " updates stream"));
    } catch (RuntimeException e) {
      failOpen(session, e);
    }
  }

  @ActivateRequestContext
  public void onMessage(String connectionId, String text) {
    ClientSession session = sessions.get(connectionId);
    if (session == null || session.state() != SessionState.ACTIVE) {
      LOG.debugf("Ignoring message on inactive connection %s", connectionId);
      return;
    }

    try {
      handle(session, text);
    } catch (RuntimeException e) {
      long userId = session.user().userId();
      LOG.errorf(e, "Error processing message from user %d on connection %s", userId, connectionId);
      try {
        send(session, ServerMessage.error("Error: " + e.getMessage(), 500));
      } catch (RuntimeException sendFailure) {
        LOG.warnf("Could not report error to user %d: %s", userId, sendFailure.getMessage());
      }
      release(session);
      closeQuietly(session, INTERNAL_ERROR, "Internal error");
    }
  }

  // Client went away: unregister and, for a board socket, unsubscribe from its board.
  public void onClose(String connectionId) {
    ClientSession session = sessions.get(connectionId);
    if (session == null) return;
    release(session);
  }

  public ClientSession session(String connectionId) {
    return sessions.get(connectionId);
  }

  private void handle(ClientSession session, String text) {
    JsonNode root;
    try {
      root = mapper.readTree(text);
    } catch (JsonProcessingException e) {
      LOG.warnf("Invalid JSON from user %d: %s", session.user().userId(), e.getOriginalMessage());
      send(session, ServerMessage.error("Invalid JSON format", 400));
      return;
    }

    if (root != null && root.isObject() && root.hasNonNull("command")) {
      handleCommand(session, root.get("command").asText(), root.path("data"));
    } else if (root != null && root.isObject() && root.hasNonNull("event")) {
      handleClientEvent(session, root.get("event").asText());
    } else {
      LOG.warnf("Invalid message format from user %d", session.user().userId());
      send(session, ServerMessage.error("Invalid message format", 400));
    }
  }

  private void handleCommand(ClientSession session, String command, JsonNode data) {
    long userId = session.user().userId();
    LOG.debugf("Command '%s' from user %d", command, userId);

    if ("ping".equals(command)) {
      send(session, ServerMessage.pong());
      return;
    }
    if (!session.boardScoped() && "subscribe".equals(command)) {
      subscribe(session, data);
      return;
    }
    if (!session.boardScoped() && "unsubscribe".equals(command)) {
      Long boardId = boardIdOf(data);
      if (boardId == null) {
        send(session, ServerMessage.error("Missing board_id", 400));
        return;
      }
      manager.unsubscribeFromBoard(userId, boardId);
      send(session, ServerMessage.ping("Unsubscribed from board " + boardId));
      return;
    }

    LOG.warnf("Unknown command '%s' from user %d", command, userId);
    send(session, ServerMessage.error("Unknown command: " + command, 400));
  }

  // Access is re-checked against the permission service on every subscribe.
  private void subscribe(ClientSession session, JsonNode data) {
    AuthenticatedUser user = session.user();
    Long boardId = boardIdOf(data);
    if (boardId == null) {
      send(session, ServerMessage.error("Missing board_id", 400));
      return;
    }

    boolean allowed = perms.accessFor(boardId, user.userId(), user.elevated()).canRead();
    manager.setBoardAccess(user.userId(), boardId, allowed);
    if (!manager.subscribeToBoard(user.userId(), boardId)) {
      LOG.warnf("User %d denied subscription to board %d", user.userId(), boardId);
      send(session, ServerMessage.error("Access denied to this board", 403));
      return;
    }
    send(session, ServerMessage.ping("Subscribed to board " + boardId));
  }

  private void handleClientEvent(ClientSession session, String event) {
    long userId = session.user().userId();
    if (ACKNOWLEDGED_EVENTS.contains(event)) {
      LOG.infof("Client event '%s' from user %d", event, userId);
      send(session, ServerMessage.ping("Event received"));
      return;
    }
    LOG.warnf("Unknown client event '%s' from user %d", event, userId);
    send(session, ServerMessage.error("Unknown event: " + event, 400));
  }

  private ClientSession register(ClientConnection connection, Long boardId) {
    ClientSession session = new ClientSession(connection, boardId);
    sessions.put(connection.id(), session);
    return session;
  }

  // Null when authentication failed; the connection is then already closed.
  private AuthenticatedUser authenticate(ClientSession session, String token) {
    session.authenticating();
    try {
      return identity.verify(token);
    } catch (AuthenticationFailedException e) {
      LOG.warnf("Socket authentication failed from %s: %s", session.connection().remoteAddress(), e.getMessage());
      reject(session, ServerMessage.error("Authentication failed", 401), POLICY_VIOLATION, "Authentication failed");
      return null;
    } catch (RuntimeException e) {
      failOpen(session, e);
      return null;
    }
  }

  private void failOpen(ClientSession session, RuntimeException e) {
    LOG.errorf(e, "Unexpected error while opening connection %s", session.connection().id());
    release(session);
    reject(session, ServerMessage.error("Unexpected error: " + e.getMessage(), 500), INTERNAL_ERROR, "Internal error");
  }

  // Sends a final error and closes. Never throws.
  private void reject(ClientSession session, ServerMessage error, int closeCode, String reason) {
    session.closing();
    sessions.remove(session.connection().id(), session);
    try {
      send(session, error);
    } catch (RuntimeException e) {
      LOG.warnf("Could not deliver rejection to %s: %s", session.connection().id(), e.getMessage());
    }
    closeQuietly(session, closeCode, reason);
  }

  private void release(ClientSession session) {
    session.closing();
    sessions.remove(session.connection().id(), session);
    AuthenticatedUser user = session.user();
    if (user != null) {
      manager.disconnect(session.connection(), user.userId());
      if (session.boardScoped()) manager.unsubscribeFromBoard(user.userId(), session.boardId());
    }
    session.closed();
  }

  private void closeQuietly(ClientSession session, int code, String reason) {
    try {
      session.connection().close(code, reason);
    } catch (RuntimeException e) {
      LOG.debugf("Close of %s failed: %s", session.connection().id(), e.getMessage());
    }
    session.closed();
  }

  private void send(ClientSession session, ServerMessage message) {
    session.connection().sendText(toJson(message));
  }

  private String toJson(ServerMessage message) {
    try {
      return mapper.writeValueAsString(message);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize " + message.event(), e);
    }
  }

  private static Long boardIdOf(JsonNode data) {
    if (data == null) return null;
    JsonNode id = data.get("board_id");
    if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) return null;
    return id.asLong();
  }

  private static Long parseBoardId(String value) {
    if (value == null) return null;
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
