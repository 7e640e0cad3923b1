package com.school.kanban.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.school.kanban.realtime.message.BoardEvent;
import com.school.kanban.realtime.message.EventValidator;
import com.school.kanban.realtime.message.InvalidEventException;
import com.school.kanban.realtime.message.ServerMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of live connections, board access grants and board subscriptions.
 *
 * <p>All three tables sit behind one lock. Socket writes never happen while holding it:
 * targets are snapshotted first and written afterwards, and connections whose write
 * fails are removed through the same path as {@link #disconnect}.
 *
 * <p>Known limitation: revoking access with {@link #setBoardAccess} does not remove an
 * existing subscription. Use {@link #evictFromBoard} for that.
 */
@ApplicationScoped
public class ConnectionManager {

  private static final Logger LOG = Logger.getLogger(ConnectionManager.class);

  private final Object lock = new Object();

  // user id -> live connections, in registration order
  private final Map<Long, Set<ClientConnection>> connections = new HashMap<>();
  // connection id -> owning user id
  private final Map<String, Long> owners = new HashMap<>();
  // board id -> user ids known to have access
  private final Map<Long, Set<Long>> boardAccess = new HashMap<>();
  // board id -> subscribed user ids
  private final Map<Long, Set<Long>> subscriptions = new HashMap<>();

  private final ObjectMapper mapper;

  @Inject
  public ConnectionManager(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public void connect(ClientConnection connection, long userId) {
    synchronized (lock) {
      Long previous = owners.put(connection.id(), userId);
      if (previous != null && previous != userId) removeLocked(connection, previous);
      connections.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(connection);
    }
    LOG.infof("User %d connected from %s (connection %s)", userId, connection.remoteAddress(), connection.id());
  }

  // Idempotent. Subscriptions are left alone.
  public void disconnect(ClientConnection connection, long userId) {
    boolean removed;
    synchronized (lock) {
      removed = removeLocked(connection, userId);
    }
    if (removed) LOG.infof("User %d disconnected (connection %s)", userId, connection.id());
  }

  private boolean removeLocked(ClientConnection connection, long userId) {
    Set<ClientConnection> set = connections.get(userId);
    if (set == null || !set.remove(connection)) return false;
    if (set.isEmpty()) connections.remove(userId);
    owners.remove(connection.id(), userId);
    return true;
  }

  public void setBoardAccess(long userId, long boardId, boolean hasAccess) {
    synchronized (lock) {
      if (hasAccess) {
        boardAccess.computeIfAbsent(boardId, k -> new LinkedHashSet<>()).add(userId);
      } else {
        removeFrom(boardAccess, boardId, userId);
      }
    }
  }

  public boolean checkBoardAccess(long userId, long boardId) {
    synchronized (lock) {
      Set<Long> users = boardAccess.get(boardId);
      return users != null && users.contains(userId);
    }
  }

  /**
   * Adds the user to the board's subscribers.
   *
   * @return false when the user is not in the board's access set
   */
  public boolean subscribeToBoard(long userId, long boardId) {
    synchronized (lock) {
      Set<Long> users = boardAccess.get(boardId);
      if (users == null || !users.contains(userId)) {
        LOG.warnf("User %d tried to subscribe to board %d without access", userId, boardId);
        return false;
      }
      subscriptions.computeIfAbsent(boardId, k -> new LinkedHashSet<>()).add(userId);
    }
    LOG.infof("User %d subscribed to board %d", userId, boardId);
    return true;
  }

  public void unsubscribeFromBoard(long userId, long boardId) {
    boolean removed;
    synchronized (lock) {
      removed = removeFrom(subscriptions, boardId, userId);
    }
    if (removed) LOG.infof("User %d unsubscribed from board %d", userId, boardId);
  }

  // Drops both the access grant and the subscription.
  public void evictFromBoard(long userId, long boardId) {
    synchronized (lock) {
      removeFrom(boardAccess, boardId, userId);
      removeFrom(subscriptions, boardId, userId);
    }
    LOG.infof("User %d evicted from board %d", userId, boardId);
  }

  public void evictBoard(long boardId) {
    synchronized (lock) {
      boardAccess.remove(boardId);
      subscriptions.remove(boardId);
    }
    LOG.infof("Board %d dropped from the subscription tables", boardId);
  }

  /**
   * Sends the event to every live connection of every subscriber of the board.
   * Invalid events are logged and dropped. A board without subscribers costs nothing.
   *
   * @return the number of connections the event was written to
   */
  public int broadcastToBoard(long boardId, BoardEvent event) {
    try {
      EventValidator.validate(event);
    } catch (InvalidEventException e) {
      LOG.errorf("Dropping %s event for board %d: %s", event.type().wire(), boardId, e.getMessage());
      return 0;
    }

    List<Long> targets;
    synchronized (lock) {
      Set<Long> users = subscriptions.get(boardId);
      if (users == null || users.isEmpty()) return 0;
      targets = new ArrayList<>(users);
    }

    String json;
    try {
      json = mapper.writeValueAsString(ServerMessage.of(event));
    } catch (JsonProcessingException e) {
      LOG.errorf(e, "Could not serialize %s event for board %d", event.type().wire(), boardId);
      return 0;
    }

    int delivered = 0;
    for (Long userId : targets) {
      delivered += sendToUser(userId, json);
    }
    LOG.infof("Broadcast %s to %d subscriber(s) of board %d (%d connection(s))",
        event.type().wire(), targets.size(), boardId, delivered);
    return delivered;
  }

  /**
   * Best-effort delivery to all of the user's connections. Connections that fail
   * are pruned after the attempt.
   *
   * @return the number of successful writes
   */
  public int sendToUser(long userId, String message) {
    List<ClientConnection> targets;
    synchronized (lock) {
      Set<ClientConnection> set = connections.get(userId);
      if (set == null || set.isEmpty()) return 0;
      targets = new ArrayList<>(set);
    }

    int delivered = 0;
    List<ClientConnection> dead = new ArrayList<>();
    for (ClientConnection c : targets) {
      try {
        c.sendText(message);
        delivered++;
      } catch (RuntimeException e) {
        LOG.errorf("Send to user %d on connection %s failed: %s", userId, c.id(), e.getMessage());
        dead.add(c);
      }
    }

    if (!dead.isEmpty()) {
      synchronized (lock) {
        for (ClientConnection c : dead) removeLocked(c, userId);
      }
      LOG.infof("Pruned %d dead connection(s) of user %d", dead.size(), userId);
    }
    return delivered;
  }

  public List<ClientConnection> connectionsOf(long userId) {
    synchronized (lock) {
      Set<ClientConnection> set = connections.get(userId);
      return set == null ? List.of() : List.copyOf(set);
    }
  }

  public Set<Long> subscribersOf(long boardId) {
    synchronized (lock) {
      Set<Long> users = subscriptions.get(boardId);
      return users == null ? Set.of() : Set.copyOf(users);
    }
  }

  public boolean isConnected(long userId) {
    synchronized (lock) {
      return connections.containsKey(userId);
    }
  }

  private static boolean removeFrom(Map<Long, Set<Long>> table, long boardId, long userId) {
    Set<Long> users = table.get(boardId);
    if (users == null || !users.remove(userId)) return false;
    if (users.isEmpty()) table.remove(boardId);
    return true;
  }
}
