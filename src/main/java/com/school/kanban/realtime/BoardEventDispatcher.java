package com.school.kanban.realtime;

import com.school.kanban.api.dto.BoardDto;
import com.school.kanban.api.dto.CardDto;
import com.school.kanban.api.dto.ColumnDto;
import com.school.kanban.api.dto.CommentDto;
import com.school.kanban.api.dto.UserDto;
import com.school.kanban.config.KanbanConfig;
import com.school.kanban.model.BoardRole;
import com.school.kanban.realtime.message.BoardEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for REST handlers: one method per domain event.
 *
 * <p>Events are handed to a single fan-out thread and the call returns at once, so a
 * slow or failing broadcast never reaches the HTTP response. One thread keeps the
 * per-board order in which events were published.
 */
@ApplicationScoped
public class BoardEventDispatcher {

  private static final Logger LOG = Logger.getLogger(BoardEventDispatcher.class);

  private final ConnectionManager connections;
  private final boolean evictOnRevoke;
  private final Duration shutdownTimeout;
  private final Executor executor;

  @Inject
  public BoardEventDispatcher(ConnectionManager connections, KanbanConfig config) {
    this(connections, config.realtime().evictOnRevoke(), config.realtime().shutdownTimeout(),
        Executors.newSingleThreadExecutor(r -> {
          Thread t = new Thread(r, "kanban-fanout");
          t.setDaemon(true);
          return t;
        }));
  }

  BoardEventDispatcher(ConnectionManager connections, boolean evictOnRevoke, Duration shutdownTimeout, Executor executor) {
    this.connections = connections;
    this.evictOnRevoke = evictOnRevoke;
    this.shutdownTimeout = shutdownTimeout;
    this.executor = executor;
  }

  @PreDestroy
  void shutdown() {
    if (!(executor instanceof ExecutorService service)) return;
    service.shutdown();
    try {
      if (!service.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warnf("Fan-out executor did not drain within %s, %d task(s) dropped",
            shutdownTimeout, service.shutdownNow().size());
      }
    } catch (InterruptedException e) {
      service.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public void publish(long boardId, BoardEvent event) {
    submit(boardId, event, () -> connections.broadcastToBoard(boardId, event));
  }

  public void boardUpdated(long boardId, BoardDto board) {
    publish(boardId, new BoardEvent.BoardUpdated(boardId, board));
  }

  // Drops the board from the subscription tables once the event is out.
  public void boardDeleted(long boardId) {
    BoardEvent event = new BoardEvent.BoardDeleted(boardId);
    submit(boardId, event, () -> {
      connections.broadcastToBoard(boardId, event);
      if (evictOnRevoke) connections.evictBoard(boardId);
    });
  }

  public void columnCreated(long boardId, ColumnDto column) {
    publish(boardId, new BoardEvent.ColumnCreated(boardId, column));
  }

  public void columnUpdated(long boardId, ColumnDto column) {
    publish(boardId, new BoardEvent.ColumnUpdated(boardId, column));
  }

  public void columnDeleted(long boardId, long columnId) {
    publish(boardId, new BoardEvent.ColumnDeleted(boardId, columnId));
  }

  public void columnsReordered(long boardId, List<ColumnDto> columns) {
    publish(boardId, new BoardEvent.ColumnsReordered(boardId, columns));
  }

  public void cardCreated(long boardId, CardDto card) {
    publish(boardId, new BoardEvent.CardCreated(boardId, card));
  }

  public void cardUpdated(long boardId, CardDto card) {
    publish(boardId, new BoardEvent.CardUpdated(boardId, card));
  }

  public void cardDeleted(long boardId, long cardId) {
    publish(boardId, new BoardEvent.CardDeleted(boardId, cardId));
  }

  public void cardMoved(long boardId, CardDto card, Long fromColumnId, Long toColumnId) {
    publish(boardId, new BoardEvent.CardMoved(boardId, card, fromColumnId, toColumnId));
  }

  public void cardDeadlineUpdated(long boardId, long cardId, Instant deadline) {
    publish(boardId, new BoardEvent.CardDeadlineUpdated(boardId, cardId, deadline));
  }

  public void userAdded(long boardId, UserDto user) {
    publish(boardId, new BoardEvent.UserAdded(boardId, user));
  }

  // The removed user still receives this event, then loses access and subscription.
  public void userRemoved(long boardId, long userId) {
    BoardEvent event = new BoardEvent.UserRemoved(boardId, userId);
    submit(boardId, event, () -> {
      connections.broadcastToBoard(boardId, event);
      if (evictOnRevoke) connections.evictFromBoard(userId, boardId);
    });
  }

  public void userRoleChanged(long boardId, long userId, BoardRole role) {
    publish(boardId, new BoardEvent.UserRoleChanged(boardId, userId, role == null ? null : role.wire()));
  }

  public void commentAdded(long boardId, long cardId, CommentDto comment) {
    publish(boardId, new BoardEvent.CommentAdded(boardId, cardId, comment));
  }

  public void commentUpdated(long boardId, long cardId, CommentDto comment) {
    publish(boardId, new BoardEvent.CommentUpdated(boardId, cardId, comment));
  }

  public void commentDeleted(long boardId, long cardId, long commentId) {
    publish(boardId, new BoardEvent.CommentDeleted(boardId, cardId, commentId));
  }

  private void submit(long boardId, BoardEvent event, Runnable task) {
    try {
      executor.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException e) {
          LOG.errorf(e, "Fan-out of %s for board %d failed", event.type().wire(), boardId);
        }
      });
    } catch (RejectedExecutionException e) {
      LOG.warnf("Fan-out stopped, %s for board %d not sent", event.type().wire(), boardId);
    }
  }
}
