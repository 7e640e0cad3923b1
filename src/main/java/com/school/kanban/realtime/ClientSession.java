package com.school.kanban.realtime;

/**
 * Per-connection state of a socket session.
 * {@code boardId} is set only for board-scoped sessions.
 */
public class ClientSession {

  private final ClientConnection connection;
  private final Long boardId;
  private volatile SessionState state = SessionState.CONNECTING;
  private volatile AuthenticatedUser user;

  public ClientSession(ClientConnection connection, Long boardId) {
    this.connection = connection;
    this.boardId = boardId;
  }

  public ClientConnection connection() { return connection; }

  public Long boardId() { return boardId; }

  public boolean boardScoped() { return boardId != null; }

  public SessionState state() { return state; }

  public AuthenticatedUser user() { return user; }

  void authenticating() {
    state = SessionState.AUTHENTICATING;
  }

  void activate(AuthenticatedUser user) {
    this.user = user;
    state = SessionState.ACTIVE;
  }

  void closing() {
    state = SessionState.CLOSING;
  }

  void closed() {
    state = SessionState.CLOSED;
  }
}
