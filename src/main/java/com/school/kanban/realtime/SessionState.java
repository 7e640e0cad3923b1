package com.school.kanban.realtime;

public enum SessionState {
  CONNECTING,
  AUTHENTICATING,
  ACTIVE,
  CLOSING,
  CLOSED
}
