package com.school.kanban.api.dto;

import java.time.Instant;

// A null deadline clears it.
public class DeadlineRequest {
  public Instant deadline;
}
