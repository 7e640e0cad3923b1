package com.school.kanban.api.dto;

import java.time.Instant;

public class CardRequest {
  public String title;
  public String description;
  public String color;
  public Integer position;
  public Instant deadline;
  public Boolean completed;
}
