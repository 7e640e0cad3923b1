package com.school.kanban.api.dto;

import java.util.List;

public class CardOrderRequest {
  public List<Long> cardOrder;
}
