package com.school.kanban.api.dto;

import java.util.List;

public class ColumnOrderRequest {
  public List<Long> columnOrder;
}
