package com.school.kanban.api.dto;

import java.util.ArrayList;
import java.util.List;

// Board with its ordered columns, each with its ordered cards.
public class BoardDetailDto extends BoardDto {
  public List<ColumnDto> columns = new ArrayList<>();
  public List<TagDto> tags = new ArrayList<>();
}
