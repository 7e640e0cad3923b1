package com.school.kanban.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

@Entity
@Table(name = "tag")
public class Tag extends PanacheEntityBase {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  public Long id;

  @Column(name = "board_id", nullable = false)
  public Long boardId;

  @Column(name = "name", nullable = false, length = 50)
  public String name;

  @Column(name = "color", length = 7)
  public String color;
}
