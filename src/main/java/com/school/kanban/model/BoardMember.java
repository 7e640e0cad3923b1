package com.school.kanban.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "board_member")
public class BoardMember extends PanacheEntityBase {
  @EmbeddedId
  public BoardMemberId id;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false)
  public BoardRole role;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;
}
