package com.school.kanban.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "card_comment")
public class Comment extends PanacheEntityBase {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  public Long id;

  @Column(name = "card_id", nullable = false)
  public Long cardId;

  @Column(name = "author_user_id", nullable = false)
  public Long authorUserId;

  @Column(name = "text", nullable = false, columnDefinition = "text")
  public String text;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  public Instant updatedAt;
}
