package com.school.kanban.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "card")
public class Card extends PanacheEntityBase {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  public Long id;

  @Column(name = "column_id", nullable = false)
  public Long columnId;

  @Column(name = "title", nullable = false)
  public String title;

  @Column(name = "description", columnDefinition = "text")
  public String description;

  // #RRGGBB
  @Column(name = "color")
  public String color;

  @Column(name = "position", nullable = false)
  public int position;

  @Column(name = "completed", nullable = false)
  public boolean completed;

  @Column(name = "deadline")
  public Instant deadline;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "card_assignee", joinColumns = @JoinColumn(name = "card_id"))
  @Column(name = "user_id")
  public Set<Long> assigneeIds = new LinkedHashSet<>();

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "card_tag", joinColumns = @JoinColumn(name = "card_id"))
  @Column(name = "tag_id")
  public Set<Long> tagIds = new LinkedHashSet<>();

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  public Instant updatedAt;
}
