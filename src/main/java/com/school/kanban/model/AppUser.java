package com.school.kanban.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "app_user")
public class AppUser extends PanacheEntityBase {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  public Long id;

  // Subject claim of the identity provider token.
  @Column(name = "subject", nullable = false, unique = true)
  public String subject;

  @Column(name = "username", unique = true)
  public String username;

  @Column(name = "email")
  public String email;

  @Column(name = "superuser", nullable = false)
  public boolean superuser;

  @Column(name = "active", nullable = false)
  public boolean active = true;

  @Column(name = "created_at", nullable = false)
  public Instant createdAt;
}
