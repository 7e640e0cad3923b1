package com.school.kanban.repo;

import com.school.kanban.model.AppUser;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

// Database access for app user repository.
@ApplicationScoped
public class AppUserRepository implements PanacheRepositoryBase<AppUser, Long> {

  public AppUser findBySubject(String subject) {
    return find("subject", subject).firstResult();
  }

  public AppUser findByUsername(String username) {
    return find("username", username).firstResult();
  }

  public AppUser findByEmail(String email) {
    return find("lower(email) = lower(?1)", email).firstResult();
  }

  // Accounts ordered by id, offset based.
  public List<AppUser> listPage(int skip, int limit) {
    return findAll(Sort.by("id")).range(skip, skip + limit - 1).list();
  }
}
