package com.school.kanban.repo;

import com.school.kanban.model.Tag;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class TagRepository implements PanacheRepositoryBase<Tag, Long> {

  public List<Tag> listForBoard(Long boardId) {
    return list("boardId = ?1 order by name asc", boardId);
  }

  public long deleteForBoard(Long boardId) {
    return delete("boardId", boardId);
  }
}
