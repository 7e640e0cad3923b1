package com.school.kanban.repo;

import com.school.kanban.model.Comment;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

// Database access for comment repository.
@ApplicationScoped
public class CommentRepository implements PanacheRepositoryBase<Comment, Long> {

  public List<Comment> listForCard(Long cardId) {
    return list("cardId = ?1 order by createdAt asc, id asc", cardId);
  }

  public long deleteForCard(Long cardId) {
    return delete("cardId", cardId);
  }
}
