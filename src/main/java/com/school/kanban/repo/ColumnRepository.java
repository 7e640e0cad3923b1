package com.school.kanban.repo;

import com.school.kanban.model.BoardColumn;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class ColumnRepository implements PanacheRepositoryBase<BoardColumn, Long> {

  public List<BoardColumn> listForBoard(Long boardId) {
    return list("boardId = ?1 order by position asc, id asc", boardId);
  }

  // Highest position in the board, or -1 when it has no columns.
  public int maxPosition(Long boardId) {
    Integer max = getEntityManager()
        .createQuery("select max(c.position) from BoardColumn c where c.boardId = :boardId", Integer.class)
        .setParameter("boardId", boardId)
        .getSingleResult();
    return max == null ? -1 : max;
  }
}
