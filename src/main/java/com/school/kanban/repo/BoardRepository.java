package com.school.kanban.repo;

import com.school.kanban.model.Board;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class BoardRepository implements PanacheRepositoryBase<Board, Long> {

  public List<Board> listForMember(Long userId) {
    return getEntityManager()
        .createQuery(
            "select b from Board b where b.id in " +
            "(select m.id.boardId from BoardMember m where m.id.userId = :userId) " +
            "order by b.createdAt asc", Board.class)
        .setParameter("userId", userId)
        .getResultList();
  }

  public List<Board> listAllOrdered() {
    return list("order by createdAt asc");
  }
}
