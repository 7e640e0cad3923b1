package com.school.kanban.repo;

import com.school.kanban.model.Card;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.List;

@ApplicationScoped
public class CardRepository implements PanacheRepositoryBase<Card, Long> {

  public List<Card> listForColumn(Long columnId) {
    return list("columnId = ?1 order by position asc, id asc", columnId);
  }

  public List<Card> listForBoard(Long boardId) {
    return getEntityManager()
        .createQuery(
            "select c from Card c where c.columnId in " +
            "(select col.id from BoardColumn col where col.boardId = :boardId) " +
            "order by c.position asc, c.id asc", Card.class)
        .setParameter("boardId", boardId)
        .getResultList();
  }

  public List<Card> listTaggedWith(Long tagId) {
    return getEntityManager()
        .createQuery("select c from Card c where :tagId member of c.tagIds", Card.class)
        .setParameter("tagId", tagId)
        .getResultList();
  }

  // Highest position in the column, or -1 when it is empty.
  public int maxPosition(Long columnId) {
    Integer max = getEntityManager()
        .createQuery("select max(c.position) from Card c where c.columnId = :columnId", Integer.class)
        .setParameter("columnId", columnId)
        .getSingleResult();
    return max == null ? -1 : max;
  }

  // Opens a gap at the given position.
  public int shiftDown(Long columnId, int fromPosition, Instant now) {
    return update("position = position + 1, updatedAt = ?3 where columnId = ?1 and position >= ?2",
        columnId, fromPosition, now);
  }

  // Closes the gap left behind at the given position.
  public int compactAfter(Long columnId, int position, Instant now) {
    return update("position = position - 1, updatedAt = ?3 where columnId = ?1 and position > ?2",
        columnId, position, now);
  }
}
