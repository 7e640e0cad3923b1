package com.school.kanban.repo;

import com.school.kanban.model.BoardMember;
import com.school.kanban.model.BoardMemberId;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

// Database access for board member repository.
@ApplicationScoped
public class BoardMemberRepository implements PanacheRepositoryBase<BoardMember, BoardMemberId> {

  // Retrieve one membership row, or null.
  public BoardMember findMember(Long boardId, Long userId) {
    return findById(new BoardMemberId(boardId, userId));
  }

  public List<BoardMember> listForBoard(Long boardId) {
    return list("id.boardId = ?1 order by createdAt asc", boardId);
  }

  public long deleteForBoard(Long boardId) {
    return delete("id.boardId = ?1", boardId);
  }
}
