package io.b2mash.taskboard.task;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubtaskRepository extends JpaRepository<Subtask, Long> {

  List<Subtask> findAllByOrderByIdAsc();

  List<Subtask> findByTaskIdOrderBySortOrderAscIdAsc(Long taskId);

  List<Subtask> findByTaskIdInOrderBySortOrderAscIdAsc(Collection<Long> taskIds);

  @Query("SELECT COALESCE(MAX(s.sortOrder), -1) FROM Subtask s WHERE s.taskId = :taskId")
  int findMaxSortOrder(@Param("taskId") Long taskId);

  @Modifying
  @Query("DELETE FROM Subtask s WHERE s.taskId = :taskId")
  void deleteByTaskId(@Param("taskId") Long taskId);
}
