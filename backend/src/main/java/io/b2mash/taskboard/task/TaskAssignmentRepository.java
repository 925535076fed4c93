package io.b2mash.taskboard.task;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskAssignmentRepository extends JpaRepository<TaskAssignment, Long> {

  List<TaskAssignment> findByTaskId(Long taskId);

  List<TaskAssignment> findByTaskIdIn(Collection<Long> taskIds);

  @Modifying
  @Query("DELETE FROM TaskAssignment a WHERE a.taskId = :taskId")
  void deleteByTaskId(@Param("taskId") Long taskId);

  @Modifying
  @Query("DELETE FROM TaskAssignment a WHERE a.contactId = :contactId")
  void deleteByContactId(@Param("contactId") Long contactId);
}
