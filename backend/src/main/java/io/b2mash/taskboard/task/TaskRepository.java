package io.b2mash.taskboard.task;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface TaskRepository extends JpaRepository<Task, Long> {

  List<Task> findAllByOrderByIdAsc();

  List<Task> findByBoardCategoryOrderByIdAsc(TaskStatus boardCategory);

  /**
   * Task counts grouped by status. Returns Object[] rows with [0]={@link TaskStatus},
   * [1]=count. Statuses without tasks are absent.
   */
  @Query("SELECT t.status, COUNT(t) FROM Task t GROUP BY t.status")
  List<Object[]> countGroupedByStatus();

  long countByPriority(TaskPriority priority);
}
