package io.b2mash.taskboard.dashboard;

import io.b2mash.taskboard.dashboard.dto.BoardOverview;
import io.b2mash.taskboard.dashboard.dto.TaskSummary;
import io.b2mash.taskboard.task.TaskPriority;
import io.b2mash.taskboard.task.TaskRepository;
import io.b2mash.taskboard.task.TaskStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only aggregations over the whole task collection. Nothing is cached. */
@Service
public class SummaryService {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final TaskRepository taskRepository;

  public SummaryService(TaskRepository taskRepository) {
    this.taskRepository = taskRepository;
  }

  @Transactional(readOnly = true)
  public TaskSummary getTaskSummary() {
    Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
    for (Object[] row : taskRepository.countGroupedByStatus()) {
      byStatus.put((TaskStatus) row[0], ((Number) row[1]).longValue());
    }
    long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
    long done = byStatus.getOrDefault(TaskStatus.DONE, 0L);
    long urgent = taskRepository.countByPriority(TaskPriority.URGENT);

    return new TaskSummary(
        byStatus.getOrDefault(TaskStatus.TO_DO, 0L),
        byStatus.getOrDefault(TaskStatus.IN_PROGRESS, 0L),
        byStatus.getOrDefault(TaskStatus.AWAIT_FEEDBACK, 0L),
        done,
        total,
        urgent,
        completedPercentage(done, total));
  }

  @Transactional(readOnly = true)
  public BoardOverview getBoardOverview() {
    var rows =
        taskRepository.findAllByOrderByIdAsc().stream().map(BoardOverview.Row::from).toList();
    return new BoardOverview(rows);
  }

  static double completedPercentage(long done, long total) {
    if (total == 0) {
      return 0;
    }
    return BigDecimal.valueOf(done)
        .multiply(HUNDRED)
        .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
