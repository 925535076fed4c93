package io.b2mash.taskboard.dashboard.dto;

import io.b2mash.taskboard.task.Task;
import io.b2mash.taskboard.task.TaskCategory;
import io.b2mash.taskboard.task.TaskPriority;
import io.b2mash.taskboard.task.TaskStatus;
import java.time.LocalDate;
import java.util.List;

/** Every task as a flat row, without contacts or subtasks. */
public record BoardOverview(List<Row> board) {

  public record Row(
      Long id,
      String title,
      String description,
      LocalDate dueDate,
      TaskPriority priority,
      TaskStatus status,
      TaskStatus boardCategory,
      TaskCategory taskCategory,
      String icon) {

    public static Row from(Task task) {
      return new Row(
          task.getId(),
          task.getTitle(),
          task.getDescription(),
          task.getDueDate(),
          task.getPriority(),
          task.getStatus(),
          task.getBoardCategory(),
          task.getTaskCategory(),
          task.getIcon());
    }
  }
}
