package io.b2mash.taskboard.task;

import io.b2mash.taskboard.exception.FieldValidationException;
import io.b2mash.taskboard.exception.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubtaskService {

  private static final Logger log = LoggerFactory.getLogger(SubtaskService.class);

  private final SubtaskRepository subtaskRepository;
  private final TaskRepository taskRepository;

  public SubtaskService(SubtaskRepository subtaskRepository, TaskRepository taskRepository) {
    this.subtaskRepository = subtaskRepository;
    this.taskRepository = taskRepository;
  }

  @Transactional(readOnly = true)
  public List<Subtask> listSubtasks(Long taskId) {
    if (taskId == null) {
      return subtaskRepository.findAllByOrderByIdAsc();
    }
    return subtaskRepository.findByTaskIdOrderBySortOrderAscIdAsc(taskId);
  }

  @Transactional(readOnly = true)
  public Subtask getSubtask(Long id) {
    return subtaskRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Subtask", id));
  }

  /** Appends a subtask after the task's current last subtask. */
  @Transactional
  public Subtask createSubtask(Long taskId, String title, boolean completed) {
    if (!taskRepository.existsById(taskId)) {
      throw new FieldValidationException("task_id", "Task " + taskId + " does not exist");
    }
    int sortOrder = subtaskRepository.findMaxSortOrder(taskId) + 1;
    var subtask = subtaskRepository.save(new Subtask(taskId, title, completed, sortOrder));
    log.info("Added subtask {} to task {}", subtask.getId(), taskId);
    return subtask;
  }

  /** Updates title and/or completion; null arguments keep the stored value. */
  @Transactional
  public Subtask updateSubtask(Long id, String title, Boolean completed) {
    var subtask = getSubtask(id);
    subtask.update(
        title != null ? title : subtask.getTitle(),
        completed != null ? completed : subtask.isCompleted(),
        subtask.getSortOrder());
    subtask = subtaskRepository.save(subtask);
    log.info("Updated subtask {}", id);
    return subtask;
  }

  @Transactional
  public void deleteSubtask(Long id) {
    var subtask = getSubtask(id);
    subtaskRepository.delete(subtask);
    log.info("Deleted subtask {} from task {}", id, subtask.getTaskId());
  }
}
