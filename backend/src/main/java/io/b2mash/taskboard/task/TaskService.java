package io.b2mash.taskboard.task;

import io.b2mash.taskboard.contact.Contact;
import io.b2mash.taskboard.contact.ContactRepository;
import io.b2mash.taskboard.exception.FieldValidationException;
import io.b2mash.taskboard.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final SubtaskRepository subtaskRepository;
  private final TaskAssignmentRepository taskAssignmentRepository;
  private final ContactRepository contactRepository;
  private final AssignmentReconciler assignmentReconciler;

  public TaskService(
      TaskRepository taskRepository,
      SubtaskRepository subtaskRepository,
      TaskAssignmentRepository taskAssignmentRepository,
      ContactRepository contactRepository,
      AssignmentReconciler assignmentReconciler) {
    this.taskRepository = taskRepository;
    this.subtaskRepository = subtaskRepository;
    this.taskAssignmentRepository = taskAssignmentRepository;
    this.contactRepository = contactRepository;
    this.assignmentReconciler = assignmentReconciler;
  }

  /**
   * Lists tasks ordered by id. When {@code boardCategory} is given (wire value such as {@code
   * to-do}) only tasks in that board column are returned.
   */
  @Transactional(readOnly = true)
  public List<Task> listTasks(String boardCategory) {
    if (boardCategory == null || boardCategory.isBlank()) {
      return taskRepository.findAllByOrderByIdAsc();
    }
    TaskStatus category;
    try {
      category = TaskStatus.fromValue(boardCategory);
    } catch (IllegalArgumentException e) {
      throw new FieldValidationException("board_category", e.getMessage());
    }
    return taskRepository.findByBoardCategoryOrderByIdAsc(category);
  }

  @Transactional(readOnly = true)
  public Task getTask(Long id) {
    return taskRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Task", id));
  }

  /**
   * Creates a task with its assignments and subtasks. Missing or empty {@code contactIds} and
   * {@code subtasks} create none.
   */
  @Transactional
  public Task createTask(
      TaskFields fields, List<Long> contactIds, List<SubtaskDescriptor> subtasks) {
    var task = new Task(fields.title(), fields.dueDate(), fields.priority());
    task.apply(fields);
    task = taskRepository.save(task);

    if (contactIds != null && !contactIds.isEmpty()) {
      assignmentReconciler.reconcileContacts(task.getId(), contactIds);
    }
    assignmentReconciler.reconcileSubtasks(task.getId(), subtasks);

    log.info("Created task {}", task.getId());
    return task;
  }

  /**
   * Updates a task. Null scalar fields are left unchanged. {@code contactIds == null} leaves the
   * assignments unchanged while an empty list clears them; a null or empty {@code subtasks} list
   * leaves the subtasks unchanged.
   */
  @Transactional
  public Task updateTask(
      Long id, TaskFields fields, List<Long> contactIds, List<SubtaskDescriptor> subtasks) {
    var task = getTask(id);
    task.apply(fields);
    task = taskRepository.save(task);

    if (contactIds != null) {
      assignmentReconciler.reconcileContacts(id, contactIds);
    }
    assignmentReconciler.reconcileSubtasks(id, subtasks);

    log.info("Updated task {}", id);
    return task;
  }

  /** Deletes a task together with its subtasks and contact assignments. */
  @Transactional
  public void deleteTask(Long id) {
    var task = getTask(id);
    subtaskRepository.deleteByTaskId(id);
    taskAssignmentRepository.deleteByTaskId(id);
    taskRepository.delete(task);
    log.info("Deleted task {}", id);
  }

  /**
   * Batch-loads the subtasks of several tasks in one query. Every requested id has an entry, empty
   * when the task has no subtasks.
   */
  @Transactional(readOnly = true)
  public Map<Long, List<Subtask>> getSubtasksBatch(Collection<Long> taskIds) {
    if (taskIds.isEmpty()) {
      return Map.of();
    }
    Map<Long, List<Subtask>> byTask =
        subtaskRepository.findByTaskIdInOrderBySortOrderAscIdAsc(taskIds).stream()
            .collect(Collectors.groupingBy(Subtask::getTaskId));
    taskIds.forEach(id -> byTask.putIfAbsent(id, List.of()));
    return byTask;
  }

  /**
   * Batch-loads the assigned contacts of several tasks in two queries. Contacts are ordered by id.
   */
  @Transactional(readOnly = true)
  public Map<Long, List<Contact>> getContactsBatch(Collection<Long> taskIds) {
    if (taskIds.isEmpty()) {
      return Map.of();
    }
    var assignments = taskAssignmentRepository.findByTaskIdIn(taskIds);
    var contactIds = assignments.stream().map(TaskAssignment::getContactId).distinct().toList();
    Map<Long, Contact> contactsById =
        contactRepository.findAllById(contactIds).stream()
            .collect(Collectors.toMap(Contact::getId, Function.identity()));

    Map<Long, List<Contact>> byTask =
        assignments.stream()
            .collect(
                Collectors.groupingBy(
                    TaskAssignment::getTaskId,
                    Collectors.collectingAndThen(
                        Collectors.toList(),
                        list ->
                            list.stream()
                                .map(a -> contactsById.get(a.getContactId()))
                                .filter(Objects::nonNull)
                                .sorted(Comparator.comparing(Contact::getId))
                                .toList())));
    taskIds.forEach(id -> byTask.putIfAbsent(id, List.of()));
    return byTask;
  }
}
