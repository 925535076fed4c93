package io.b2mash.taskboard.task;

import io.b2mash.taskboard.contact.Contact;
import io.b2mash.taskboard.contact.ContactController.ContactResponse;
import io.b2mash.taskboard.task.SubtaskController.SubtaskResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  /** Matches any value with at least one non-whitespace character. */
  static final String NOT_BLANK_PATTERN = "(?s).*\\S.*";

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/tasks")
  public ResponseEntity<List<TaskResponse>> listTasks(
      @RequestParam(name = "board_category", required = false) String boardCategory) {
    return ResponseEntity.ok(toResponses(taskService.listTasks(boardCategory)));
  }

  @GetMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable Long id) {
    return ResponseEntity.ok(toResponse(taskService.getTask(id)));
  }

  @PostMapping("/api/tasks")
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody TaskRequest request) {
    var task =
        taskService.createTask(request.toFields(), request.contactIds(), request.subtasks());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(toResponse(task));
  }

  @PutMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> replaceTask(
      @PathVariable Long id, @Valid @RequestBody TaskRequest request) {
    var task =
        taskService.updateTask(id, request.toFields(), request.contactIds(), request.subtasks());
    return ResponseEntity.ok(toResponse(task));
  }

  @PatchMapping("/api/tasks/{id}")
  public ResponseEntity<TaskResponse> patchTask(
      @PathVariable Long id, @Valid @RequestBody TaskPatchRequest request) {
    var task =
        taskService.updateTask(id, request.toFields(), request.contactIds(), request.subtasks());
    return ResponseEntity.ok(toResponse(task));
  }

  @DeleteMapping("/api/tasks/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable Long id) {
    taskService.deleteTask(id);
    return ResponseEntity.noContent().build();
  }

  private TaskResponse toResponse(Task task) {
    return toResponses(List.of(task)).get(0);
  }

  private List<TaskResponse> toResponses(List<Task> tasks) {
    var taskIds = tasks.stream().map(Task::getId).toList();
    Map<Long, List<Contact>> contacts = taskService.getContactsBatch(taskIds);
    Map<Long, List<Subtask>> subtasks = taskService.getSubtasksBatch(taskIds);
    return tasks.stream()
        .map(
            t ->
                TaskResponse.from(
                    t,
                    contacts.getOrDefault(t.getId(), List.of()),
                    subtasks.getOrDefault(t.getId(), List.of())))
        .toList();
  }

  // --- DTOs ---

  /** Create and full-replace payload. */
  public record TaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      @NotNull(message = "due_date is required") LocalDate dueDate,
      @NotNull(message = "priority is required") TaskPriority priority,
      TaskStatus status,
      TaskStatus boardCategory,
      TaskCategory taskCategory,
      @Size(max = 255, message = "icon must be at most 255 characters") String icon,
      List<@NotNull(message = "contact id must not be null") Long> contactIds,
      List<@Valid SubtaskDescriptor> subtasks) {

    TaskFields toFields() {
      return new TaskFields(
          title, description, dueDate, priority, status, boardCategory, taskCategory, icon);
    }
  }

  /** Partial update payload; absent fields are left unchanged. */
  public record TaskPatchRequest(
      @Pattern(regexp = NOT_BLANK_PATTERN, message = "title must not be blank")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      LocalDate dueDate,
      TaskPriority priority,
      TaskStatus status,
      TaskStatus boardCategory,
      TaskCategory taskCategory,
      @Size(max = 255, message = "icon must be at most 255 characters") String icon,
      List<@NotNull(message = "contact id must not be null") Long> contactIds,
      List<@Valid SubtaskDescriptor> subtasks) {

    TaskFields toFields() {
      return new TaskFields(
          title, description, dueDate, priority, status, boardCategory, taskCategory, icon);
    }
  }

  public record TaskResponse(
      Long id,
      String title,
      String description,
      LocalDate dueDate,
      TaskPriority priority,
      TaskStatus status,
      TaskStatus boardCategory,
      TaskCategory taskCategory,
      String icon,
      List<Long> contactIds,
      List<ContactResponse> contacts,
      List<SubtaskResponse> subtasks,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task, List<Contact> contacts, List<Subtask> subtasks) {
      return new TaskResponse(
          task.getId(),
          task.getTitle(),
          task.getDescription(),
          task.getDueDate(),
          task.getPriority(),
          task.getStatus(),
          task.getBoardCategory(),
          task.getTaskCategory(),
          task.getIcon(),
          contacts.stream().map(Contact::getId).toList(),
          contacts.stream().map(ContactResponse::from).toList(),
          subtasks.stream().map(SubtaskResponse::from).toList(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }
}
