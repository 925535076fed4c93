package io.b2mash.taskboard.task;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
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
public class SubtaskController {

  private final SubtaskService subtaskService;

  public SubtaskController(SubtaskService subtaskService) {
    this.subtaskService = subtaskService;
  }

  @GetMapping("/api/subtasks")
  public ResponseEntity<List<SubtaskResponse>> listSubtasks(
      @RequestParam(name = "task_id", required = false) Long taskId) {
    var subtasks =
        subtaskService.listSubtasks(taskId).stream().map(SubtaskResponse::from).toList();
    return ResponseEntity.ok(subtasks);
  }

  @GetMapping("/api/subtasks/{id}")
  public ResponseEntity<SubtaskResponse> getSubtask(@PathVariable Long id) {
    return ResponseEntity.ok(SubtaskResponse.from(subtaskService.getSubtask(id)));
  }

  @PostMapping("/api/subtasks")
  public ResponseEntity<SubtaskResponse> createSubtask(
      @Valid @RequestBody CreateSubtaskRequest request) {
    var subtask =
        subtaskService.createSubtask(
            request.taskId(), request.title(), Boolean.TRUE.equals(request.completed()));
    return ResponseEntity.created(URI.create("/api/subtasks/" + subtask.getId()))
        .body(SubtaskResponse.from(subtask));
  }

  @PutMapping("/api/subtasks/{id}")
  public ResponseEntity<SubtaskResponse> replaceSubtask(
      @PathVariable Long id, @Valid @RequestBody ReplaceSubtaskRequest request) {
    var subtask = subtaskService.updateSubtask(id, request.title(), request.completed());
    return ResponseEntity.ok(SubtaskResponse.from(subtask));
  }

  @PatchMapping("/api/subtasks/{id}")
  public ResponseEntity<SubtaskResponse> patchSubtask(
      @PathVariable Long id, @Valid @RequestBody PatchSubtaskRequest request) {
    var subtask = subtaskService.updateSubtask(id, request.title(), request.completed());
    return ResponseEntity.ok(SubtaskResponse.from(subtask));
  }

  @DeleteMapping("/api/subtasks/{id}")
  public ResponseEntity<Void> deleteSubtask(@PathVariable Long id) {
    subtaskService.deleteSubtask(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateSubtaskRequest(
      @NotNull(message = "task_id is required") Long taskId,
      @NotBlank(message = "title is required")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      Boolean completed) {}

  public record ReplaceSubtaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      @NotNull(message = "completed is required") Boolean completed) {}

  public record PatchSubtaskRequest(
      @Pattern(regexp = TaskController.NOT_BLANK_PATTERN, message = "title must not be blank")
          @Size(max = 255, message = "title must be at most 255 characters")
          String title,
      Boolean completed) {}

  public record SubtaskResponse(
      Long id,
      Long taskId,
      String title,
      boolean completed,
      int sortOrder,
      Instant createdAt,
      Instant updatedAt) {

    public static SubtaskResponse from(Subtask subtask) {
      return new SubtaskResponse(
          subtask.getId(),
          subtask.getTaskId(),
          subtask.getTitle(),
          subtask.isCompleted(),
          subtask.getSortOrder(),
          subtask.getCreatedAt(),
          subtask.getUpdatedAt());
    }
  }
}
