package io.b2mash.taskboard.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * One entry of a task's requested subtask list. Without {@code id} a new subtask is created; with
 * {@code id} the existing subtask of the same task is updated in place.
 */
public record SubtaskDescriptor(
    Long id,
    @NotBlank(message = "title is required")
        @Size(max = 255, message = "title must be at most 255 characters")
        String title,
    Boolean completed) {

  public boolean completedOrDefault() {
    return Boolean.TRUE.equals(completed);
  }
}
