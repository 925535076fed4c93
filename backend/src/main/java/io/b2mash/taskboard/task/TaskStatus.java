package io.b2mash.taskboard.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Workflow column of a task. Also used for the independent board category. */
public enum TaskStatus {
  TO_DO("to-do"),
  IN_PROGRESS("in-progress"),
  AWAIT_FEEDBACK("await-feedback"),
  DONE("done");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TaskStatus fromValue(String value) {
    for (TaskStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException(
        "Status must be one of: to-do, in-progress, await-feedback, done");
  }
}
