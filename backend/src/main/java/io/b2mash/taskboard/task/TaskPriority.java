package io.b2mash.taskboard.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
  LOW("low"),
  MEDIUM("medium"),
  URGENT("urgent");

  private final String value;

  TaskPriority(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TaskPriority fromValue(String value) {
    for (TaskPriority priority : values()) {
      if (priority.value.equals(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Priority must be one of: low, medium, urgent");
  }
}
