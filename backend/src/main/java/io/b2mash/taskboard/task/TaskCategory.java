package io.b2mash.taskboard.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskCategory {
  TECHNICAL_TASK("technical-task"),
  USER_STORY("user-story");

  private final String value;

  TaskCategory(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TaskCategory fromValue(String value) {
    for (TaskCategory category : values()) {
      if (category.value.equals(value)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Task category must be one of: technical-task, user-story");
  }
}
