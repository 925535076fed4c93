package io.b2mash.taskboard.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TaskStatusTest {

  @Test
  void fromValue_acceptsWireValues() {
    assertThat(TaskStatus.fromValue("to-do")).isEqualTo(TaskStatus.TO_DO);
    assertThat(TaskStatus.fromValue("in-progress")).isEqualTo(TaskStatus.IN_PROGRESS);
    assertThat(TaskStatus.fromValue("await-feedback")).isEqualTo(TaskStatus.AWAIT_FEEDBACK);
    assertThat(TaskStatus.fromValue("done")).isEqualTo(TaskStatus.DONE);
  }

  @Test
  void fromValue_rejectsConstantNames() {
    assertThatThrownBy(() -> TaskStatus.fromValue("TO_DO"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("to-do, in-progress, await-feedback, done");
  }

  @Test
  void priorityAndCategory_roundTripThroughWireValue() {
    for (TaskPriority priority : TaskPriority.values()) {
      assertThat(TaskPriority.fromValue(priority.value())).isEqualTo(priority);
    }
    assertThat(TaskCategory.fromValue("user-story")).isEqualTo(TaskCategory.USER_STORY);
    assertThatThrownBy(() -> TaskPriority.fromValue("critical"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
