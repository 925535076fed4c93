package io.b2mash.taskboard.task;

import java.time.LocalDate;

/**
 * Scalar task fields carried from a request into {@link TaskService}. On update a {@code null}
 * component leaves the stored value unchanged.
 */
public record TaskFields(
    String title,
    String description,
    LocalDate dueDate,
    TaskPriority priority,
    TaskStatus status,
    TaskStatus boardCategory,
    TaskCategory taskCategory,
    String icon) {}
