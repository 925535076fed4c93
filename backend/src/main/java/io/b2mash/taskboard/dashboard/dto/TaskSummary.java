package io.b2mash.taskboard.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate task counts.
 *
 * @param toDo number of tasks with status to-do
 * @param inProgress number of tasks with status in-progress
 * @param awaitFeedback number of tasks with status await-feedback
 * @param done number of tasks with status done
 * @param totalTasks total number of tasks
 * @param urgent number of tasks with urgent priority
 * @param completedPercentage done / total * 100, two decimals, 0 when there are no tasks
 */
public record TaskSummary(
    @JsonProperty("to-do") long toDo,
    @JsonProperty("in-progress") long inProgress,
    @JsonProperty("await-feedback") long awaitFeedback,
    @JsonProperty("done") long done,
    @JsonProperty("total-tasks") long totalTasks,
    @JsonProperty("urgent") long urgent,
    @JsonProperty("completed-percentage") double completedPercentage) {}
