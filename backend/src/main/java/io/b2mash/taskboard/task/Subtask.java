package io.b2mash.taskboard.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "subtasks")
public class Subtask {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private Long taskId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subtask() {}

  public Subtask(Long taskId, String title, boolean completed, int sortOrder) {
    this.taskId = taskId;
    this.title = title;
    this.completed = completed;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Updates title, completion and position in one step. */
  public void update(String title, boolean completed, int sortOrder) {
    this.title = title;
    this.completed = completed;
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public String getTitle() {
    return title;
  }

  public boolean isCompleted() {
    return completed;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
