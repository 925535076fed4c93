package io.b2mash.taskboard.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "tasks")
public class Task {

  public static final String DEFAULT_ICON = "/static/default.svg";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "description", length = 5000)
  private String description;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "board_category", nullable = false, length = 20)
  private TaskStatus boardCategory;

  @Enumerated(EnumType.STRING)
  @Column(name = "task_category", length = 20)
  private TaskCategory taskCategory;

  @Column(name = "icon", length = 255)
  private String icon;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(String title, LocalDate dueDate, TaskPriority priority) {
    this.title = title;
    this.dueDate = dueDate;
    this.priority = priority;
    this.status = TaskStatus.TO_DO;
    this.boardCategory = TaskStatus.TO_DO;
    this.icon = DEFAULT_ICON;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies every non-null field; null fields keep their current value. */
  public void apply(TaskFields fields) {
    if (fields.title() != null) {
      this.title = fields.title();
    }
    if (fields.description() != null) {
      this.description = fields.description();
    }
    if (fields.dueDate() != null) {
      this.dueDate = fields.dueDate();
    }
    if (fields.priority() != null) {
      this.priority = fields.priority();
    }
    if (fields.status() != null) {
      this.status = fields.status();
    }
    if (fields.boardCategory() != null) {
      this.boardCategory = fields.boardCategory();
    }
    if (fields.taskCategory() != null) {
      this.taskCategory = fields.taskCategory();
    }
    if (fields.icon() != null) {
      this.icon = fields.icon();
    }
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public TaskStatus getBoardCategory() {
    return boardCategory;
  }

  public TaskCategory getTaskCategory() {
    return taskCategory;
  }

  public String getIcon() {
    return icon;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
