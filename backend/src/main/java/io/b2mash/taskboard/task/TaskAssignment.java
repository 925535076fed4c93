package io.b2mash.taskboard.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Join row assigning a contact to a task. */
@Entity
@Table(name = "task_assignments")
public class TaskAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private Long taskId;

  @Column(name = "contact_id", nullable = false, updatable = false)
  private Long contactId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskAssignment() {}

  public TaskAssignment(Long taskId, Long contactId) {
    this.taskId = taskId;
    this.contactId = contactId;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getContactId() {
    return contactId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
