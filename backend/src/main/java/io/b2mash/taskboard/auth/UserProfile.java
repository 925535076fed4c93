package io.b2mash.taskboard.auth;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "user_profiles")
public class UserProfile {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, unique = true, updatable = false)
  private Long userId;

  @Column(name = "bio", length = 2000)
  private String bio;

  @Column(name = "location", length = 100)
  private String location;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected UserProfile() {}

  public UserProfile(Long userId) {
    this.userId = userId;
    this.createdAt = Instant.now();
  }

  /** Null arguments keep the current value. */
  public void update(String bio, String location) {
    if (bio != null) {
      this.bio = bio;
    }
    if (location != null) {
      this.location = location;
    }
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public String getBio() {
    return bio;
  }

  public String getLocation() {
    return location;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
