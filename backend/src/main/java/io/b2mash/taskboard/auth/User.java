package io.b2mash.taskboard.auth;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** An account. The email address is the login key; the username is a unique display handle. */
@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "email", nullable = false, length = 254, unique = true)
  private String email;

  @Column(name = "username", nullable = false, length = 150, unique = true)
  private String username;

  @Column(name = "password_hash", nullable = false, length = 100)
  private String passwordHash;

  @Column(name = "first_name", length = 150)
  private String firstName;

  @Column(name = "last_name", length = 150)
  private String lastName;

  @Column(name = "staff", nullable = false)
  private boolean staff;

  @Column(name = "superuser", nullable = false)
  private boolean superuser;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected User() {}

  public User(
      String email, String username, String passwordHash, String firstName, String lastName) {
    this.email = email;
    this.username = username;
    this.passwordHash = passwordHash;
    this.firstName = firstName;
    this.lastName = lastName;
    this.createdAt = Instant.now();
  }

  public void changePasswordHash(String passwordHash) {
    this.passwordHash = passwordHash;
  }

  public Long getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getUsername() {
    return username;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public boolean isStaff() {
    return staff;
  }

  public boolean isSuperuser() {
    return superuser;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
