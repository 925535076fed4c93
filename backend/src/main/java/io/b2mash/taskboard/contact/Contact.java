package io.b2mash.taskboard.contact;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "contacts")
public class Contact {

  public static final String DEFAULT_COLOR = "#000000";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "email", nullable = false, length = 254, unique = true)
  private String email;

  @Column(name = "phone", nullable = false, length = 20)
  private String phone;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Contact() {}

  public Contact(String name, String email, String phone, String color) {
    this.name = name;
    this.email = email;
    this.phone = phone;
    this.color = color != null ? color : DEFAULT_COLOR;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies every non-null argument. */
  public void update(String name, String email, String phone, String color) {
    if (name != null) {
      this.name = name;
    }
    if (email != null) {
      this.email = email;
    }
    if (phone != null) {
      this.phone = phone;
    }
    if (color != null) {
      this.color = color;
    }
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public String getColor() {
    return color;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
