package io.b2mash.prodtrack.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "holidays")
public class Holiday {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "holiday_date", nullable = false, unique = true)
  private LocalDate date;

  /** Statutory public holiday, as opposed to an organisation-specific closure. */
  @Column(name = "is_public", nullable = false)
  private boolean isPublic;

  @Column(name = "is_custom", nullable = false)
  private boolean isCustom;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Holiday() {}

  public Holiday(
      String name, LocalDate date, boolean isPublic, boolean isCustom, String description) {
    this.name = name;
    this.date = date;
    this.isPublic = isPublic;
    this.isCustom = isCustom;
    this.description = description;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(
      String name, LocalDate date, boolean isPublic, boolean isCustom, String description) {
    this.name = name;
    this.date = date;
    this.isPublic = isPublic;
    this.isCustom = isCustom;
    this.description = description;
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public LocalDate getDate() {
    return date;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public boolean isCustom() {
    return isCustom;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
