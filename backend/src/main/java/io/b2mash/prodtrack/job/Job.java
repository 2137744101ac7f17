package io.b2mash.prodtrack.job;

import io.b2mash.prodtrack.scheduling.DateColumn;
import io.b2mash.prodtrack.scheduling.ScheduledDates;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "jobs")
public class Job {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "unit", length = 100)
  private String unit;

  @Column(name = "type", length = 100)
  private String type;

  @Column(name = "items", nullable = false, columnDefinition = "TEXT")
  private String items;

  @Column(name = "status_id", nullable = false)
  private Long statusId;

  @Column(name = "nesting_date")
  private LocalDate nestingDate;

  @Column(name = "machining_date")
  private LocalDate machiningDate;

  @Column(name = "assembly_date")
  private LocalDate assemblyDate;

  @Column(name = "delivery_date")
  private LocalDate deliveryDate;

  @Column(name = "comments", columnDefinition = "TEXT")
  private String comments;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(
      Long projectId, String unit, String type, String items, Long statusId, String comments) {
    this.projectId = projectId;
    this.unit = unit;
    this.type = type;
    this.items = items;
    this.statusId = statusId;
    this.comments = comments;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void moveToStatus(Long statusId) {
    this.statusId = statusId;
    this.updatedAt = Instant.now();
  }

  /**
   * Replaces the delivery date and all upstream dates. A column the schedule could not resolve is
   * cleared, since a date computed from an earlier delivery date no longer holds.
   */
  public void applySchedule(ScheduledDates dates) {
    this.deliveryDate = dates.deliveryDate();
    this.nestingDate = dates.dateFor(DateColumn.NESTING).orElse(null);
    this.machiningDate = dates.dateFor(DateColumn.MACHINING).orElse(null);
    this.assemblyDate = dates.dateFor(DateColumn.ASSEMBLY).orElse(null);
    this.updatedAt = Instant.now();
  }

  public LocalDate getDate(DateColumn column) {
    return switch (column) {
      case NESTING -> nestingDate;
      case MACHINING -> machiningDate;
      case ASSEMBLY -> assemblyDate;
      case DELIVERY -> deliveryDate;
    };
  }

  public Long getId() {
    return id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public String getUnit() {
    return unit;
  }

  public String getType() {
    return type;
  }

  public String getItems() {
    return items;
  }

  public Long getStatusId() {
    return statusId;
  }

  public LocalDate getNestingDate() {
    return nestingDate;
  }

  public LocalDate getMachiningDate() {
    return machiningDate;
  }

  public LocalDate getAssemblyDate() {
    return assemblyDate;
  }

  public LocalDate getDeliveryDate() {
    return deliveryDate;
  }

  public String getComments() {
    return comments;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
