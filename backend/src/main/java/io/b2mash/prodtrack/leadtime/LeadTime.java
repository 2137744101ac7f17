package io.b2mash.prodtrack.leadtime;

import io.b2mash.prodtrack.scheduling.LeadTimeDirection;
import io.b2mash.prodtrack.scheduling.LeadTimeRule;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Working days between two job statuses. */
@Entity
@Table(name = "lead_times")
public class LeadTime {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "from_status_id", nullable = false)
  private Long fromStatusId;

  @Column(name = "to_status_id", nullable = false)
  private Long toStatusId;

  @Column(name = "days", nullable = false)
  private int days;

  @Enumerated(EnumType.STRING)
  @Column(name = "direction", nullable = false, length = 10)
  private LeadTimeDirection direction;

  @Column(name = "is_active", nullable = false)
  private boolean isActive;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LeadTime() {}

  public LeadTime(
      Long fromStatusId,
      Long toStatusId,
      int days,
      LeadTimeDirection direction,
      boolean isActive) {
    this.fromStatusId = fromStatusId;
    this.toStatusId = toStatusId;
    this.days = days;
    this.direction = direction;
    this.isActive = isActive;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(int days, LeadTimeDirection direction, boolean isActive) {
    this.days = days;
    this.direction = direction;
    this.isActive = isActive;
    this.updatedAt = Instant.now();
  }

  public LeadTimeRule toRule() {
    return new LeadTimeRule(id, fromStatusId, toStatusId, days, direction, isActive);
  }

  public Long getId() {
    return id;
  }

  public Long getFromStatusId() {
    return fromStatusId;
  }

  public Long getToStatusId() {
    return toStatusId;
  }

  public int getDays() {
    return days;
  }

  public LeadTimeDirection getDirection() {
    return direction;
  }

  public boolean isActive() {
    return isActive;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
