package io.b2mash.prodtrack.jobstatus;

import io.b2mash.prodtrack.scheduling.ColumnTarget;
import io.b2mash.prodtrack.scheduling.Stage;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A step of the production pipeline that jobs move through. */
@Entity
@Table(name = "job_statuses")
public class JobStatus {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, unique = true, length = 100)
  private String name;

  @Column(name = "display_name", nullable = false, length = 100)
  private String displayName;

  @Column(name = "color", nullable = false, length = 7)
  private String color;

  @Column(name = "background_color", nullable = false, length = 7)
  private String backgroundColor;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(name = "is_default", nullable = false)
  private boolean isDefault;

  @Column(name = "is_final", nullable = false)
  private boolean isFinal;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "target_columns", columnDefinition = "jsonb")
  private List<ColumnTarget> targetColumns = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected JobStatus() {}

  public JobStatus(
      String name,
      String displayName,
      String color,
      String backgroundColor,
      int orderIndex,
      boolean isDefault,
      boolean isFinal) {
    this.name = name;
    this.displayName = displayName;
    this.color = color;
    this.backgroundColor = backgroundColor;
    this.orderIndex = orderIndex;
    this.isDefault = isDefault;
    this.isFinal = isFinal;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateAppearance(
      String name, String displayName, String color, String backgroundColor) {
    this.name = name;
    this.displayName = displayName;
    this.color = color;
    this.backgroundColor = backgroundColor;
    this.updatedAt = Instant.now();
  }

  public void updateFlags(boolean isDefault, boolean isFinal) {
    this.isDefault = isDefault;
    this.isFinal = isFinal;
    this.updatedAt = Instant.now();
  }

  public void clearDefault() {
    this.isDefault = false;
    this.updatedAt = Instant.now();
  }

  public void moveTo(int orderIndex) {
    this.orderIndex = orderIndex;
    this.updatedAt = Instant.now();
  }

  public void replaceTargetColumns(List<ColumnTarget> targetColumns) {
    this.targetColumns = targetColumns == null ? new ArrayList<>() : new ArrayList<>(targetColumns);
    this.updatedAt = Instant.now();
  }

  /** Immutable engine view of this status. */
  public Stage toStage() {
    return new Stage(id, name, displayName, orderIndex, isDefault, isFinal, targetColumns);
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getColor() {
    return color;
  }

  public String getBackgroundColor() {
    return backgroundColor;
  }

  public int getOrderIndex() {
    return orderIndex;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public boolean isFinal() {
    return isFinal;
  }

  public List<ColumnTarget> getTargetColumns() {
    return targetColumns == null ? List.of() : List.copyOf(targetColumns);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
