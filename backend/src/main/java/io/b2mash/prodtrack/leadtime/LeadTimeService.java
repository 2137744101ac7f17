package io.b2mash.prodtrack.leadtime;

import io.b2mash.prodtrack.exception.InvalidStateException;
import io.b2mash.prodtrack.exception.ResourceNotFoundException;
import io.b2mash.prodtrack.jobstatus.JobStatus;
import io.b2mash.prodtrack.jobstatus.JobStatusRepository;
import io.b2mash.prodtrack.leadtime.dto.InitializeLeadTimesResponse;
import io.b2mash.prodtrack.leadtime.dto.LeadTimeResponse;
import io.b2mash.prodtrack.leadtime.dto.UpdateLeadTimeRequest;
import io.b2mash.prodtrack.leadtime.dto.UpsertLeadTimeRequest;
import io.b2mash.prodtrack.scheduling.LeadTimeDirection;
import io.b2mash.prodtrack.scheduling.SchedulingProperties;
import io.b2mash.prodtrack.scheduling.Stage;
import io.b2mash.prodtrack.scheduling.StatusPipeline;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LeadTimeService {

  private static final Logger log = LoggerFactory.getLogger(LeadTimeService.class);

  private final LeadTimeRepository leadTimeRepository;
  private final JobStatusRepository jobStatusRepository;
  private final SchedulingProperties schedulingProperties;

  public LeadTimeService(
      LeadTimeRepository leadTimeRepository,
      JobStatusRepository jobStatusRepository,
      SchedulingProperties schedulingProperties) {
    this.leadTimeRepository = leadTimeRepository;
    this.jobStatusRepository = jobStatusRepository;
    this.schedulingProperties = schedulingProperties;
  }

  /** Result of an upsert: whether a new rule was inserted, and the rule as stored. */
  public record UpsertOutcome(boolean created, LeadTimeResponse leadTime) {}

  @Transactional(readOnly = true)
  public List<LeadTimeResponse> listAll() {
    return leadTimeRepository.findAllOrdered().stream().map(LeadTimeResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public List<LeadTimeResponse> listFromStatus(Long statusId) {
    return leadTimeRepository.findByFromStatusId(statusId).stream()
        .map(LeadTimeResponse::from)
        .toList();
  }

  /** Creates the rule for the (from, to) pair, or updates the existing one. */
  @Transactional
  public UpsertOutcome upsert(UpsertLeadTimeRequest request) {
    requireStatusPair(request.fromStatusId(), request.toStatusId());
    var direction = parseDirection(request.direction(), LeadTimeDirection.BEFORE);
    boolean isActive = request.isActive() == null || request.isActive();

    var existing =
        leadTimeRepository.findFirstByPair(request.fromStatusId(), request.toStatusId());
    if (existing.isPresent()) {
      var leadTime = existing.get();
      leadTime.update(request.days(), direction, isActive);
      leadTime = leadTimeRepository.save(leadTime);
      log.info(
          "Updated lead time: id={}, from={}, to={}, days={}",
          leadTime.getId(),
          leadTime.getFromStatusId(),
          leadTime.getToStatusId(),
          leadTime.getDays());
      return new UpsertOutcome(false, LeadTimeResponse.from(leadTime));
    }

    var leadTime =
        leadTimeRepository.save(
            new LeadTime(
                request.fromStatusId(), request.toStatusId(), request.days(), direction, isActive));
    log.info(
        "Created lead time: id={}, from={}, to={}, days={}",
        leadTime.getId(),
        leadTime.getFromStatusId(),
        leadTime.getToStatusId(),
        leadTime.getDays());
    return new UpsertOutcome(true, LeadTimeResponse.from(leadTime));
  }

  @Transactional
  public LeadTimeResponse update(Long id, UpdateLeadTimeRequest request) {
    var leadTime =
        leadTimeRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("LeadTime", id));

    leadTime.update(
        request.days() != null ? request.days() : leadTime.getDays(),
        parseDirection(request.direction(), leadTime.getDirection()),
        request.isActive() != null ? request.isActive() : leadTime.isActive());
    leadTime = leadTimeRepository.save(leadTime);

    log.info("Updated lead time: id={}, days={}", leadTime.getId(), leadTime.getDays());
    return LeadTimeResponse.from(leadTime);
  }

  @Transactional
  public void delete(Long id) {
    var leadTime =
        leadTimeRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("LeadTime", id));
    leadTimeRepository.delete(leadTime);
    log.info("Deleted lead time: id={}", id);
  }

  /**
   * Seeds a "before" rule from every non-final status to the final status, spaced by the configured
   * days per pipeline step. Pairs that already have a rule are skipped, so the call can be repeated
   * on a partially configured pipeline.
   */
  @Transactional
  public InitializeLeadTimesResponse initializeDefaults() {
    var pipeline =
        StatusPipeline.of(jobStatusRepository.findAll().stream().map(JobStatus::toStage).toList());
    Stage finalStage = pipeline.finalStage();
    int daysPerStage = schedulingProperties.defaultDaysPerStage();

    int created = 0;
    int skipped = 0;
    for (Stage stage : pipeline.orderedStages()) {
      if (stage.isFinal()) {
        continue;
      }
      if (leadTimeRepository.findFirstByPair(stage.id(), finalStage.id()).isPresent()) {
        log.info(
            "Lead time already exists, skipping: from={}, to={}", stage.name(), finalStage.name());
        skipped++;
        continue;
      }
      int days = Math.max(1, (finalStage.orderIndex() - stage.orderIndex()) * daysPerStage);
      leadTimeRepository.save(
          new LeadTime(stage.id(), finalStage.id(), days, LeadTimeDirection.BEFORE, true));
      created++;
    }

    log.info("Initialized default lead times: created={}, skipped={}", created, skipped);
    return new InitializeLeadTimesResponse(
        "Default lead times initialized successfully", created, skipped);
  }

  private void requireStatusPair(Long fromStatusId, Long toStatusId) {
    if (fromStatusId.equals(toStatusId)) {
      throw new InvalidStateException(
          "Invalid lead time", "A lead time must link two different statuses");
    }
    if (!jobStatusRepository.existsById(fromStatusId)) {
      throw new ResourceNotFoundException("JobStatus", fromStatusId);
    }
    if (!jobStatusRepository.existsById(toStatusId)) {
      throw new ResourceNotFoundException("JobStatus", toStatusId);
    }
  }

  private static LeadTimeDirection parseDirection(String value, LeadTimeDirection fallback) {
    if (value == null) {
      return fallback;
    }
    try {
      return LeadTimeDirection.fromValue(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid direction", e.getMessage());
    }
  }
}
