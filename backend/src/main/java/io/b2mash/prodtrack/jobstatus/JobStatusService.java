package io.b2mash.prodtrack.jobstatus;

import io.b2mash.prodtrack.exception.InvalidStateException;
import io.b2mash.prodtrack.exception.ResourceConflictException;
import io.b2mash.prodtrack.exception.ResourceNotFoundException;
import io.b2mash.prodtrack.job.JobRepository;
import io.b2mash.prodtrack.jobstatus.dto.CreateJobStatusRequest;
import io.b2mash.prodtrack.jobstatus.dto.JobStatusResponse;
import io.b2mash.prodtrack.jobstatus.dto.ReorderJobStatusesRequest;
import io.b2mash.prodtrack.jobstatus.dto.UpdateJobStatusRequest;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JobStatusService {

  private static final Logger log = LoggerFactory.getLogger(JobStatusService.class);

  private final JobStatusRepository jobStatusRepository;
  private final JobRepository jobRepository;

  public JobStatusService(JobStatusRepository jobStatusRepository, JobRepository jobRepository) {
    this.jobStatusRepository = jobStatusRepository;
    this.jobRepository = jobRepository;
  }

  @Transactional(readOnly = true)
  public List<JobStatusResponse> listAll() {
    return jobStatusRepository.findAllOrdered().stream().map(JobStatusResponse::from).toList();
  }

  @Transactional
  public JobStatusResponse create(CreateJobStatusRequest request) {
    if (jobStatusRepository.findByName(request.name()).isPresent()) {
      throw ResourceConflictException.duplicate("status", "name", request.name());
    }

    var existing = jobStatusRepository.findAllOrdered();
    int orderIndex =
        request.orderIndex() != null
            ? request.orderIndex()
            : existing.stream().mapToInt(JobStatus::getOrderIndex).max().orElse(0) + 1;
    requireOrderIndexFree(existing, orderIndex, null);

    boolean isDefault = Boolean.TRUE.equals(request.isDefault());
    boolean isFinal = Boolean.TRUE.equals(request.isFinal());
    clearExclusiveFlags(existing, null, isDefault, isFinal);

    var status =
        new JobStatus(
            request.name(),
            request.displayName(),
            request.color(),
            request.backgroundColor(),
            orderIndex,
            isDefault,
            isFinal);
    status.replaceTargetColumns(request.targetColumns());
    status = jobStatusRepository.save(status);

    log.info(
        "Created job status: id={}, name={}, orderIndex={}",
        status.getId(),
        status.getName(),
        status.getOrderIndex());
    return JobStatusResponse.from(status);
  }

  @Transactional
  public JobStatusResponse update(Long id, UpdateJobStatusRequest request) {
    var status =
        jobStatusRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("JobStatus", id));

    if (request.name() != null && !request.name().equals(status.getName())) {
      jobStatusRepository
          .findByName(request.name())
          .ifPresent(
              other -> {
                throw ResourceConflictException.duplicate("status", "name", request.name());
              });
    }

    status.updateAppearance(
        valueOr(request.name(), status.getName()),
        valueOr(request.displayName(), status.getDisplayName()),
        valueOr(request.color(), status.getColor()),
        valueOr(request.backgroundColor(), status.getBackgroundColor()));

    var existing = jobStatusRepository.findAllOrdered();
    if (request.orderIndex() != null && request.orderIndex() != status.getOrderIndex()) {
      requireOrderIndexFree(existing, request.orderIndex(), id);
      status.moveTo(request.orderIndex());
    }

    boolean isDefault = valueOr(request.isDefault(), status.isDefault());
    boolean isFinal = valueOr(request.isFinal(), status.isFinal());
    clearExclusiveFlags(existing, id, isDefault, isFinal);
    status.updateFlags(isDefault, isFinal);

    if (request.targetColumns() != null) {
      status.replaceTargetColumns(request.targetColumns());
    }
    status = jobStatusRepository.save(status);

    log.info("Updated job status: id={}, name={}", status.getId(), status.getName());
    return JobStatusResponse.from(status);
  }

  @Transactional
  public List<JobStatusResponse> reorder(ReorderJobStatusesRequest request) {
    var statuses = jobStatusRepository.findAllOrdered();
    Map<Long, JobStatus> byId = new HashMap<>();
    statuses.forEach(status -> byId.put(status.getId(), status));

    Map<Long, Integer> finalIndexes = new HashMap<>();
    statuses.forEach(status -> finalIndexes.put(status.getId(), status.getOrderIndex()));
    for (var order : request.statusOrders()) {
      if (!byId.containsKey(order.id())) {
        throw new ResourceNotFoundException("JobStatus", order.id());
      }
      finalIndexes.put(order.id(), order.orderIndex());
    }
    Set<Integer> seen = new HashSet<>();
    for (Integer index : finalIndexes.values()) {
      if (!seen.add(index)) {
        throw new InvalidStateException(
            "Invalid order", "Order index " + index + " would be used by more than one status");
      }
    }

    for (var order : request.statusOrders()) {
      byId.get(order.id()).moveTo(order.orderIndex());
    }
    jobStatusRepository.saveAll(statuses);

    log.info("Reordered job statuses: count={}", request.statusOrders().size());
    return listAll();
  }

  @Transactional
  public void delete(Long id) {
    var status =
        jobStatusRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("JobStatus", id));

    if (jobRepository.existsByStatusId(id)) {
      throw new ResourceConflictException(
          "Status in use", "Cannot delete status that is being used by jobs");
    }

    jobStatusRepository.delete(status);
    log.info("Deleted job status: id={}, name={}", status.getId(), status.getName());
  }

  private void requireOrderIndexFree(List<JobStatus> existing, int orderIndex, Long ownId) {
    boolean taken =
        existing.stream()
            .anyMatch(s -> s.getOrderIndex() == orderIndex && !s.getId().equals(ownId));
    if (taken) {
      throw new ResourceConflictException(
          "Order index taken", "Order index " + orderIndex + " is already used by another status");
    }
  }

  /** A pipeline has one default and one final status; setting either flag clears it elsewhere. */
  private void clearExclusiveFlags(
      List<JobStatus> existing, Long ownId, boolean isDefault, boolean isFinal) {
    for (JobStatus other : existing) {
      if (other.getId().equals(ownId)) {
        continue;
      }
      if (isDefault && other.isDefault()) {
        other.clearDefault();
      }
      if (isFinal && other.isFinal()) {
        other.updateFlags(other.isDefault(), false);
      }
    }
  }

  private static <T> T valueOr(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
