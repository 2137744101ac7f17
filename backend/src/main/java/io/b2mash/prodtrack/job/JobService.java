package io.b2mash.prodtrack.job;

import io.b2mash.prodtrack.exception.ResourceNotFoundException;
import io.b2mash.prodtrack.job.dto.CreateJobRequest;
import io.b2mash.prodtrack.job.dto.JobResponse;
import io.b2mash.prodtrack.job.dto.RescheduleJobRequest;
import io.b2mash.prodtrack.scheduling.DayMonthYearDates;
import io.b2mash.prodtrack.scheduling.SchedulingService;
import io.b2mash.prodtrack.scheduling.SchedulingSnapshotLoader;
import io.b2mash.prodtrack.scheduling.StatusCycler;
import io.b2mash.prodtrack.scheduling.StatusPipeline;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class JobService {

  private static final Logger log = LoggerFactory.getLogger(JobService.class);

  private final JobRepository jobRepository;
  private final SchedulingSnapshotLoader snapshotLoader;
  private final SchedulingService schedulingService;

  public JobService(
      JobRepository jobRepository,
      SchedulingSnapshotLoader snapshotLoader,
      SchedulingService schedulingService) {
    this.jobRepository = jobRepository;
    this.snapshotLoader = snapshotLoader;
    this.schedulingService = schedulingService;
  }

  @Transactional(readOnly = true)
  public List<JobResponse> list(Long projectId) {
    var pipeline = snapshotLoader.loadPipeline();
    var jobs =
        projectId != null
            ? jobRepository.findByProjectId(projectId)
            : jobRepository.findAllNewestFirst();
    return jobs.stream().map(job -> toResponse(job, pipeline)).toList();
  }

  @Transactional(readOnly = true)
  public JobResponse get(Long id) {
    return toResponse(findJob(id), snapshotLoader.loadPipeline());
  }

  /**
   * Creates a job in the default status. When a delivery date is supplied the upstream production
   * dates are calculated from it straight away.
   */
  @Transactional(isolation = Isolation.REPEATABLE_READ)
  public JobResponse create(CreateJobRequest request) {
    var deliveryDate = DayMonthYearDates.parse(request.deliveryDate());
    var snapshot = snapshotLoader.load();
    var initial = StatusCycler.initialStage(snapshot.pipeline());

    var job =
        new Job(
            request.projectId(),
            request.unit(),
            request.type(),
            request.items(),
            initial.id(),
            request.comments());
    deliveryDate.ifPresent(
        date -> job.applySchedule(schedulingService.scheduleFromDelivery(snapshot, date)));
    var saved = jobRepository.save(job);

    log.info(
        "Created job: id={}, projectId={}, status={}, deliveryDate={}",
        saved.getId(),
        saved.getProjectId(),
        initial.name(),
        saved.getDeliveryDate());
    return toResponse(saved, snapshot.pipeline());
  }

  /** Moves the job to the next status, wrapping from the last status back to the first. */
  @Transactional
  public JobResponse advanceStatus(Long id) {
    var job = findJob(id);
    var pipeline = snapshotLoader.loadPipeline();
    var next = StatusCycler.advance(pipeline, job.getStatusId());

    Long previousStatusId = job.getStatusId();
    job.moveToStatus(next.id());
    var saved = jobRepository.save(job);

    log.info("Advanced job status: id={}, from={}, to={}", id, previousStatusId, next.id());
    return toResponse(saved, pipeline);
  }

  /**
   * Recalculates the job's production dates from a new delivery date. Dates that can no longer be
   * determined are cleared.
   */
  @Transactional(isolation = Isolation.REPEATABLE_READ)
  public JobResponse reschedule(Long id, RescheduleJobRequest request) {
    var job = findJob(id);
    var deliveryDate = DayMonthYearDates.parseRequired(request.deliveryDate(), "deliveryDate");
    var snapshot = snapshotLoader.load();

    job.applySchedule(schedulingService.scheduleFromDelivery(snapshot, deliveryDate));
    var saved = jobRepository.save(job);

    log.info("Rescheduled job: id={}, deliveryDate={}", id, deliveryDate);
    return toResponse(saved, snapshot.pipeline());
  }

  @Transactional
  public void delete(Long id) {
    var job = findJob(id);
    jobRepository.delete(job);
    log.info("Deleted job: id={}, projectId={}", id, job.getProjectId());
  }

  private Job findJob(Long id) {
    return jobRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Job", id));
  }

  private JobResponse toResponse(Job job, StatusPipeline pipeline) {
    return JobResponse.from(job, pipeline.findById(job.getStatusId()).orElse(null));
  }
}
