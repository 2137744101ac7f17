package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.calendar.HolidayRepository;
import io.b2mash.prodtrack.calendar.WorkingCalendar;
import io.b2mash.prodtrack.jobstatus.JobStatus;
import io.b2mash.prodtrack.jobstatus.JobStatusRepository;
import io.b2mash.prodtrack.leadtime.LeadTime;
import io.b2mash.prodtrack.leadtime.LeadTimeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/** Reads statuses, lead times and holidays together and freezes them into a snapshot. */
@Service
public class SchedulingSnapshotLoader {

  private final JobStatusRepository jobStatusRepository;
  private final LeadTimeRepository leadTimeRepository;
  private final HolidayRepository holidayRepository;

  public SchedulingSnapshotLoader(
      JobStatusRepository jobStatusRepository,
      LeadTimeRepository leadTimeRepository,
      HolidayRepository holidayRepository) {
    this.jobStatusRepository = jobStatusRepository;
    this.leadTimeRepository = leadTimeRepository;
    this.holidayRepository = holidayRepository;
  }

  @Transactional(readOnly = true)
  public StatusPipeline loadPipeline() {
    return StatusPipeline.of(
        jobStatusRepository.findAllOrdered().stream().map(JobStatus::toStage).toList());
  }

  /**
   * Statuses, lead times and holidays must come from one database snapshot, otherwise a rule
   * committed between the reads can reference a status the pipeline has not seen.
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public SchedulingSnapshot load() {
    var pipeline = loadPipeline();
    var rules =
        leadTimeRepository.findAllInInsertionOrder().stream().map(LeadTime::toRule).toList();
    var calendar = WorkingCalendar.of(holidayRepository.findAll());
    return new SchedulingSnapshot(pipeline, LeadTimeRegistry.of(rules, pipeline), calendar);
  }
}
