package io.b2mash.prodtrack.job;

import static io.b2mash.prodtrack.testutil.TestPipelines.ASSEMBLY;
import static io.b2mash.prodtrack.testutil.TestPipelines.DELIVERY;
import static io.b2mash.prodtrack.testutil.TestPipelines.MACHINING;
import static io.b2mash.prodtrack.testutil.TestPipelines.NESTING;
import static io.b2mash.prodtrack.testutil.TestPipelines.before;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.prodtrack.calendar.WorkingCalendar;
import io.b2mash.prodtrack.exception.InvalidScheduleInputException;
import io.b2mash.prodtrack.exception.ResourceNotFoundException;
import io.b2mash.prodtrack.job.dto.CreateJobRequest;
import io.b2mash.prodtrack.job.dto.JobResponse;
import io.b2mash.prodtrack.job.dto.RescheduleJobRequest;
import io.b2mash.prodtrack.scheduling.DateColumn;
import io.b2mash.prodtrack.scheduling.LeadTimeRegistry;
import io.b2mash.prodtrack.scheduling.LeadTimeRule;
import io.b2mash.prodtrack.scheduling.ScheduledDates;
import io.b2mash.prodtrack.scheduling.SchedulingProperties;
import io.b2mash.prodtrack.scheduling.SchedulingService;
import io.b2mash.prodtrack.scheduling.SchedulingSnapshot;
import io.b2mash.prodtrack.scheduling.SchedulingSnapshotLoader;
import io.b2mash.prodtrack.testutil.TestEntities;
import io.b2mash.prodtrack.testutil.TestPipelines;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

  private static final Long PROJECT_ID = 7L;

  @Mock private JobRepository jobRepository;
  @Mock private SchedulingSnapshotLoader snapshotLoader;

  private JobService service;

  @BeforeEach
  void setUp() {
    var schedulingService = new SchedulingService(snapshotLoader, SchedulingProperties.defaults());
    service = new JobService(jobRepository, snapshotLoader, schedulingService);
  }

  private static SchedulingSnapshot snapshot(List<LeadTimeRule> rules) {
    var pipeline = TestPipelines.standard();
    return new SchedulingSnapshot(
        pipeline, LeadTimeRegistry.of(rules, pipeline), WorkingCalendar.weekendsOnly());
  }

  private static Job jobWithId(Long id, Long statusId) {
    return TestEntities.withId(
        new Job(PROJECT_ID, "U1", "Kitchen", "Cabinets", statusId, null), id);
  }

  @Test
  void create_startsInDefaultStatusAndSchedulesFromDelivery() {
    when(snapshotLoader.load()).thenReturn(snapshot(TestPipelines.chainedRules()));
    when(jobRepository.save(any(Job.class))).thenAnswer(i -> i.getArgument(0));

    var response =
        service.create(
            new CreateJobRequest(PROJECT_ID, "U1", "Kitchen", "Cabinets", "14/03/2025", null));

    assertThat(response.statusId()).isEqualTo(NESTING);
    assertThat(response.statusName()).isEqualTo("nesting");
    assertThat(response.deliveryDate()).isEqualTo("14/03/2025");
    assertThat(response.assemblyDate()).isEqualTo("11/03/2025");
    assertThat(response.machiningDate()).isEqualTo("07/03/2025");
    assertThat(response.nestingDate()).isEqualTo("05/03/2025");
    assertThat(response.activeColumns()).containsExactly("nesting");
  }

  @Test
  void create_withoutDeliveryDate_leavesDatesEmpty() {
    when(snapshotLoader.load()).thenReturn(snapshot(TestPipelines.chainedRules()));
    when(jobRepository.save(any(Job.class))).thenAnswer(i -> i.getArgument(0));

    var response =
        service.create(new CreateJobRequest(PROJECT_ID, null, null, "Cabinets", null, null));

    assertThat(response.deliveryDate()).isNull();
    assertThat(response.nestingDate()).isNull();
  }

  @Test
  void create_invalidDeliveryDate_isRejected() {
    assertThatThrownBy(
            () ->
                service.create(
                    new CreateJobRequest(PROJECT_ID, null, null, "Cabinets", "31/02/2025", null)))
        .isInstanceOf(InvalidScheduleInputException.class);
    verify(jobRepository, never()).save(any());
  }

  @Test
  void advanceStatus_fromFinalStatus_wrapsToDefault() {
    var job = jobWithId(3L, DELIVERY);
    when(jobRepository.findById(3L)).thenReturn(Optional.of(job));
    when(snapshotLoader.loadPipeline()).thenReturn(TestPipelines.standard());
    when(jobRepository.save(job)).thenReturn(job);

    var response = service.advanceStatus(3L);

    assertThat(response.statusId()).isEqualTo(NESTING);
    assertThat(job.getStatusId()).isEqualTo(NESTING);
  }

  @Test
  void advanceStatus_movesOneStep() {
    var job = jobWithId(3L, MACHINING);
    when(jobRepository.findById(3L)).thenReturn(Optional.of(job));
    when(snapshotLoader.loadPipeline()).thenReturn(TestPipelines.standard());
    when(jobRepository.save(job)).thenReturn(job);

    assertThat(service.advanceStatus(3L).statusId()).isEqualTo(ASSEMBLY);
  }

  @Test
  void reschedule_clearsDatesTheNewDeliveryDateCannotDetermine() {
    var job = jobWithId(3L, NESTING);
    job.applySchedule(
        new ScheduledDates(
            LocalDate.of(2025, 5, 30),
            Map.of(
                DateColumn.NESTING, LocalDate.of(2025, 5, 20),
                DateColumn.MACHINING, LocalDate.of(2025, 5, 22))));
    when(jobRepository.findById(3L)).thenReturn(Optional.of(job));
    when(snapshotLoader.load()).thenReturn(snapshot(List.of(before(1, ASSEMBLY, DELIVERY, 3))));
    when(jobRepository.save(job)).thenReturn(job);

    var response = service.reschedule(3L, new RescheduleJobRequest("01/05/2025"));

    assertThat(response.deliveryDate()).isEqualTo("01/05/2025");
    assertThat(response.assemblyDate()).isEqualTo("28/04/2025");
    assertThat(response.machiningDate()).isNull();
    assertThat(response.nestingDate()).isNull();
    assertThat(job.getDate(DateColumn.NESTING)).isNull();
  }

  @Test
  void reschedule_withoutAnyRule_leavesNoUpstreamDateAfterDelivery() {
    var job = jobWithId(4L, MACHINING);
    job.applySchedule(
        new ScheduledDates(
            LocalDate.of(2025, 5, 30), Map.of(DateColumn.NESTING, LocalDate.of(2025, 5, 20))));
    when(jobRepository.findById(4L)).thenReturn(Optional.of(job));
    when(snapshotLoader.load()).thenReturn(snapshot(List.of()));
    when(jobRepository.save(job)).thenReturn(job);

    service.reschedule(4L, new RescheduleJobRequest("01/05/2025"));

    assertThat(job.getDate(DateColumn.DELIVERY)).isEqualTo(LocalDate.of(2025, 5, 1));
    assertThat(job.getDate(DateColumn.NESTING)).isNull();
    assertThat(job.getDate(DateColumn.MACHINING)).isNull();
    assertThat(job.getDate(DateColumn.ASSEMBLY)).isNull();
  }

  @Test
  void get_unknownJob_isNotFound() {
    when(jobRepository.findById(42L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(42L))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining("42");
  }

  @Test
  void list_filtersByProject() {
    when(snapshotLoader.loadPipeline()).thenReturn(TestPipelines.standard());
    when(jobRepository.findByProjectId(PROJECT_ID)).thenReturn(List.of(jobWithId(1L, ASSEMBLY)));

    var jobs = service.list(PROJECT_ID);

    assertThat(jobs).extracting(JobResponse::statusName).containsExactly("assembly");
  }
}
