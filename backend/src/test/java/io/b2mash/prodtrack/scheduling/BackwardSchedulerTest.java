package io.b2mash.prodtrack.scheduling;

import static io.b2mash.prodtrack.testutil.TestPipelines.ASSEMBLY;
import static io.b2mash.prodtrack.testutil.TestPipelines.DELIVERY;
import static io.b2mash.prodtrack.testutil.TestPipelines.MACHINING;
import static io.b2mash.prodtrack.testutil.TestPipelines.NESTING;
import static io.b2mash.prodtrack.testutil.TestPipelines.before;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.prodtrack.calendar.WorkingCalendar;
import io.b2mash.prodtrack.exception.InvalidScheduleInputException;
import io.b2mash.prodtrack.testutil.TestPipelines;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class BackwardSchedulerTest {

  private static final LocalDate FRIDAY_14_MARCH = LocalDate.of(2025, 3, 14);
  private static final List<Long> UPSTREAM = List.of(NESTING, MACHINING, ASSEMBLY);

  private static BackwardScheduler scheduler(List<LeadTimeRule> rules, WorkingCalendar calendar) {
    return new BackwardScheduler(
        TestPipelines.standard(), TestPipelines.registry(rules), calendar);
  }

  @Test
  void chain_resolvesEachStageFromItsSuccessor() {
    var result =
        scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, UPSTREAM);

    assertThat(result.dateFor(ASSEMBLY)).contains(LocalDate.of(2025, 3, 11));
    assertThat(result.dateFor(MACHINING)).contains(LocalDate.of(2025, 3, 7));
    assertThat(result.dateFor(NESTING)).contains(LocalDate.of(2025, 3, 5));
    assertThat(result.unresolvedStageIds()).isEmpty();
  }

  @Test
  void chain_resultIsOrderedFromAnchorUpstream() {
    var result =
        scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, UPSTREAM);

    assertThat(result.dates().keySet()).containsExactly(ASSEMBLY, MACHINING, NESTING);
  }

  @Test
  void holiday_shiftsTheWholeChain() {
    var calendar = WorkingCalendar.ofDates(List.of(LocalDate.of(2025, 3, 11)));

    var result =
        scheduler(TestPipelines.chainedRules(), calendar)
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, UPSTREAM);

    assertThat(result.dateFor(ASSEMBLY)).contains(LocalDate.of(2025, 3, 10));
    assertThat(result.dateFor(MACHINING)).contains(LocalDate.of(2025, 3, 6));
    assertThat(result.dateFor(NESTING)).contains(LocalDate.of(2025, 3, 4));
  }

  @Test
  void missingChainRule_fallsBackToRuleAgainstAnchor() {
    var rules = List.of(before(1, ASSEMBLY, DELIVERY, 3), before(2, NESTING, DELIVERY, 10));

    var result =
        scheduler(rules, WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, UPSTREAM);

    assertThat(result.dateFor(ASSEMBLY)).contains(LocalDate.of(2025, 3, 11));
    assertThat(result.dateFor(MACHINING)).isEmpty();
    assertThat(result.dateFor(NESTING)).contains(LocalDate.of(2025, 2, 28));
    assertThat(result.unresolvedStageIds()).containsExactly(MACHINING);
  }

  @Test
  void chainRule_isPreferredOverAnchorRule() {
    var rules =
        List.of(
            before(1, ASSEMBLY, DELIVERY, 3),
            before(2, MACHINING, ASSEMBLY, 2),
            before(3, MACHINING, DELIVERY, 1));

    var result =
        scheduler(rules, WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, List.of(MACHINING, ASSEMBLY));

    assertThat(result.dateFor(MACHINING)).contains(LocalDate.of(2025, 3, 7));
  }

  @Test
  void noRules_leavesEverythingUnresolved() {
    var result =
        scheduler(List.of(), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, UPSTREAM);

    assertThat(result.dates()).isEmpty();
    assertThat(result.unresolvedStageIds()).containsExactly(ASSEMBLY, MACHINING, NESTING);
    assertThat(result.dateFor(ASSEMBLY)).isEmpty();
  }

  @Test
  void weekendAnchor_isAcceptedAsGiven() {
    var result =
        scheduler(List.of(before(1, ASSEMBLY, DELIVERY, 3)), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, LocalDate.of(2025, 3, 16), List.of(ASSEMBLY));

    assertThat(result.dateFor(ASSEMBLY)).contains(LocalDate.of(2025, 3, 12));
  }

  @Test
  void zeroDayRule_onWorkingDay_keepsTheDate() {
    var result =
        scheduler(List.of(before(1, ASSEMBLY, DELIVERY, 0)), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, List.of(ASSEMBLY));

    assertThat(result.dateFor(ASSEMBLY)).contains(FRIDAY_14_MARCH);
  }

  @Test
  void zeroDayRule_onWeekend_movesToPreviousWorkingDay() {
    var result =
        scheduler(List.of(before(1, ASSEMBLY, DELIVERY, 0)), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, LocalDate.of(2025, 3, 15), List.of(ASSEMBLY));

    assertThat(result.dateFor(ASSEMBLY)).contains(FRIDAY_14_MARCH);
  }

  @Test
  void anchorInTargets_isIgnored() {
    var result =
        scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly())
            .computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, List.of(DELIVERY, ASSEMBLY));

    assertThat(result.dates()).containsOnlyKeys(ASSEMBLY);
    assertThat(result.unresolvedStageIds()).isEmpty();
  }

  @Test
  void unknownTarget_isRejected() {
    var scheduler = scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly());

    assertThatThrownBy(
            () -> scheduler.computeUpstreamDates(DELIVERY, FRIDAY_14_MARCH, List.of(99L)))
        .isInstanceOf(InvalidScheduleInputException.class)
        .hasMessageContaining("Status 99");
  }

  @Test
  void unknownAnchor_isRejected() {
    var scheduler = scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly());

    assertThatThrownBy(() -> scheduler.computeUpstreamDates(99L, FRIDAY_14_MARCH, UPSTREAM))
        .isInstanceOf(InvalidScheduleInputException.class);
  }

  @Test
  void missingAnchorDate_isRejected() {
    var scheduler = scheduler(TestPipelines.chainedRules(), WorkingCalendar.weekendsOnly());

    assertThatThrownBy(() -> scheduler.computeUpstreamDates(DELIVERY, null, UPSTREAM))
        .isInstanceOf(InvalidScheduleInputException.class);
  }

  @Test
  void computedDates_areWorkingDaysAndNeverAfterTheirSuccessor() {
    var calendar =
        WorkingCalendar.ofDates(
            List.of(
                LocalDate.of(2025, 4, 18),
                LocalDate.of(2025, 4, 21),
                LocalDate.of(2025, 4, 25),
                LocalDate.of(2025, 5, 5)));
    var scheduler = scheduler(TestPipelines.chainedRules(), calendar);
    var start = LocalDate.of(2025, 3, 1);

    for (int offset = 0; offset < 120; offset++) {
      var delivery = start.plusDays(offset);
      var result = scheduler.computeUpstreamDates(DELIVERY, delivery, UPSTREAM);

      var assembly = result.dateFor(ASSEMBLY).orElseThrow();
      var machining = result.dateFor(MACHINING).orElseThrow();
      var nesting = result.dateFor(NESTING).orElseThrow();
      assertThat(assembly).isBeforeOrEqualTo(delivery);
      assertThat(machining).isBeforeOrEqualTo(assembly);
      assertThat(nesting).isBeforeOrEqualTo(machining);
      assertThat(List.of(assembly, machining, nesting)).allMatch(calendar::isWorkingDay);
    }
  }
}
