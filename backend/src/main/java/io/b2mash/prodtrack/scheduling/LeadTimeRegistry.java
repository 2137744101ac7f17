package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.exception.PipelineConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup of active "before" lead times by status pair.
 *
 * <p>When several active rules exist for the same pair, the first one in insertion order is used
 * and a warning is logged once, when the registry is built.
 */
public final class LeadTimeRegistry {

  private static final Logger log = LoggerFactory.getLogger(LeadTimeRegistry.class);

  private record StagePair(long fromStageId, long toStageId) {}

  private final Map<StagePair, LeadTimeRule> applicable;

  private LeadTimeRegistry(Map<StagePair, LeadTimeRule> applicable) {
    this.applicable = applicable;
  }

  public static LeadTimeRegistry empty() {
    return new LeadTimeRegistry(Map.of());
  }

  /**
   * Builds a registry from rules in insertion order, validated against the pipeline.
   *
   * @throws PipelineConfigurationException if a rule references an unknown status, links a status
   *     to itself, or carries a negative day count
   */
  public static LeadTimeRegistry of(List<LeadTimeRule> rules, StatusPipeline pipeline) {
    var applicable = new LinkedHashMap<StagePair, LeadTimeRule>();
    var duplicates = new LinkedHashMap<StagePair, Integer>();

    for (LeadTimeRule rule : rules) {
      validate(rule, pipeline);
      if (!rule.active() || rule.direction() != LeadTimeDirection.BEFORE) {
        continue;
      }
      var pair = new StagePair(rule.fromStageId(), rule.toStageId());
      if (applicable.putIfAbsent(pair, rule) != null) {
        duplicates.merge(pair, 2, (count, ignored) -> count + 1);
      }
    }

    duplicates.forEach(
        (pair, count) ->
            log.warn(
                "Ambiguous lead time: from={}, to={}, activeRules={}, using ruleId={}",
                pair.fromStageId(),
                pair.toStageId(),
                count,
                applicable.get(pair).id()));

    return new LeadTimeRegistry(Map.copyOf(applicable));
  }

  /** Active {@code before} rule from one status to another, if any. */
  public Optional<LeadTimeRule> rule(long fromStageId, long toStageId) {
    return Optional.ofNullable(applicable.get(new StagePair(fromStageId, toStageId)));
  }

  private static void validate(LeadTimeRule rule, StatusPipeline pipeline) {
    if (rule.fromStageId() == rule.toStageId()) {
      throw new PipelineConfigurationException(
          "Lead time " + rule.id() + " links status " + rule.fromStageId() + " to itself");
    }
    if (pipeline.findById(rule.fromStageId()).isEmpty()) {
      throw new PipelineConfigurationException(
          "Lead time " + rule.id() + " references unknown status " + rule.fromStageId());
    }
    if (pipeline.findById(rule.toStageId()).isEmpty()) {
      throw new PipelineConfigurationException(
          "Lead time " + rule.id() + " references unknown status " + rule.toStageId());
    }
    if (rule.days() < 0) {
      throw new PipelineConfigurationException(
          "Lead time " + rule.id() + " has a negative day count: " + rule.days());
    }
  }
}
