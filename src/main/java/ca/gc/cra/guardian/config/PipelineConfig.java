package ca.gc.cra.guardian.config;

import ca.gc.cra.guardian.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered list of stage names. The safety stage must run first so nothing shapes content before it is screened.
 *
 * @param order stage names in execution order
 * @param safetyStage name of the stage allowed to halt the pipeline
 * @since 1.0.0
 */
public record PipelineConfig(List<String> order, String safetyStage) {

  /** Name of the built-in safety stage. */
  public static final String CONTENT_FILTER = "content_filter";
  /** Name of the built-in age adaptation stage. */
  public static final String AGE_ADAPTER = "age_adapter";
  /** Name of the built-in parent activity stage. */
  public static final String PARENT_LOGGER = "parent_logger";

  /**
   * Validates the ordering rules.
   */
  public PipelineConfig {
    Objects.requireNonNull(order, "order");
    safetyStage = Strings.requireIdentifier("pipeline.safetyStage", safetyStage);
    List<String> names = new ArrayList<>(order.size());
    Set<String> seen = new LinkedHashSet<>();
    for (String raw : order) {
      String name = Strings.requireIdentifier("pipeline.order entry", raw);
      if (!seen.add(name)) {
        throw new IllegalArgumentException("Duplicate stage in pipeline.order: " + name);
      }
      names.add(name);
    }
    if (names.isEmpty()) {
      throw new IllegalArgumentException("pipeline.order must list at least the safety stage");
    }
    if (!names.get(0).equals(safetyStage)) {
      throw new IllegalArgumentException(
          "pipeline.order must start with the safety stage " + safetyStage + " (was " + names.get(0) + ")");
    }
    order = List.copyOf(names);
  }

  /**
   * Returns the stages that run after the safety stage.
   *
   * @return stage names following the safety stage
   */
  public List<String> downstreamStages() {
    return order.subList(1, order.size());
  }

  /**
   * Returns the shipped default order.
   *
   * @return {@code content_filter, age_adapter, parent_logger}
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(List.of(CONTENT_FILTER, AGE_ADAPTER, PARENT_LOGGER), CONTENT_FILTER);
  }
}
