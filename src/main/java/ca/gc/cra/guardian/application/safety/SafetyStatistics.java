package ca.gc.cra.guardian.application.safety;

import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running evaluation counters kept by a {@link SafetyEngine}.
 * <p><strong>Thread-safety:</strong> Counters are {@link LongAdder}s; snapshots are point-in-time but not
 * atomic across counters.</p>
 *
 * @since 1.0.0
 */
public final class SafetyStatistics {
  private final LongAdder evaluations = new LongAdder();
  private final LongAdder blocked = new LongAdder();
  private final LongAdder errors = new LongAdder();
  private final Map<SafetyCategory, LongAdder> blockedByCategory = new EnumMap<>(SafetyCategory.class);

  SafetyStatistics() {
    for (SafetyCategory category : SafetyCategory.values()) {
      if (category != SafetyCategory.SAFE) {
        blockedByCategory.put(category, new LongAdder());
      }
    }
  }

  void recordEvaluation() {
    evaluations.increment();
  }

  void recordBlocked(SafetyCategory category) {
    blocked.increment();
    LongAdder counter = blockedByCategory.get(category);
    if (counter != null) {
      counter.increment();
    }
  }

  void recordError() {
    errors.increment();
  }

  /**
   * Captures the current counter values.
   *
   * @return snapshot
   */
  public Snapshot snapshot() {
    Map<SafetyCategory, Long> perCategory = new EnumMap<>(SafetyCategory.class);
    blockedByCategory.forEach((category, counter) -> {
      long value = counter.sum();
      if (value > 0) {
        perCategory.put(category, value);
      }
    });
    return new Snapshot(evaluations.sum(), blocked.sum(), errors.sum(), perCategory);
  }

  /**
   * Point-in-time counter values.
   *
   * @param evaluations evaluations started
   * @param blocked evaluations that returned unsafe
   * @param errors evaluations that failed and were closed
   * @param blockedByCategory blocked count per primary category; zero counts omitted
   */
  public record Snapshot(long evaluations, long blocked, long errors, Map<SafetyCategory, Long> blockedByCategory) {
    public Snapshot {
      blockedByCategory = Map.copyOf(blockedByCategory);
    }

    /**
     * Returns the blocked count for one category.
     *
     * @param category category
     * @return count, zero when none
     */
    public long blocked(SafetyCategory category) {
      return blockedByCategory.getOrDefault(category, 0L);
    }
  }
}
