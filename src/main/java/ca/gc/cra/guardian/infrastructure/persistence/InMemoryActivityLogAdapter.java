package ca.gc.cra.guardian.infrastructure.persistence;

import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Activity log kept in memory.
 *
 * @since 1.0.0
 */
public final class InMemoryActivityLogAdapter implements ActivityLogPort {
  private final List<ActivityRecord> records = new CopyOnWriteArrayList<>();

  @Override
  public void append(ActivityRecord record) {
    records.add(Objects.requireNonNull(record, "record"));
  }

  /**
   * Returns every appended record in order.
   *
   * @return immutable snapshot
   */
  public List<ActivityRecord> snapshot() {
    return List.copyOf(records);
  }
}
