package ca.gc.cra.guardian.application.port;

import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import java.io.IOException;

/**
 * Port receiving one activity record per completed turn for the parent dashboard.
 * <p>Implementations must be safe for concurrent appends.</p>
 *
 * @since 1.0.0
 */
public interface ActivityLogPort extends AutoCloseable {
  /**
   * Appends one activity record.
   *
   * @param record record to append; must not be {@code null}
   * @throws IOException when the record cannot be written
   */
  void append(ActivityRecord record) throws IOException;

  /**
   * Releases resources held by the log.
   *
   * @throws IOException when closing fails
   */
  @Override
  default void close() throws IOException {}
}
