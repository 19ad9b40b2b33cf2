package ca.gc.cra.guardian.application.port;

import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * <strong>What:</strong> Port persisting safety incidents for the parent dashboard.
 * <p><strong>Why:</strong> Decouples the safety stage from the storage technology; any keyed store that can be
 * queried by child and time range satisfies the contract.</p>
 * <p><strong>Role:</strong> Application port implemented by the NDJSON and in-memory adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #record(SafetyIncident)} calls
 * from different sessions.</p>
 *
 * @since 1.0.0
 */
public interface IncidentStorePort extends AutoCloseable {
  /**
   * Persists one incident.
   *
   * @param incident incident to store; must not be {@code null}
   * @throws IOException when the incident cannot be written
   */
  void record(SafetyIncident incident) throws IOException;

  /**
   * Returns a child's incidents whose timestamp lies in {@code [from, to)}, oldest first.
   *
   * @param childId child profile identifier
   * @param from inclusive lower bound
   * @param to exclusive upper bound
   * @return matching incidents ordered by timestamp
   * @throws IOException when stored incidents cannot be read
   */
  List<SafetyIncident> findByChild(String childId, Instant from, Instant to) throws IOException;

  /**
   * Releases resources held by the store.
   *
   * @throws IOException when closing fails
   */
  @Override
  default void close() throws IOException {}
}
