package ca.gc.cra.guardian.infrastructure.persistence;

import ca.gc.cra.guardian.application.port.IncidentStorePort;
import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Incident store kept in memory; used by tests and by the {@code evaluate} CLI when no store directory is given.
 *
 * @since 1.0.0
 */
public final class InMemoryIncidentStoreAdapter implements IncidentStorePort {
  private final List<SafetyIncident> incidents = new CopyOnWriteArrayList<>();

  @Override
  public void record(SafetyIncident incident) {
    incidents.add(Objects.requireNonNull(incident, "incident"));
  }

  @Override
  public List<SafetyIncident> findByChild(String childId, Instant from, Instant to) {
    Objects.requireNonNull(childId, "childId");
    return incidents.stream()
        .filter(incident -> incident.childId().equals(childId))
        .filter(incident -> !incident.timestamp().isBefore(from) && incident.timestamp().isBefore(to))
        .sorted(Comparator.comparing(SafetyIncident::timestamp))
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Returns every stored incident in insertion order.
   *
   * @return immutable snapshot
   */
  public List<SafetyIncident> snapshot() {
    return List.copyOf(incidents);
  }
}
