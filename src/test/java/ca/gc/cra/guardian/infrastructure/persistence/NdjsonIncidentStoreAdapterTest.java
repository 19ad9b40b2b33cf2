package ca.gc.cra.guardian.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.guardian.domain.safety.IncidentAction;
import ca.gc.cra.guardian.domain.safety.SafetyCategory;
import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import ca.gc.cra.guardian.domain.safety.SeverityLevel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonIncidentStoreAdapterTest {
  private static final Instant T0 = Instant.parse("2026-06-01T09:00:00Z");

  @TempDir
  Path dir;

  @Test
  void returnsChildIncidentsInRangeOldestFirst() throws Exception {
    try (NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(dir.resolve("store"))) {
      store.record(incident("i-3", T0.plusSeconds(300), "child-a"));
      store.record(incident("i-1", T0, "child-a"));
      store.record(incident("i-x", T0.plusSeconds(100), "child-b"));
      store.record(incident("i-2", T0.plusSeconds(200), "child-a"));

      List<SafetyIncident> found = store.findByChild("child-a", T0, T0.plusSeconds(300));

      assertEquals(List.of("i-1", "i-2"), found.stream().map(SafetyIncident::id).toList());
      assertEquals(incident("i-1", T0, "child-a"), found.get(0));
    }
  }

  @Test
  void incidentsSurviveReopen() throws Exception {
    try (NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(dir)) {
      store.record(incident("i-1", T0, "child-a"));
    }
    try (NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(dir)) {
      store.record(incident("i-2", T0.plusSeconds(1), "child-a"));
      assertEquals(2, store.findByChild("child-a", Instant.EPOCH, Instant.MAX).size());
    }
    List<String> lines = Files.readAllLines(dir.resolve(NdjsonIncidentStoreAdapter.FILE_NAME));
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).contains("\"action\":\"blocked_and_redirected\""), lines.get(0));
  }

  @Test
  void corruptLineIsReportedWithItsNumber() throws Exception {
    try (NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(dir)) {
      store.record(incident("i-1", T0, "child-a"));
      Files.writeString(store.file(), "\n{\"id\":\"i-2\",\"timestamp\":\"yesterday\"}\n",
          StandardCharsets.UTF_8, StandardOpenOption.APPEND);

      IOException ex = assertThrows(IOException.class,
          () -> store.findByChild("child-a", Instant.EPOCH, Instant.MAX));
      assertTrue(ex.getMessage().contains("incidents.ndjson line 3"), ex.getMessage());
    }
  }

  @Test
  void closedStoreRejectsWritesAndCloseIsIdempotent() throws Exception {
    NdjsonIncidentStoreAdapter store = new NdjsonIncidentStoreAdapter(dir);
    store.close();
    store.close();

    assertThrows(IOException.class, () -> store.record(incident("i-1", T0, "child-a")));
  }

  private static SafetyIncident incident(String id, Instant at, String child) {
    return new SafetyIncident(id, at, child, 9, "session-1", "what is your \"home\" address",
        SafetyCategory.PERSONAL_INFO, SeverityLevel.SEVERE, IncidentAction.BLOCKED_AND_REDIRECTED, true);
  }
}
