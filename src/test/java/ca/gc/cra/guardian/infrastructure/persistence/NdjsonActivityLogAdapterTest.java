package ca.gc.cra.guardian.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonActivityLogAdapterTest {

  @TempDir
  Path dir;

  @Test
  void appendsOneJsonObjectPerLine() throws Exception {
    try (NdjsonActivityLogAdapter log = new NdjsonActivityLogAdapter(dir)) {
      log.append(new ActivityRecord(Instant.parse("2026-06-01T09:00:00Z"), "s-1", "child-a", "middle",
          "I feel lonely", 42, false, List.of("keyword_lonely")));
      log.append(new ActivityRecord(Instant.parse("2026-06-01T09:01:00Z"), "s-1", "child-a", "middle",
          "what is a prime", 18, true, List.of()));
    }

    List<String> lines = Files.readAllLines(dir.resolve(NdjsonActivityLogAdapter.FILE_NAME));
    assertEquals(2, lines.size());
    assertEquals(List.of("keyword_lonely"), alerts(lines.get(0)));
    assertEquals(List.of(), alerts(lines.get(1)));
  }

  @Test
  void closedLogRejectsAppends() throws Exception {
    NdjsonActivityLogAdapter log = new NdjsonActivityLogAdapter(dir);
    log.close();

    assertThrows(IOException.class, () -> log.append(new ActivityRecord(
        Instant.EPOCH, "s-1", "child-a", "high", "", 0, false, List.of())));
  }

  private static List<String> alerts(String line) throws IOException {
    List<String> values = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(line)) {
      while (parser.nextToken() != null) {
        if (parser.currentToken() == JsonToken.FIELD_NAME && "alerts".equals(parser.getCurrentName())) {
          parser.nextToken();
          while (parser.nextToken() != JsonToken.END_ARRAY) {
            values.add(parser.getText());
          }
        }
      }
    }
    return values;
  }
}
