package ca.gc.cra.guardian.infrastructure.persistence;

import ca.gc.cra.guardian.application.port.IncidentStorePort;
import ca.gc.cra.guardian.domain.safety.SafetyIncident;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link IncidentStorePort} that appends one JSON object per line to
 * {@code <directory>/incidents.ndjson}.
 * <p><strong>Why:</strong> A flat append-only file is enough for a single tutor host and can be tailed or shipped
 * by any log collector.</p>
 * <p><strong>Thread-safety:</strong> Methods are synchronized so a query never observes a half-written line.</p>
 * <p><strong>Failure model:</strong> A line that cannot be decoded fails the whole query with an
 * {@link IOException} naming the line number.</p>
 *
 * @since 1.0.0
 */
public final class NdjsonIncidentStoreAdapter implements IncidentStorePort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonIncidentStoreAdapter.class);

  /** File name used inside the store directory. */
  public static final String FILE_NAME = "incidents.ndjson";

  private final Path file;
  private final RecordJsonCodec codec = new RecordJsonCodec();
  private BufferedWriter writer;

  /**
   * Opens (creating when needed) the incident file under {@code directory}.
   *
   * @param directory store directory
   * @throws IOException when the directory or file cannot be created
   */
  public NdjsonIncidentStoreAdapter(Path directory) throws IOException {
    Files.createDirectories(Objects.requireNonNull(directory, "directory"));
    this.file = directory.resolve(FILE_NAME);
    this.writer = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    log.debug("Incident store opened at {}", file);
  }

  /**
   * Returns the backing file.
   *
   * @return path of {@value #FILE_NAME}
   */
  public Path file() {
    return file;
  }

  @Override
  public synchronized void record(SafetyIncident incident) throws IOException {
    Objects.requireNonNull(incident, "incident");
    if (writer == null) {
      throw new IOException("Incident store at " + file + " is closed");
    }
    writer.write(codec.encode(incident));
    writer.newLine();
    writer.flush();
  }

  @Override
  public synchronized List<SafetyIncident> findByChild(String childId, Instant from, Instant to)
      throws IOException {
    Objects.requireNonNull(childId, "childId");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (writer != null) {
      writer.flush();
    }
    List<SafetyIncident> matches = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        SafetyIncident incident;
        try {
          incident = codec.decodeIncident(line);
        } catch (IllegalArgumentException ex) {
          throw new IOException("Corrupt incident at " + file.getFileName() + " line " + lineNumber + ": "
              + ex.getMessage(), ex);
        }
        Instant ts = incident.timestamp();
        if (incident.childId().equals(childId) && !ts.isBefore(from) && ts.isBefore(to)) {
          matches.add(incident);
        }
      }
    }
    matches.sort(Comparator.comparing(SafetyIncident::timestamp));
    return List.copyOf(matches);
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer == null) {
      return;
    }
    try {
      writer.flush();
    } finally {
      writer.close();
      writer = null;
    }
  }
}
