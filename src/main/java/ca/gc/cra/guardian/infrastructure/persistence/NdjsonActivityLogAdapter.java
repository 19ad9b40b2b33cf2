package ca.gc.cra.guardian.infrastructure.persistence;

import ca.gc.cra.guardian.application.port.ActivityLogPort;
import ca.gc.cra.guardian.domain.pipeline.ActivityRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link ActivityLogPort} appending one JSON line per turn to {@code <directory>/activity.ndjson}.
 * <p>Synchronized; each record is flushed before {@link #append(ActivityRecord)} returns.</p>
 *
 * @since 1.0.0
 */
public final class NdjsonActivityLogAdapter implements ActivityLogPort {
  /** File name used inside the log directory. */
  public static final String FILE_NAME = "activity.ndjson";

  private final Path file;
  private final RecordJsonCodec codec = new RecordJsonCodec();
  private BufferedWriter writer;

  /**
   * Opens (creating when needed) the activity file under {@code directory}.
   *
   * @param directory log directory
   * @throws IOException when the directory or file cannot be created
   */
  public NdjsonActivityLogAdapter(Path directory) throws IOException {
    Files.createDirectories(Objects.requireNonNull(directory, "directory"));
    this.file = directory.resolve(FILE_NAME);
    this.writer = Files.newBufferedWriter(
        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  /** @return backing file */
  public Path file() {
    return file;
  }

  @Override
  public synchronized void append(ActivityRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    if (writer == null) {
      throw new IOException("Activity log at " + file + " is closed");
    }
    writer.write(codec.encode(record));
    writer.newLine();
    writer.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer != null) {
      try {
        writer.flush();
      } finally {
        writer.close();
        writer = null;
      }
    }
  }
}
