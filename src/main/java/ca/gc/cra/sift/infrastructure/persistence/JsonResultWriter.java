package ca.gc.cra.sift.infrastructure.persistence;

import ca.gc.cra.sift.application.port.ResultWriter;
import ca.gc.cra.sift.domain.tally.AnalysisResult;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ResultWriter} that stores the analysis result as a pretty-printed UTF-8 JSON object.
 * <p><strong>Format:</strong> findings are written as {@code {"<ip>": <count>, ...}} ordered by descending count
 * then ascending address; the sentinel is written as {@code {"message": "<text>"}}.</p>
 * <p><strong>Durability:</strong> bytes go to a sibling {@code .tmp} file that is moved over the target, so
 * readers never observe a partial artifact and a failed write leaves the previous artifact in place.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized; the root rank is the only writer.</p>
 *
 * @since 0.1.0
 */
public final class JsonResultWriter implements ResultWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonResultWriter.class);
  static final String TEMP_SUFFIX = ".tmp";

  private final JsonFactory factory = new JsonFactory();
  private final Path target;

  /**
   * Creates a writer for a fixed artifact location.
   *
   * @param target artifact path; parent directories are created on write
   */
  public JsonResultWriter(Path target) {
    this.target = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
  }

  public Path target() {
    return target;
  }

  @Override
  public Path write(AnalysisResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
    try {
      try (OutputStream out = Files.newOutputStream(temp,
              StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
           JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
        generator.useDefaultPrettyPrinter();
        writeResult(generator, result);
        generator.writeRaw('\n');
      }
      moveIntoPlace(temp);
    } catch (IOException | RuntimeException ex) {
      deleteQuietly(temp, ex);
      throw ex;
    }
    return target;
  }

  private static void writeResult(JsonGenerator generator, AnalysisResult result) throws IOException {
    generator.writeStartObject();
    if (result instanceof AnalysisResult.Findings findings) {
      for (Map.Entry<String, Long> entry : findings.tally().ranked().entrySet()) {
        generator.writeNumberField(entry.getKey(), entry.getValue());
      }
    } else if (result instanceof AnalysisResult.NoFindings none) {
      generator.writeStringField("message", none.message());
    }
    generator.writeEndObject();
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp, Exception primary) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanup) {
      primary.addSuppressed(cleanup);
    }
  }
}
