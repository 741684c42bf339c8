package ca.gc.cra.sift.application.port;

import ca.gc.cra.sift.domain.tally.AnalysisResult;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Port serializing the final {@link AnalysisResult} for the presentation layer.
 * <p>Implementations overwrite the previous artifact so that readers observe either the old or the new
 * document, never a partial one.</p>
 *
 * @since 0.1.0
 */
public interface ResultWriter {
  /**
   * Writes {@code result} to the artifact location.
   *
   * @param result scan outcome; must not be {@code null}
   * @return path of the written artifact
   * @throws IOException when the artifact cannot be written
   */
  Path write(AnalysisResult result) throws IOException;
}
