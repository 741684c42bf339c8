package ca.gc.cra.sift.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for SIFT CLI and configuration flows.
 * <p><strong>Why:</strong> Fails fast on unreadable inputs and unusable artifact locations before any worker
 * thread is started.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses operator-supplied text into an absolute, normalized path.
   *
   * @param name logical parameter name for diagnostics
   * @param value raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, contains control characters, or is not a valid path
   */
  public static Path parse(String name, String value) {
    String text = Strings.requireNonBlank(name, value);
    try {
      return Path.of(text).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + text, ex);
    }
  }

  /**
   * Validates that {@code path} names an existing, readable regular file.
   *
   * @param path candidate input file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("input is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input file is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that an artifact can be written at {@code path}.
   * <p>The nearest existing ancestor must be a writable directory; missing parents are created at write time.
   * An existing target must not be a directory.</p>
   *
   * @param path candidate artifact location
   * @return absolute normalized path
   * @throws IllegalArgumentException if the location cannot hold a file
   */
  public static Path validateWritableFile(Path path) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    Path ancestor = normalized.getParent();
    while (ancestor != null && !Files.exists(ancestor, LinkOption.NOFOLLOW_LINKS)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null) {
      throw new IllegalArgumentException("no existing ancestor for " + normalized);
    }
    if (!Files.isDirectory(ancestor)) {
      throw new IllegalArgumentException("parent is not a directory: " + ancestor);
    }
    if (!Files.isWritable(ancestor)) {
      throw new IllegalArgumentException("directory is not writable: " + ancestor);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
