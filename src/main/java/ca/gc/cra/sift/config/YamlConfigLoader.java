package ca.gc.cra.sift.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads SIFT configuration from a YAML document and flattens the {@code common} and mode sections into
 * dotted key/value pairs.
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * analyze:
 *   workers: 8
 *   out: /var/lib/sift/analysis_result.json
 * }</pre>
 *
 * <p>Mode keys win over {@code common} keys. Scalar lists are joined with commas.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration; must exist
   * @param mode pipeline mode ({@code analyze})
   * @return flat map containing merged configuration; empty for an empty document
   * @throws NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Map<String, String> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "config file not found");
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Map.of();
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    Object common = section(root, "common");
    if (common != null) {
      flatten(asMap(common, "common"), "", flattened);
    }
    Object modeSection = section(root, normalizedMode);
    if (modeSection != null) {
      flatten(asMap(modeSection, normalizedMode), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof List<?> list) {
        target.put(composite, joinScalars(composite, list));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, List<?> values) {
    List<String> parts = new ArrayList<>(values.size());
    for (Object value : values) {
      if (value instanceof Map<?, ?> || value instanceof List<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain scalars only");
      }
      parts.add(value == null ? "" : value.toString());
    }
    return String.join(",", parts);
  }
}
