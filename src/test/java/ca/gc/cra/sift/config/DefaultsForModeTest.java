package ca.gc.cra.sift.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void analyzeDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Analyze ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("4", defaults.get("workers"));
    assertEquals("false", defaults.get("dryRun"));
    assertTrue(defaults.get("out").endsWith("analysis_result.json"));
    assertTrue(!defaults.containsKey("in"), "input has no default");
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
