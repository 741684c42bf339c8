package ca.gc.cra.sift.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AnalyzeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(AnalyzeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"workers=2"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
    assertTrue(loggedError("in is required"));
  }

  @Test
  void nonexistentInputReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"in=" + tempDir.resolve("absent.log")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("does not exist"));
  }

  @Test
  void unsupportedExtensionReturnsInvalidArgs() throws IOException {
    Path input = Files.writeString(tempDir.resolve("capture.pcap"), "1.1.1.1");

    ExitCode code = AnalyzeCli.run(new String[] {
        "in=" + input, "out=" + tempDir.resolve("result.json")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Unsupported file type: .pcap"));
    assertFalse(Files.exists(tempDir.resolve("result.json")));
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"in"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotWriteArtifact() throws IOException {
    Path input = Files.writeString(tempDir.resolve("auth.log"), "seen 1.1.1.1\n");
    Path output = tempDir.resolve("out").resolve("result.json");

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + input, "out=" + output, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Analyze dry-run"));
    assertTrue(text.contains("LINES"));
    assertFalse(Files.exists(output.getParent()), "dry-run should not create output directory");
  }

  @Test
  void successfulRunWritesArtifactAndSummary() throws IOException {
    Path input = Files.writeString(tempDir.resolve("flows.csv"),
        "src_ip,label\n9.9.9.9,benign\n9.9.9.9,exploit\n", StandardCharsets.UTF_8);
    Path output = tempDir.resolve("out").resolve("result.json");

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + input, "out=" + output, "workers=3"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(output));
    assertTrue(Files.readString(output).contains("\"9.9.9.9\" : 1"));
    assertTrue(buffer.toString().contains("Analysis complete. 1 suspicious IPs found; results saved at: "));
  }

  @Test
  void yamlSuppliesInputAndCliOverridesWithWarning() throws IOException {
    Path input = Files.writeString(tempDir.resolve("auth.log"), "seen 1.1.1.1\n");
    Path output = tempDir.resolve("result.json");
    Path yaml = Files.writeString(tempDir.resolve("sift.yaml"), """
        analyze:
          in: %s
          workers: 2
        """.formatted(input));

    ExitCode code = AnalyzeCli.run(new String[] {
        "config=" + yaml, "workers=1", "out=" + output});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(output));
    boolean warned = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("CLI overrides YAML for key: workers"));
    assertTrue(warned);
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"config=" + tempDir.resolve("missing.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Configuration file does not exist"));
  }

  @Test
  void malformedConfigReturnsConfigError() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "analyze: [unclosed\n");

    assertEquals(ExitCode.CONFIG_ERROR, AnalyzeCli.run(new String[] {"config=" + yaml}));
  }

  @Test
  void unreadableJsonReturnsIoError() throws IOException {
    Path input = Files.writeString(tempDir.resolve("events.json"), "[\"open\", ");

    ExitCode code = AnalyzeCli.run(new String[] {
        "in=" + input, "out=" + tempDir.resolve("result.json")});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(loggedError("Unable to load"));
    assertFalse(Files.exists(tempDir.resolve("result.json")));
  }

  @Test
  void helpPrintsDetailedUsage() {
    assertEquals(ExitCode.SUCCESS, AnalyzeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("SIFT analyze pipeline"));
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains(fragment));
  }
}
