package ca.gc.cra.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AnalyzeCliTest {
  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F'};
  private static final byte[] OGG = "OggS\0\u0002\0\0".getBytes(StandardCharsets.ISO_8859_1);

  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(AnalyzeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = AnalyzeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("PRISM analyze"));
    assertTrue(buffer.toString().contains("backpressure=BLOCK|REJECT"));
  }

  @Test
  void missingFilesIsInvalid() {
    ExitCode code = AnalyzeCli.run(new String[] {"priority=high"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
    assertTrue(hasLogContaining("files must list at least one path"));
  }

  @Test
  void dryRunPrintsPlanWithoutAnalyzing() {
    ExitCode code = AnalyzeCli.run(new String[] {
        "files=/media/a.mp4, /media/b.JPG", "priority=3", "submitter=ops", "queue.critical=5",
        "modelBase=" + tempDir.resolve("models"), "--dry-run"});

    String out = buffer.toString();
    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(out.contains("Analyze dry-run"), out);
    assertTrue(out.contains("Job: /media/a.mp4 kind=video priority=critical submitter=ops"), out);
    assertTrue(out.contains("Job: /media/b.JPG kind=image priority=critical submitter=ops"), out);
    assertTrue(out.contains("Tier critical: 2 worker(s), queue capacity 5"), out);
  }

  @Test
  void dryRunReportsWaitBudget() {
    ExitCode code = AnalyzeCli.run(new String[] {
        "files=/media/a.mp4", "submitter=ops", "waitSeconds=45", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(" Wait: 45 s"), buffer.toString());
  }

  @Test
  void explicitKindOverridesExtension() {
    ExitCode code = AnalyzeCli.run(new String[] {
        "files=/media/recording.bin", "kind=audio", "submitter=ops", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Job: /media/recording.bin kind=audio"));
  }

  @Test
  void uninferableKindIsInvalid() {
    ExitCode code = AnalyzeCli.run(new String[] {"files=/media/report.pdf", "submitter=ops", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("cannot infer kind"));
  }

  @Test
  void invalidPriorityAndNumbersAreRejected() {
    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"files=/a.jpg", "priority=5", "--dry-run"}));
    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"files=/a.jpg", "waitSeconds=-1", "--dry-run"}));
    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"files=/a.jpg", "offerTimeoutMs=100", "--dry-run"}));
    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"files=/a.jpg", "metricsExporter=statsd", "--dry-run"}));
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = AnalyzeCli.run(new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "files=/a.jpg", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Configuration file not found"));
  }

  @Test
  void yamlSuppliesFilesAndCliWins() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("prism.yaml"), """
        analyze:
          files: [/media/from-yaml.wav]
          priority: high
          submitter: yaml-user
        """);

    ExitCode code = AnalyzeCli.run(new String[] {"config=" + yaml, "priority=normal", "--dry-run"});

    String out = buffer.toString();
    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(out.contains("Job: /media/from-yaml.wav kind=audio priority=normal submitter=yaml-user"), out);
    assertTrue(hasLogContaining("CLI overrides YAML for key: priority"));
  }

  @Test
  void analyzesFilesAndPrintsJsonLines() throws IOException {
    Path models = modelDirectory();
    Path image = Files.write(tempDir.resolve("face.jpg"), JPEG);
    Path audio = Files.write(tempDir.resolve("voice.ogg"), OGG);

    ExitCode code = AnalyzeCli.run(new String[] {
        "files=" + image + "," + audio, "submitter=ops", "modelBase=" + models, "waitSeconds=30", "--metrics"});

    List<String> lines = buffer.toString().lines().toList();
    assertEquals(ExitCode.SUCCESS, code, buffer.toString());
    assertEquals(3, lines.size(), buffer.toString());
    assertTrue(lines.get(0).contains("\"status\":\"completed\""), lines.get(0));
    assertTrue(lines.get(0).contains("\"verdict\":\"AUTHENTIC\""), lines.get(0));
    assertTrue(lines.get(1).contains("\"fileKind\":\"audio\""), lines.get(1));
    assertTrue(lines.get(2).startsWith("{\"total\":2,"), lines.get(2));
    assertTrue(lines.get(2).contains("\"successRate\":100.0"), lines.get(2));
  }

  @Test
  void failedJobYieldsAnalysisFailedExitCode() throws IOException {
    Path models = modelDirectory();
    Path empty = Files.write(tempDir.resolve("empty.png"), new byte[0]);

    ExitCode code = AnalyzeCli.run(new String[] {
        "files=" + empty, "submitter=ops", "modelBase=" + models, "waitSeconds=30"});

    assertEquals(ExitCode.ANALYSIS_FAILED, code);
    assertTrue(buffer.toString().contains("\"kind\":\"DETECTOR_ERROR\""), buffer.toString());
    assertTrue(buffer.toString().contains("File is empty"), buffer.toString());
  }

  @Test
  void missingModelIsAnIoError() {
    ExitCode code = AnalyzeCli.run(new String[] {
        "files=/media/a.jpg", "submitter=ops", "modelBase=" + tempDir.resolve("no-models")});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(hasLogContaining("Unable to load model deepfake_detector"));
  }

  private Path modelDirectory() throws IOException {
    Path models = Files.createDirectories(tempDir.resolve("models"));
    Files.writeString(models.resolve("deepfake_detector.onnx"), "weights");
    return models;
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
