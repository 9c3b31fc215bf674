package ca.gc.cra.prism.api;

import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.scheduler.AnalysisNotFoundException;
import ca.gc.cra.prism.application.scheduler.AnalysisScheduler;
import ca.gc.cra.prism.application.scheduler.AnalysisTimeoutException;
import ca.gc.cra.prism.application.scheduler.QueueFullException;
import ca.gc.cra.prism.application.scheduler.SchedulerStateException;
import ca.gc.cra.prism.application.scheduler.SubmissionRequest;
import ca.gc.cra.prism.config.CompositionRoot;
import ca.gc.cra.prism.config.ConfigMerger;
import ca.gc.cra.prism.config.DefaultsForMode;
import ca.gc.cra.prism.config.SchedulerConfig;
import ca.gc.cra.prism.config.YamlConfigLoader;
import ca.gc.cra.prism.domain.analysis.AnalysisException;
import ca.gc.cra.prism.domain.analysis.FileKind;
import ca.gc.cra.prism.domain.analysis.JobRecord;
import ca.gc.cra.prism.domain.analysis.JobStatus;
import ca.gc.cra.prism.domain.analysis.Priority;
import ca.gc.cra.prism.infrastructure.json.JobRecordJsonWriter;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import ca.gc.cra.prism.validation.Numbers;
import ca.gc.cra.prism.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI entry point that queues media files on the analysis scheduler and prints one JSON line per job.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String MODE = "analyze";
  private static final int MAX_SUBMITTER_LENGTH = 128;
  private static final long MAX_WAIT_SECONDS = 86_400L;

  private static final String SUMMARY_USAGE =
      "usage: analyze files=PATH[,PATH...] [kind=auto|video|image|audio] [priority=normal|high|critical|1-3] "
          + "[submitter=NAME] [waitSeconds=N] [config=prism.yaml] [modelBase=DIR] [modelName=NAME] "
          + "[backpressure=BLOCK|REJECT] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[--dry-run] [--metrics] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      PRISM analyze

      Usage:
        analyze files=a.mp4,b.jpg [options]

      Required:
        files=PATH[,PATH...]         Media files to analyze

      Submission:
        kind=auto|video|image|audio  File kind; auto infers it from each extension (default auto)
        priority=TIER                normal|high|critical or 1-3 (default normal)
        submitter=NAME               Identity recorded on each job (default: OS user)
        waitSeconds=N                Total time to wait for results (default 300)

      Scheduler:
        workers.<tier>=N             Dispatcher threads per tier (defaults 2/2/2)
        queue.<tier>=N               Queue capacity per tier (defaults normal 100, high 50, critical 20)
        detectorThreads=N            Concurrent detector calls (default 4)
        backpressure=BLOCK|REJECT    Behaviour when a tier queue is full (default BLOCK)
        offerTimeoutMs=N             REJECT only: how long to wait for a slot (default 0)
        pollIntervalMs=N             Status poll interval while waiting (default 250)
        retentionHours=N             Age after which terminal jobs are removed (default 24)
        cleanupIntervalMinutes=N     Periodic cleanup interval; 0 disables (default 60)
        shutdownTimeoutSeconds=N     Drain budget before forcing shutdown (default 300)
        modelBase=DIR                Directory holding model artifacts (default ~/.prism/models)
        modelName=NAME               Model artifact to load (default deepfake_detector)

      Telemetry:
        metricsExporter=otlp|none    Metrics exporter (default none)
        otelEndpoint=URL             OTLP metrics endpoint
        otelResourceAttributes=K=V   Comma-separated OpenTelemetry resource attributes

      Flags:
        config=PATH                  YAML file with 'common' and 'analyze' sections
        --dry-run                    Validate inputs and print the plan without analyzing
        --metrics                    Print aggregate scheduler metrics after the results
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Exit codes:
        0 all jobs completed, 2 invalid arguments, 3 IO error, 4 configuration error,
        5 runtime failure, 6 a job failed or did not finish in time, 130 interrupted
      """;

  private AnalyzeCli() {}

  /**
   * Entry point for the {@code analyze} command.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the command without exiting the JVM.
   *
   * @param args CLI arguments
   * @return exit code describing the outcome
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean printMetrics = input.hasFlag("--metrics");

    Plan plan;
    try {
      plan = plan(input);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printPlan(plan);
      return ExitCode.SUCCESS;
    }
    return execute(plan, printMetrics);
  }

  private static Plan plan(CliInput input) {
    Map<String, String> cliArgs = CliArgsParser.toMap(input.keyValueArray());
    String configPath = ConfigCliUtils.extractConfigPath(cliArgs);
    Optional<Map<String, String>> yaml = loadYamlConfig(configPath);
    Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        MODE, yaml, cliArgs, DefaultsForMode.asFlatMap(MODE), log::warn));

    String exporter = TelemetryConfigurator.configureMetrics(effective);
    List<String> files = ConfigCliUtils.splitList(effective.get("files"));
    if (files.isEmpty()) {
      throw new IllegalArgumentException("files must list at least one path");
    }
    String kind = Strings.requireNonBlank("kind", effective.get("kind")).toLowerCase(Locale.ROOT);
    Priority priority = Priority.fromString(effective.get("priority"));
    String submitter = Strings.requirePrintableAscii("submitter", effective.get("submitter"), MAX_SUBMITTER_LENGTH);
    long waitSeconds = Numbers.parseRange("waitSeconds", effective.get("waitSeconds"), 0, MAX_WAIT_SECONDS);
    SchedulerConfig config = SchedulerConfig.fromMap(effective);

    List<SubmissionRequest> submissions = new ArrayList<>(files.size());
    for (String file : files) {
      FileKind fileKind = resolveKind(file, kind);
      submissions.add(new SubmissionRequest(file, fileKind.wireName(), submitter, priority.level()));
    }
    return new Plan(config, submissions, Duration.ofSeconds(waitSeconds), exporter);
  }

  private static FileKind resolveKind(String file, String kind) {
    if (!"auto".equals(kind)) {
      return FileKind.fromString(kind);
    }
    return FileKind.fromExtension(file)
        .orElseThrow(() -> new IllegalArgumentException(
            "cannot infer kind for " + file + "; pass kind=video|image|audio"));
  }

  private static Optional<Map<String, String>> loadYamlConfig(String configPath) {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path;
    try {
      path = Path.of(configPath);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config path is invalid: " + configPath, ex);
    }
    try {
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(path, MODE);
      if (yaml.isEmpty()) {
        log.error("Configuration file not found: {}", path);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      return yaml;
    } catch (IOException ex) {
      log.error("Failed to read configuration file {}", path, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static ExitCode execute(Plan plan, boolean printMetrics) {
    MetricsPort metrics = CompositionRoot.metricsFor(plan.exporter());
    AnalysisScheduler scheduler = new CompositionRoot(plan.config(), metrics).analysisScheduler();
    JobRecordJsonWriter json = new JobRecordJsonWriter();
    try (scheduler) {
      scheduler.start();
      List<String> ids = scheduler.batchSubmit(plan.submissions());
      log.info("Submitted {} job(s); waiting up to {} s", ids.size(), plan.waitBudget().toSeconds());

      int unsuccessful = 0;
      long deadline = System.nanoTime() + plan.waitBudget().toNanos();
      for (String id : ids) {
        Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
        JobRecord record;
        try {
          record = scheduler.waitForCompletion(id, remaining);
        } catch (AnalysisTimeoutException ex) {
          log.warn("{}", ex.getMessage());
          unsuccessful++;
          scheduler.getResult(id).map(json::write).ifPresent(CliPrinter::println);
          continue;
        }
        if (record.status() != JobStatus.COMPLETED) {
          unsuccessful++;
        }
        CliPrinter.println(json.write(record));
      }
      if (printMetrics) {
        CliPrinter.println(json.write(scheduler.getMetrics()));
      }
      if (unsuccessful > 0) {
        log.warn("{} of {} job(s) did not complete", unsuccessful, ids.size());
        return ExitCode.ANALYSIS_FAILED;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to load model {} from {}: {}",
          plan.config().settings().modelName(), plan.config().modelBase(), ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (AnalysisException ex) {
      log.error("Detector initialization failed: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (QueueFullException ex) {
      log.error("Submission rejected: {}", ex.getMessage());
      return ExitCode.ANALYSIS_FAILED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Analysis interrupted");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid submission: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (SchedulerStateException | AnalysisNotFoundException ex) {
      log.error("Analysis aborted: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Analysis failed unexpectedly", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeMetrics(metrics);
    }
  }

  private static void printPlan(Plan plan) {
    List<String> lines = new ArrayList<>();
    lines.add("Analyze dry-run: no files will be analyzed.");
    lines.add(" Model: " + plan.config().modelBase().resolve(plan.config().settings().modelName()));
    lines.add(" Backpressure: " + plan.config().settings().backpressure());
    for (Priority priority : Priority.values()) {
      var tier = plan.config().settings().tier(priority);
      lines.add(String.format(Locale.ROOT, " Tier %s: %d worker(s), queue capacity %d",
          priority.wireName(), tier.workers(), tier.queueCapacity()));
    }
    lines.add(" Detector threads: " + plan.config().settings().detectorThreads());
    lines.add(" Metrics exporter: " + plan.exporter());
    lines.add(" Wait: " + plan.waitBudget().toSeconds() + " s");
    for (SubmissionRequest submission : plan.submissions()) {
      lines.add(String.format(Locale.ROOT, " Job: %s kind=%s priority=%s submitter=%s",
          submission.fileRef(), submission.fileKind(),
          Priority.fromLevel(submission.priority()).wireName(), submission.submitter()));
    }
    lines.add(" Re-run without --dry-run to start analysis.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }

  private record Plan(
      SchedulerConfig config, List<SubmissionRequest> submissions, Duration waitBudget, String exporter) {
    Plan {
      submissions = List.copyOf(submissions);
    }
  }

  private static final class CliAbort extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
