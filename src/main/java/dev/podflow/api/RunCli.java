package dev.podflow.api;

import dev.podflow.api.CliSupport.CliAbort;
import dev.podflow.application.pipeline.WorkflowCoordinator;
import dev.podflow.config.CompositionRoot;
import dev.podflow.config.DefaultsForMode;
import dev.podflow.config.PodflowConfig;
import dev.podflow.domain.error.ConfigurationException;
import dev.podflow.domain.error.MissingInputException;
import dev.podflow.domain.workflow.EpisodeMetadata;
import dev.podflow.domain.workflow.StageFailure;
import dev.podflow.domain.workflow.WorkflowRequest;
import dev.podflow.domain.workflow.WorkflowResult;
import dev.podflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.podflow.infrastructure.report.ReportWriter;
import dev.podflow.infrastructure.time.SystemClockAdapter;
import dev.podflow.logging.LoggingConfigurator;
import dev.podflow.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point running the full pipeline for one audio file.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: run audio=PATH [language=TAG] [title=TEXT] [tags=A,B] [config=FILE] [report=FILE] "
          + "[--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      podflow run: audio -> transcript -> content -> publishing

      Usage:
        run audio=PATH [options]

      Inputs:
        audio=PATH                Raw episode audio (WAV, AIFF or AU)
        language=TAG              Language tag such as en-US (default from config)
        transcriptDir=PATH        Directory searched for <name>.<lang>.txt before the audio's directory

      Episode metadata:
        episodeId=ID              Use this id instead of generating one
        title=TEXT                Override the generated title
        tags=A,B                  Comma separated tags
        category=TEXT             Category (default Technology)
        explicit=true|false       Explicit content flag
        episodeNumber=N           Episode number
        seasonNumber=N            Season number
        publicationDate=YYYY-MM-DD Scheduled date (default today)
        author=TEXT               Author credit
        copyright=TEXT            Copyright notice

      Global options:
        config=FILE               YAML file with common/run sections
        report=FILE               Write the run result as JSON
        art19.enabled=BOOL        Also website.enabled and twitter.enabled
        metricsExporter=otlp|none OpenTelemetry exporter (default none)
        --dry-run                 Print the resolved plan without running
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private RunCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the run command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.warn("Ignoring unknown flags: {}", input.unknownFlags());
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.settings()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PodflowConfig config;
    WorkflowRequest request;
    try {
      Path audio = CliSupport.requiredPath(cliKv, "audio", SUMMARY_USAGE);
      config = CliSupport.typedConfig(
          CliSupport.effectiveConfig(DefaultsForMode.MODE_RUN, cliKv, SUMMARY_USAGE));
      EpisodeMetadata metadata = CliSupport.metadata(cliKv);
      request = new WorkflowRequest(audio, config.language(), metadata);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path report = Strings.optional(cliKv.get("report")).map(Path::of).orElse(null);

    try (OpenTelemetryMetricsAdapter metrics = CliSupport.metrics(config, DefaultsForMode.MODE_RUN)) {
      CompositionRoot root = new CompositionRoot(config, metrics, new SystemClockAdapter());
      if (input.dryRun()) {
        printDryRunPlan(config, request, root);
        return ExitCode.SUCCESS;
      }
      WorkflowCoordinator coordinator = root.workflowCoordinator();
      WorkflowResult result = coordinator.run(request);
      metrics.forceFlush();
      printResult(result);
      if (report != null) {
        new ReportWriter().write(result, report);
        log.info("Run report written to {}", report);
      }
      return exitCodeFor(result);
    } catch (MissingInputException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (ConfigurationException ex) {
      log.error("Pipeline configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to write report {}", report, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in run pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Maps a terminal result to the process exit code.
   *
   * @param result run result
   * @return {@link ExitCode#SUCCESS} for completed runs, otherwise a failure code derived from the cause
   */
  static ExitCode exitCodeFor(WorkflowResult result) {
    if (result.success()) {
      return ExitCode.SUCCESS;
    }
    Throwable cause = result.failure().flatMap(StageFailure::cause).orElse(null);
    if (cause instanceof ConfigurationException) {
      return ExitCode.CONFIG_ERROR;
    }
    if (cause instanceof InterruptedException) {
      return ExitCode.INTERRUPTED;
    }
    return ExitCode.STAGE_FAILED;
  }

  private static void printResult(WorkflowResult result) {
    CliPrinter.println("Run " + result.runId() + ": " + result.state() + " in " + result.durationMillis() + " ms");
    result.failure().ifPresent(f -> CliPrinter.field("Failure", f.describe()));
    result.publishing().ifPresent(CliSupport::printOutcome);
  }

  private static void printDryRunPlan(PodflowConfig config, WorkflowRequest request, CompositionRoot root) {
    CliPrinter.println("Run dry-run: no audio will be processed and nothing will be published.");
    CliPrinter.field("Audio", request.audioRef());
    CliPrinter.field("Language", request.languageCode());
    CliPrinter.field("Work directory", config.workDir());
    CliPrinter.field("Transcript dir", config.transcriptDir().map(Path::toString).orElse("<next to audio>"));
    CliPrinter.field("Content", config.anthropic().apiKey().isPresent()
        ? "anthropic " + config.anthropic().model() + " with fallback"
        : "transcript-derived fallback");
    CliPrinter.field("Platforms", CliSupport.describePlatforms(root));
    CliPrinter.field("Publish workers", config.publishWorkers());
    CliPrinter.field("Metrics exporter", config.metrics().exporter());
    CliPrinter.println(" Re-run without --dry-run to execute.");
  }
}
