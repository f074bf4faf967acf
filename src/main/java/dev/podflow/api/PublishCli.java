package dev.podflow.api;

import dev.podflow.api.CliSupport.CliAbort;
import dev.podflow.application.pipeline.PublishingCoordinator;
import dev.podflow.config.CompositionRoot;
import dev.podflow.config.DefaultsForMode;
import dev.podflow.config.PodflowConfig;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.error.ConfigurationException;
import dev.podflow.domain.publish.PublishingOutcome;
import dev.podflow.domain.workflow.EpisodeMetadata;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.podflow.infrastructure.report.ReportWriter;
import dev.podflow.infrastructure.time.SystemClockAdapter;
import dev.podflow.logging.LoggingConfigurator;
import dev.podflow.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point re-publishing an episode whose content was already generated.
 *
 * @since 0.1.0
 */
public final class PublishCli {
  private static final Logger log = LoggerFactory.getLogger(PublishCli.class);
  private static final String SUMMARY_USAGE =
      "usage: publish audio=PATH content=FILE.json [title=TEXT] [config=FILE] [report=FILE] "
          + "[--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      podflow publish: fan an episode out to the enabled platforms

      Usage:
        publish audio=PATH content=FILE.json [options]

      Inputs:
        audio=PATH                Processed episode audio
        content=FILE.json         Generated content with title, description, show_notes,
                                  optional summary, social_media and metadata objects
        language=TAG              Content language (default from config)

      Episode metadata:
        episodeId, title, tags, category, explicit, episodeNumber, seasonNumber,
        publicationDate, author, copyright (see run --help)

      Global options:
        config=FILE               YAML file with common/publish sections
        report=FILE               Write the publishing outcome as JSON
        publishWorkers=N          Maximum concurrent platform requests
        --dry-run                 Print enabled platforms without publishing
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private PublishCli() {}

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
   * Executes the publish command and returns a normalized exit code.
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
      log.debug("Verbose logging enabled for publish CLI");
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

    Path audio;
    Path contentFile;
    PodflowConfig config;
    EpisodeMetadata metadata;
    try {
      audio = CliSupport.requiredPath(cliKv, "audio", SUMMARY_USAGE);
      contentFile = CliSupport.requiredPath(cliKv, "content", SUMMARY_USAGE);
      config = CliSupport.typedConfig(
          CliSupport.effectiveConfig(DefaultsForMode.MODE_PUBLISH, cliKv, SUMMARY_USAGE));
      metadata = CliSupport.metadata(cliKv);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!Files.isRegularFile(audio)) {
      log.error("Audio file not found: {}", audio);
      return ExitCode.IO_ERROR;
    }

    GeneratedContent content;
    try {
      content = readContent(contentFile, new JsonSupport());
    } catch (IOException ex) {
      log.error("Unable to read content file {}", contentFile, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid content file {}: {}", contentFile, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    Path report = Strings.optional(cliKv.get("report")).map(Path::of).orElse(null);

    try (OpenTelemetryMetricsAdapter metrics = CliSupport.metrics(config, DefaultsForMode.MODE_PUBLISH)) {
      CompositionRoot root = new CompositionRoot(config, metrics, new SystemClockAdapter());
      if (input.dryRun()) {
        CliPrinter.println("Publish dry-run: nothing will be published.");
        CliPrinter.field("Audio", audio);
        CliPrinter.field("Title", metadata.title().orElse(content.title()));
        CliPrinter.field("Language", config.language());
        CliPrinter.field("Platforms", CliSupport.describePlatforms(root));
        CliPrinter.field("Publish workers", config.publishWorkers());
        return ExitCode.SUCCESS;
      }
      PublishingCoordinator coordinator = root.publishingCoordinator();
      PublishingOutcome outcome = coordinator.publish(audio, content, metadata, config.language());
      metrics.forceFlush();
      CliPrinter.println("Publish " + (outcome.allFailed() ? "failed on every platform" : "completed"));
      CliSupport.printOutcome(outcome);
      if (report != null) {
        new ReportWriter().write(outcome, report);
        log.info("Publishing report written to {}", report);
      }
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Publishing configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Content rejected: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to write report {}", report, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in publish pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Reads generated content from a JSON document using the snake-case field names of run reports.
   *
   * @param file JSON document
   * @param json JSON helper
   * @return content; required fields may be missing and are rejected by the assembler
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is not a JSON object
   */
  static GeneratedContent readContent(Path file, JsonSupport json) throws IOException {
    Object root = json.parse(Files.readString(file, StandardCharsets.UTF_8));
    if (!(root instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("content document must be a JSON object");
    }
    Object document = JsonSupport.at(root, "content").filter(Map.class::isInstance).orElse(root);
    return new GeneratedContent(
        JsonSupport.text(document, "title").orElse(null),
        JsonSupport.text(document, "description").orElse(null),
        JsonSupport.text(document, "show_notes").orElse(null),
        JsonSupport.text(document, "summary"),
        stringMap(document, "social_media"),
        stringMap(document, "metadata"),
        JsonSupport.at(document, "fallback").map(Boolean.TRUE::equals).orElse(false));
  }

  private static Map<String, String> stringMap(Object document, String field) {
    Map<String, String> values = new LinkedHashMap<>();
    JsonSupport.at(document, field).ifPresent(node -> {
      if (node instanceof Map<?, ?> map) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
          JsonSupport.text(map, String.valueOf(e.getKey()))
              .ifPresent(v -> values.put(String.valueOf(e.getKey()), v));
        }
      }
    });
    return values;
  }
}
