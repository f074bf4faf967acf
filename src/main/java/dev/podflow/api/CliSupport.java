package dev.podflow.api;

import dev.podflow.config.CompositionRoot;
import dev.podflow.config.ConfigMerger;
import dev.podflow.config.DefaultsForMode;
import dev.podflow.config.PodflowConfig;
import dev.podflow.config.PodflowConfig.PlatformSettings;
import dev.podflow.config.YamlConfigLoader;
import dev.podflow.domain.publish.PlatformResult;
import dev.podflow.domain.publish.PublishingOutcome;
import dev.podflow.domain.workflow.EpisodeMetadata;
import dev.podflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.podflow.validation.Numbers;
import dev.podflow.validation.Paths;
import dev.podflow.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for the {@code run} and {@code publish} commands: configuration layering, episode metadata
 * arguments and result printing.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);

  private CliSupport() {}

  /**
   * Removes {@code config=PATH} from the CLI arguments.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Layers defaults, the optional YAML file and the CLI arguments.
   *
   * @param mode command mode
   * @param cliKv CLI arguments; {@code config} is consumed
   * @param usage usage line printed on argument errors
   * @return effective configuration map
   * @throws CliAbort when the YAML file is missing or invalid, or the merged values fail validation
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliKv, String usage)
      throws CliAbort {
    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Builds typed configuration.
   *
   * @param effective merged configuration
   * @return typed configuration
   * @throws CliAbort with {@link ExitCode#CONFIG_ERROR} when a value is malformed
   */
  static PodflowConfig typedConfig(Map<String, String> effective) throws CliAbort {
    try {
      return PodflowConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    }
  }

  /**
   * Reads a required path argument.
   *
   * @param cliKv CLI arguments
   * @param key argument name
   * @param usage usage line printed when absent
   * @return absolute path
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} when absent or malformed
   */
  static Path requiredPath(Map<String, String> cliKv, String key, String usage) throws CliAbort {
    String value = cliKv.get(key);
    if (value == null || value.isBlank()) {
      log.error("Missing required argument: {}=PATH", key);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return Paths.parse(key, value);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Builds episode metadata from CLI arguments. Only arguments given on the command line are used; the
   * configured {@code author} default is applied later by the assembler.
   *
   * @param cliKv CLI arguments
   * @return metadata
   * @throws IllegalArgumentException if a value is malformed
   */
  static EpisodeMetadata metadata(Map<String, String> cliKv) {
    EpisodeMetadata.Builder builder = EpisodeMetadata.builder();
    Strings.optional(cliKv.get("episodeId")).ifPresent(builder::episodeId);
    Strings.optional(cliKv.get("title")).ifPresent(builder::title);
    Strings.optional(cliKv.get("tags")).ifPresent(v -> builder.tags(splitTags(v)));
    Strings.optional(cliKv.get("category")).ifPresent(builder::category);
    Strings.optional(cliKv.get("explicit"))
        .ifPresent(v -> builder.explicit(Strings.parseBoolean("explicit", v, false)));
    Strings.optional(cliKv.get("episodeNumber"))
        .ifPresent(v -> builder.episodeNumber(Numbers.parseInt("episodeNumber", v, 1, Integer.MAX_VALUE)));
    Strings.optional(cliKv.get("seasonNumber"))
        .ifPresent(v -> builder.seasonNumber(Numbers.parseInt("seasonNumber", v, 1, Integer.MAX_VALUE)));
    Strings.optional(cliKv.get("publicationDate")).ifPresent(v -> builder.publicationDate(parseDate(v)));
    Strings.optional(cliKv.get("author")).ifPresent(builder::author);
    Strings.optional(cliKv.get("copyright")).ifPresent(builder::copyright);
    return builder.build();
  }

  static List<String> splitTags(String raw) {
    List<String> tags = new ArrayList<>();
    for (String token : raw.split(",")) {
      String tag = token.trim();
      if (!tag.isEmpty() && !tags.contains(tag)) {
        tags.add(tag);
      }
    }
    return List.copyOf(tags);
  }

  private static LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("publicationDate must be YYYY-MM-DD (was " + value + ")", ex);
    }
  }

  /**
   * Describes the platforms that would be launched, for dry-run output.
   *
   * @param root composition root
   * @return comma separated names, or {@code <none>}
   */
  static String describePlatforms(CompositionRoot root) {
    List<PlatformSettings> enabled = root.enabledPlatforms();
    if (enabled.isEmpty()) {
      return "<none>";
    }
    return enabled.stream().map(PlatformSettings::name).collect(Collectors.joining(", "));
  }

  /**
   * Starts the metrics adapter for one command from the typed metrics settings.
   *
   * @param config typed configuration
   * @param command {@code run} or {@code publish}
   * @return metrics adapter; close it when the command finishes
   */
  static OpenTelemetryMetricsAdapter metrics(PodflowConfig config, String command) {
    PodflowConfig.MetricsSettings settings = config.metrics();
    return OpenTelemetryMetricsAdapter.create(
        settings.exporter(),
        settings.endpoint().orElse(null),
        settings.resourceAttributes().orElse(null),
        command);
  }

  /**
   * Prints the publishing outcome.
   *
   * @param outcome publishing outcome
   */
  static void printOutcome(PublishingOutcome outcome) {
    CliPrinter.field("Episode id", outcome.episodeId());
    CliPrinter.field("Episode URL", outcome.episodeUrl().orElse(null));
    CliPrinter.field("Published", outcome.published().isEmpty() ? null : String.join(", ", outcome.published()));
    for (String name : outcome.failed()) {
      PlatformResult result = outcome.details().get(name);
      CliPrinter.field("Failed", name + " (" + result.error().orElse("unknown error") + ")");
    }
  }

  /**
   * Signals an early CLI exit with a specific code.
   */
  static final class CliAbort extends Exception {
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
