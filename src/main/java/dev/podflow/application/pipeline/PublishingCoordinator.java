package dev.podflow.application.pipeline;

import dev.podflow.application.port.ClockPort;
import dev.podflow.application.port.MetricsPort;
import dev.podflow.application.port.PlatformConnector;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.error.ConfigurationException;
import dev.podflow.domain.publish.EpisodeData;
import dev.podflow.domain.publish.PlatformKind;
import dev.podflow.domain.publish.PlatformResult;
import dev.podflow.domain.publish.PublishingOutcome;
import dev.podflow.domain.workflow.EpisodeMetadata;
import dev.podflow.infrastructure.exec.ExecutorFactories;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Assembles one {@link EpisodeData} and fans it out concurrently to every enabled platform.
 * <p><strong>Why:</strong> Platforms fail independently; one rejected or crashed upload must not hide the others'
 * results or abort the episode.</p>
 * <p><strong>Role:</strong> Application-layer use case behind stage 4 of the workflow and the standalone
 * {@code publish} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the ordered enabled-platform set supplied at construction.</li>
 *   <li>Launch one task per platform, await all of them, and convert each settled task into a
 *       {@link PlatformResult}.</li>
 *   <li>Correlate results to platforms by launch position and pick the canonical episode URL by
 *       {@link PlatformKind} priority.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@code publish} calls; each call uses its own pool.</p>
 * <p><strong>Performance:</strong> Wall time is bounded by the slowest platform; no blanket timeout is imposed on
 * top of the connectors' own.</p>
 * <p><strong>Observability:</strong> Sets the {@code platform} MDC key inside each task and emits
 * {@code publish.platform.<name>.success|failure}, {@code publish.fanout.latencyMillis} and
 * {@code publish.outcome.allFailed}.</p>
 *
 * @since 0.1.0
 */
public final class PublishingCoordinator {
  private static final Logger log = LoggerFactory.getLogger(PublishingCoordinator.class);
  private static final String MDC_PLATFORM = "platform";

  private final List<PlatformConnector> connectors;
  private final EpisodeDataAssembler assembler;
  private final int maxWorkers;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a coordinator for an ordered platform set.
   *
   * @param connectors enabled platforms in priority-tie and reporting order; may be empty, in which case
   *     {@code publish} reports a configuration error
   * @param assembler episode record assembler
   * @param maxWorkers upper bound on concurrent platform tasks; must be positive
   * @param metrics metrics sink
   * @param clock time source for latency metrics
   * @throws ConfigurationException if two connectors share a name
   */
  public PublishingCoordinator(
      List<PlatformConnector> connectors,
      EpisodeDataAssembler assembler,
      int maxWorkers,
      MetricsPort metrics,
      ClockPort clock) {
    this.connectors = List.copyOf(Objects.requireNonNull(connectors, "connectors"));
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    if (maxWorkers <= 0) {
      throw new IllegalArgumentException("maxWorkers must be positive");
    }
    this.maxWorkers = maxWorkers;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    Set<String> names = new HashSet<>();
    for (PlatformConnector connector : this.connectors) {
      if (!names.add(connector.name())) {
        throw new ConfigurationException("duplicate publishing platform: " + connector.name());
      }
    }
  }

  /**
   * Returns the enabled platform names in launch order.
   *
   * @return platform names
   */
  public List<String> enabledPlatforms() {
    List<String> names = new ArrayList<>(connectors.size());
    for (PlatformConnector connector : connectors) {
      names.add(connector.name());
    }
    return List.copyOf(names);
  }

  /**
   * Publishes generated content, reading the language from the content metadata.
   *
   * @param audioRef processed audio reference
   * @param content generated content
   * @param metadata caller metadata
   * @return aggregated outcome; never throws for per-platform failures
   * @throws ConfigurationException if no platform is enabled
   * @throws IllegalArgumentException if the content lacks required fields
   */
  public PublishingOutcome publish(Path audioRef, GeneratedContent content, EpisodeMetadata metadata) {
    return publish(audioRef, content, metadata, null);
  }

  /**
   * Publishes generated content in the given language.
   *
   * @param audioRef processed audio reference
   * @param content generated content
   * @param metadata caller metadata
   * @param language content language, or {@code null} to read it from the content metadata
   * @return aggregated outcome; never throws for per-platform failures
   * @throws ConfigurationException if no platform is enabled
   * @throws IllegalArgumentException if the content lacks required fields
   */
  public PublishingOutcome publish(
      Path audioRef, GeneratedContent content, EpisodeMetadata metadata, String language) {
    if (connectors.isEmpty()) {
      throw new ConfigurationException("no publishing platforms enabled");
    }
    EpisodeData episode = assembler.assemble(audioRef, content, metadata, language);
    return publish(episode);
  }

  /**
   * Fans an already assembled episode out to every enabled platform.
   *
   * @param episode shared read-only episode record
   * @return aggregated outcome
   * @throws ConfigurationException if no platform is enabled
   */
  public PublishingOutcome publish(EpisodeData episode) {
    Objects.requireNonNull(episode, "episode");
    if (connectors.isEmpty()) {
      throw new ConfigurationException("no publishing platforms enabled");
    }
    log.info("Publishing episode {} to {}", episode.episodeId(), enabledPlatforms());
    long started = clock.nowMillis();

    List<PlatformResult> results = fanOut(episode);

    metrics.observe("publish.fanout.latencyMillis", Math.max(0L, clock.nowMillis() - started));
    PublishingOutcome outcome =
        PublishingOutcome.of(episode.episodeId(), results, resolveEpisodeUrl(results));
    if (outcome.allFailed()) {
      metrics.increment("publish.outcome.allFailed");
      log.warn("Episode {} was not published to any platform; failed={}",
          episode.episodeId(), outcome.failed());
    } else {
      log.info("Episode {} published to {} of {} platforms; url={}",
          episode.episodeId(),
          outcome.published().size(),
          connectors.size(),
          outcome.episodeUrl().orElse("<none>"));
    }
    return outcome;
  }

  private List<PlatformResult> fanOut(EpisodeData episode) {
    ExecutorService executor = ExecutorFactories.newPublishPool(
        Math.min(maxWorkers, connectors.size()),
        "podflow-publish",
        (thread, ex) -> log.error("Uncaught error on {}", thread.getName(), ex));
    try {
      List<Future<PlatformResult>> futures = new ArrayList<>(connectors.size());
      for (PlatformConnector connector : connectors) {
        futures.add(executor.submit(task(connector, episode)));
      }
      return collect(futures, executor);
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Awaits every future in launch order. After an interrupt, futures that already settled keep their real result
   * and only the unsettled ones are reported as {@code interrupted}.
   */
  private List<PlatformResult> collect(List<Future<PlatformResult>> futures, ExecutorService executor) {
    List<PlatformResult> results = new ArrayList<>(futures.size());
    boolean interrupted = false;
    for (int i = 0; i < futures.size(); i++) {
      String platform = connectors.get(i).name();
      Future<PlatformResult> future = futures.get(i);
      PlatformResult result = null;
      if (!interrupted) {
        try {
          result = settle(platform, future);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          interrupted = true;
          log.warn("Publishing fan-out interrupted; marking unsettled platforms failed");
          executor.shutdownNow();
        }
      }
      if (result == null && future.isDone() && !future.isCancelled()) {
        result = settleQuietly(platform, future);
      }
      if (result == null) {
        result = PlatformResult.failed(platform, "interrupted");
      }
      results.add(record(result));
    }
    return results;
  }

  private static PlatformResult settle(String platform, Future<PlatformResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.warn("Platform {} raised {}", platform, cause.toString(), cause);
      return PlatformResult.fromException(platform, cause);
    } catch (CancellationException ex) {
      return PlatformResult.failed(platform, "cancelled");
    }
  }

  /** Reads a future already known to be done while the caller's interrupt flag is set. */
  private static PlatformResult settleQuietly(String platform, Future<PlatformResult> future) {
    boolean wasInterrupted = Thread.interrupted();
    try {
      return settle(platform, future);
    } catch (InterruptedException ex) {
      return PlatformResult.failed(platform, "interrupted");
    } finally {
      if (wasInterrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private Callable<PlatformResult> task(PlatformConnector connector, EpisodeData episode) {
    String platform = connector.name();
    return () -> {
      String previousPlatform = MDC.get(MDC_PLATFORM);
      try {
        MDC.put(MDC_PLATFORM, platform);
        log.info("Publishing to {} started", platform);
        PlatformResult result = normalize(platform, connector.publish(episode));
        if (result.success()) {
          log.info("Publishing to {} succeeded; url={}", platform, result.publishedUrl().orElse("<none>"));
        } else {
          log.warn("Publishing to {} failed: {}", platform, result.error().orElse("unknown error"));
        }
        return result;
      } finally {
        if (previousPlatform == null) {
          MDC.remove(MDC_PLATFORM);
        } else {
          MDC.put(MDC_PLATFORM, previousPlatform);
        }
      }
    };
  }

  private static PlatformResult normalize(String platform, PlatformResult result) {
    if (result == null) {
      return PlatformResult.failed(platform, "connector returned no result");
    }
    if (platform.equals(result.platform())) {
      return result;
    }
    return new PlatformResult(
        platform,
        result.success(),
        result.publishedUrl(),
        result.remoteId(),
        result.error(),
        result.attributes());
  }

  private PlatformResult record(PlatformResult result) {
    metrics.increment("publish.platform." + result.platform() + (result.success() ? ".success" : ".failure"));
    return result;
  }

  /**
   * Picks the first successful platform URL scanning {@link PlatformKind} in priority order; platforms of the
   * same kind are scanned in enabled order.
   */
  private Optional<String> resolveEpisodeUrl(List<PlatformResult> results) {
    for (PlatformKind kind : PlatformKind.values()) {
      for (int i = 0; i < results.size(); i++) {
        PlatformResult result = results.get(i);
        if (connectors.get(i).kind() == kind && result.success() && result.publishedUrl().isPresent()) {
          return result.publishedUrl();
        }
      }
    }
    return Optional.empty();
  }
}
