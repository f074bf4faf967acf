package dev.podflow.application.pipeline;

import dev.podflow.application.port.ClockPort;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Derives episode identifiers of the form {@code <slug>-<yyyyMMdd-HHmmss>-<micros>-<hash>}.
 * <p><strong>Why:</strong> Concurrent runs need distinct ids without coordination; the timestamp is made strictly
 * monotonic per generator so two ids for the same title never collide, even within one clock tick.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the timestamp sequence is an {@link AtomicLong}.</p>
 *
 * @since 0.1.0
 */
public final class EpisodeIdGenerator {
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final int MAX_SLUG_LENGTH = 60;
  private static final String EMPTY_SLUG = "episode";

  private final ClockPort clock;
  private final AtomicLong lastMicros = new AtomicLong(Long.MIN_VALUE);

  /**
   * Creates a generator reading the given clock.
   *
   * @param clock time source; must not be {@code null}
   */
  public EpisodeIdGenerator(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Generates a new identifier for the title.
   *
   * @param title episode title; {@code null} is treated as empty
   * @return identifier unique within this generator
   */
  public String generate(String title) {
    String safeTitle = title == null ? "" : title;
    long micros = nextMicros();
    Instant instant = Instant.ofEpochMilli(Math.floorDiv(micros, 1000L));
    long microOfSecond = Math.floorMod(micros, 1_000_000L);
    return slug(safeTitle)
        + '-'
        + STAMP.format(instant)
        + '-'
        + String.format(Locale.ROOT, "%06d", microOfSecond)
        + '-'
        + shortHash(safeTitle);
  }

  /**
   * Builds the title slug: characters other than ASCII letters, digits and whitespace are dropped, whitespace runs
   * become one hyphen, the result is lower-cased and capped.
   *
   * @param title raw title
   * @return slug; {@code episode} when nothing survives
   */
  static String slug(String title) {
    String cleaned = NON_ALPHANUMERIC.matcher(title).replaceAll("").trim();
    String slug = WHITESPACE.matcher(cleaned).replaceAll("-").toLowerCase(Locale.ROOT);
    if (slug.length() > MAX_SLUG_LENGTH) {
      slug = slug.substring(0, MAX_SLUG_LENGTH);
      while (slug.endsWith("-")) {
        slug = slug.substring(0, slug.length() - 1);
      }
    }
    return slug.isEmpty() ? EMPTY_SLUG : slug;
  }

  static String shortHash(String title) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(title.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(8);
      for (int i = 0; i < 4; i++) {
        hex.append(String.format(Locale.ROOT, "%02x", digest[i] & 0xff));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  private long nextMicros() {
    long candidate = Math.multiplyExact(clock.nowMillis(), 1000L);
    return lastMicros.updateAndGet(previous -> candidate > previous ? candidate : previous + 1);
  }
}
