package dev.podflow.infrastructure.publish;

import dev.podflow.domain.publish.EpisodeData;

/**
 * Builds and bounds tweet text.
 *
 * @since 0.1.0
 */
public final class TweetComposer {
  /** Maximum tweet length in characters. */
  public static final int MAX_LENGTH = 280;

  private static final String ELLIPSIS = "...";
  private static final String HASHTAGS = " #podcast #ai";
  private static final int SUMMARY_BUDGET = 250;

  private TweetComposer() {}

  /**
   * Builds the default announcement: {@code New episode: <title> - <first summary sentence> #podcast #ai}.
   * The summary sentence is dropped when it would push the text past the summary budget.
   *
   * @param episode episode to announce
   * @return tweet text within {@link #MAX_LENGTH}
   */
  public static String defaultAnnouncement(EpisodeData episode) {
    StringBuilder tweet = new StringBuilder("New episode: ").append(episode.title());
    String firstSentence = episode.summary()
        .map(s -> s.split("\\.", 2)[0].trim())
        .orElse("");
    if (!firstSentence.isEmpty() && tweet.length() + 3 + firstSentence.length() < SUMMARY_BUDGET) {
      tweet.append(" - ").append(firstSentence);
    }
    tweet.append(HASHTAGS);
    return truncate(tweet.toString());
  }

  /**
   * Truncates text to {@link #MAX_LENGTH}, preferring a sentence boundary, then a word boundary, when either
   * falls in the last 30% of the allowed length. An ellipsis marks the cut.
   *
   * @param text text to bound
   * @return text unchanged when short enough, otherwise a truncated copy ending in {@code ...}
   */
  public static String truncate(String text) {
    if (text.length() <= MAX_LENGTH) {
      return text;
    }
    int maxLength = MAX_LENGTH - ELLIPSIS.length();
    String truncated = text.substring(0, maxLength);
    int lastPeriod = truncated.lastIndexOf('.');
    int lastSpace = truncated.lastIndexOf(' ');
    double threshold = maxLength * 0.7;
    if (lastPeriod > threshold) {
      truncated = text.substring(0, lastPeriod + 1);
    } else if (lastSpace > threshold) {
      truncated = text.substring(0, lastSpace);
    }
    return truncated + ELLIPSIS;
  }
}
