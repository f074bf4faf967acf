package dev.podflow.domain.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PublishingOutcomeTest {

  @Test
  void partitionsResultsInEnabledOrder() {
    PublishingOutcome outcome = PublishingOutcome.of("ep-1", List.of(
        PlatformResult.failed("art19", "Art19 API error: 422"),
        PlatformResult.published("website", "https://show.dev/ep-1", null),
        PlatformResult.published("twitter", "https://twitter.com/i/status/9", "9")),
        Optional.of("https://show.dev/ep-1"));

    assertEquals(List.of("website", "twitter"), outcome.published());
    assertEquals(List.of("art19"), outcome.failed());
    assertEquals(List.of("art19", "website", "twitter"), List.copyOf(outcome.details().keySet()));
    assertFalse(outcome.allFailed());
    assertEquals(Optional.of("9"), outcome.result("twitter").flatMap(PlatformResult::remoteId));
    assertTrue(outcome.result("spotify").isEmpty());
  }

  @Test
  void allFailedWhenNothingPublished() {
    PublishingOutcome outcome = PublishingOutcome.of("ep-2", List.of(
        PlatformResult.fromException("website", new IOException("connection refused"))), Optional.empty());

    assertTrue(outcome.allFailed());
    assertEquals(Optional.of("IOException: connection refused"), outcome.details().get("website").error());
  }

  @Test
  void rejectsDuplicatePlatforms() {
    assertThrows(IllegalArgumentException.class, () -> PublishingOutcome.of("ep-3", List.of(
        PlatformResult.published("website", null, null),
        PlatformResult.failed("website", "boom")), Optional.empty()));
  }

  @Test
  void platformResultEnforcesErrorInvariant() {
    assertThrows(IllegalArgumentException.class, () -> PlatformResult.failed("art19", " "));
    assertThrows(IllegalArgumentException.class, () -> PlatformResult.published(" ", null, null));
    assertEquals("NullPointerException",
        PlatformResult.fromException("twitter", new NullPointerException()).error().orElseThrow());
    assertTrue(PlatformResult.published("website", "", "").publishedUrl().isEmpty());
  }
}
