package dev.podflow.infrastructure.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.Transcript;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FallbackContentGeneratorTest {
  private final FallbackContentGenerator generator = new FallbackContentGenerator();

  @Test
  void derivesContentFromLeadingSentences() {
    Transcript transcript = Transcript.of(
        "Welcome to the show. Today we cover queues! Any questions? Bye.", null, 0.9);

    GeneratedContent content = generator.generate(transcript, "en-US");

    assertEquals("Welcome to the show", content.title());
    assertEquals("Welcome to the show. Today we cover queues! Any questions?", content.description());
    assertEquals(
        "Episode highlights:\n• Welcome to the show.\n• Today we cover queues!\n• Any questions?\n• Bye.",
        content.showNotes());
    assertEquals(Optional.of("Welcome to the show. Today we cover queues!"), content.summary());
    assertEquals(Optional.of("New episode: Welcome to the show #podcast"), content.socialCopy("twitter"));
    assertTrue(content.fallback());
    assertEquals(FallbackContentGenerator.PROVIDER, content.metadata().get("provider"));
    assertEquals("en-US", content.metadata().get("language"));
    assertEquals(List.of(), content.missingRequiredFields());
  }

  @Test
  void blankTranscriptStillSatisfiesRequiredFields() {
    GeneratedContent content = generator.generate(Transcript.of("   ", null, 0.0), "de-DE");

    assertEquals("Untitled Episode", content.title());
    assertEquals("Untitled Episode", content.description());
    assertEquals(List.of(), content.missingRequiredFields());
    assertTrue(content.summary().isEmpty());
  }

  @Test
  void longFirstSentenceIsClipped() {
    String sentence = "word ".repeat(40).trim() + ".";

    GeneratedContent content = generator.generate(Transcript.of(sentence, null, 1.0), "en-US");

    assertTrue(content.title().length() <= 83, content.title());
    assertTrue(content.title().endsWith("..."));
  }

  @Test
  void splitsOnCjkTerminators() {
    assertEquals(List.of("你好。", "再见！"), FallbackContentGenerator.sentences("你好。再见！"));
  }
}
