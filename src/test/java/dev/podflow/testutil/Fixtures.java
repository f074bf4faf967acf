package dev.podflow.testutil;

import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.publish.EpisodeData;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

/** Shared test data. */
public final class Fixtures {
  private Fixtures() {}

  public static GeneratedContent content() {
    return new GeneratedContent(
        "Scaling Event Pipelines",
        "How we scaled our event pipeline.",
        "- intro\n- backpressure\n- wrap-up",
        Optional.of("We talk about pipelines. Then we talk about queues."),
        Map.of("twitter", "New episode on pipelines!"),
        Map.of("language", "en-US"),
        false);
  }

  public static EpisodeData episode(Path audio) {
    return new EpisodeData(
        "scaling-event-pipelines-20240301-123456-789000-abcdef12",
        "Scaling Event Pipelines",
        "How we scaled our event pipeline.",
        "- intro\n- backpressure",
        Optional.of("We talk about pipelines. Then we talk about queues."),
        audio,
        "en-US",
        Map.of(),
        List.of("tech", "streaming"),
        "Technology",
        false,
        Optional.of(12),
        Optional.empty(),
        LocalDate.of(2024, 3, 1),
        "Podflow",
        "© 2024 Podflow");
  }

  /**
   * Writes a silent 16-bit mono PCM WAV file.
   *
   * @param target destination
   * @param sampleRate sample rate in Hz
   * @param seconds duration in seconds
   * @return the target path
   * @throws IOException if writing fails
   */
  public static Path writeWav(Path target, int sampleRate, int seconds) throws IOException {
    AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
    int frames = sampleRate * seconds;
    byte[] data = new byte[frames * format.getFrameSize()];
    try (AudioInputStream stream = new AudioInputStream(new ByteArrayInputStream(data), format, frames)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, target.toFile());
    }
    return target;
  }
}
