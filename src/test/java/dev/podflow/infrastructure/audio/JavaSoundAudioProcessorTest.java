package dev.podflow.infrastructure.audio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.testutil.Fixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JavaSoundAudioProcessorTest {
  @TempDir
  Path tmp;

  @Test
  void stagesWavAndReadsFormat() throws Exception {
    Path source = Fixtures.writeWav(tmp.resolve("show.wav"), 8000, 2);
    Path work = tmp.resolve("work");

    ProcessedAudio audio = new JavaSoundAudioProcessor(work).process(source);

    assertEquals(source, audio.source());
    assertEquals(work.resolve("show-processed.wav"), audio.processedRef());
    assertTrue(Files.isReadable(audio.processedRef()));
    assertEquals(2.0, audio.durationSeconds(), 0.001);
    assertEquals(8000, audio.sampleRate());
    assertEquals(1, audio.channels());
  }

  @Test
  void rejectsNonAudio() throws Exception {
    Path source = tmp.resolve("notes.wav");
    Files.writeString(source, "this is not audio");

    assertThrows(UnsupportedAudioFileException.class,
        () -> new JavaSoundAudioProcessor(tmp.resolve("work")).process(source));
  }

  @Test
  void processedNameKeepsExtension() {
    assertEquals("show-processed.aiff", JavaSoundAudioProcessor.processedName(Path.of("/in/show.aiff")));
    assertEquals("raw-processed", JavaSoundAudioProcessor.processedName(Path.of("raw")));
    assertEquals(".hidden-processed", JavaSoundAudioProcessor.processedName(Path.of(".hidden")));
  }
}
