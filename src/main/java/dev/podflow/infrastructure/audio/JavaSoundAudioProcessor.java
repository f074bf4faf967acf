package dev.podflow.infrastructure.audio;

import dev.podflow.application.port.AudioProcessor;
import dev.podflow.domain.content.ProcessedAudio;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stage 1 adapter that admits audio the JDK sound API can parse (WAV, AIFF, AU) and stages
 * it in the work directory.
 * <p>The staged copy is named {@code <name>-processed.<ext>}; the format header supplies duration, sample rate and
 * channel count.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use on distinct inputs.</p>
 *
 * @since 0.1.0
 */
public final class JavaSoundAudioProcessor implements AudioProcessor {
  private static final Logger log = LoggerFactory.getLogger(JavaSoundAudioProcessor.class);

  private final Path workDir;

  /**
   * Creates the processor.
   *
   * @param workDir directory receiving processed files; created on demand
   */
  public JavaSoundAudioProcessor(Path workDir) {
    this.workDir = Objects.requireNonNull(workDir, "workDir");
  }

  @Override
  public ProcessedAudio process(Path audioRef) throws IOException, UnsupportedAudioFileException {
    Objects.requireNonNull(audioRef, "audioRef");
    AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(audioRef.toFile());
    AudioFormat format = fileFormat.getFormat();

    double duration = 0.0;
    long frames = fileFormat.getFrameLength();
    float frameRate = format.getFrameRate();
    if (frames > 0 && frameRate > 0) {
      duration = frames / (double) frameRate;
    }
    int sampleRate = format.getSampleRate() > 0 ? Math.round(format.getSampleRate()) : 0;
    int channels = Math.max(0, format.getChannels());

    Files.createDirectories(workDir);
    Path target = workDir.resolve(processedName(audioRef));
    Files.copy(audioRef, target, StandardCopyOption.REPLACE_EXISTING);
    log.info("Audio {} staged as {} ({} s, {} Hz, {} ch, {})",
        audioRef.getFileName(),
        target,
        String.format(Locale.ROOT, "%.1f", duration),
        sampleRate,
        channels,
        fileFormat.getType());
    return new ProcessedAudio(audioRef, target, duration, sampleRate, channels);
  }

  static String processedName(Path audioRef) {
    String fileName = audioRef.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0) {
      return fileName + "-processed";
    }
    return fileName.substring(0, dot) + "-processed" + fileName.substring(dot);
  }
}
