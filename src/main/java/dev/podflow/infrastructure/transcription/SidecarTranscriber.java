package dev.podflow.infrastructure.transcription;

import dev.podflow.application.port.Transcriber;
import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stage 2 adapter reading a transcript prepared alongside the recording.
 * <p>For {@code show.wav} requested in {@code en-US} the lookup order is {@code show.en-US.txt},
 * {@code show.en.txt}, {@code show.txt}, then any {@code show.<lang>.txt}. A language in the chosen file name is
 * reported as the detected language.</p>
 *
 * @since 0.1.0
 */
public final class SidecarTranscriber implements Transcriber {
  private static final Logger log = LoggerFactory.getLogger(SidecarTranscriber.class);
  private static final Pattern LANGUAGE_SUFFIX = Pattern.compile("\\.([a-z]{2,3}(?:-[A-Za-z0-9]{2,8})?)\\.txt$");
  private static final double SIDECAR_CONFIDENCE = 1.0;

  private final Optional<Path> transcriptDir;

  /**
   * Creates a transcriber.
   *
   * @param transcriptDir directory holding transcripts; when empty, the directory of the original audio
   */
  public SidecarTranscriber(Optional<Path> transcriptDir) {
    this.transcriptDir = Objects.requireNonNull(transcriptDir, "transcriptDir");
  }

  @Override
  public Transcript transcribe(ProcessedAudio audio, String languageCode) throws IOException {
    Path source = audio.source().toAbsolutePath();
    Path dir = transcriptDir.orElse(source.getParent());
    String base = baseName(source);

    for (Path candidate : candidates(dir, base, languageCode)) {
      if (Files.isRegularFile(candidate)) {
        return read(candidate, languageOf(candidate).orElse(null));
      }
    }
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, base + ".*.txt")) {
      for (Path candidate : stream) {
        Optional<String> language = languageOf(candidate);
        if (language.isPresent()) {
          return read(candidate, language.get());
        }
      }
    } catch (NoSuchFileException ex) {
      log.debug("Transcript directory {} does not exist", dir);
    }
    throw new NoSuchFileException(dir.resolve(base + ".txt").toString(), null, "no transcript found for " + source);
  }

  private static List<Path> candidates(Path dir, String base, String languageCode) {
    List<Path> candidates = new ArrayList<>(3);
    candidates.add(dir.resolve(base + "." + languageCode + ".txt"));
    int dash = languageCode.indexOf('-');
    if (dash > 0) {
      candidates.add(dir.resolve(base + "." + languageCode.substring(0, dash) + ".txt"));
    }
    candidates.add(dir.resolve(base + ".txt"));
    return candidates;
  }

  private Transcript read(Path file, String detectedLanguage) throws IOException {
    String text = Files.readString(file, StandardCharsets.UTF_8);
    Transcript transcript = Transcript.of(text, detectedLanguage, SIDECAR_CONFIDENCE);
    log.info("Transcript loaded from {} ({} words, language={})",
        file.getFileName(), transcript.wordCount(), detectedLanguage == null ? "<requested>" : detectedLanguage);
    return transcript;
  }

  static Optional<String> languageOf(Path file) {
    Matcher matcher = LANGUAGE_SUFFIX.matcher(file.getFileName().toString());
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  private static String baseName(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
