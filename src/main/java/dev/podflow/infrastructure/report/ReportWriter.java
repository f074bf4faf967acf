package dev.podflow.infrastructure.report;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import dev.podflow.domain.content.GeneratedContent;
import dev.podflow.domain.content.ProcessedAudio;
import dev.podflow.domain.content.Transcript;
import dev.podflow.domain.publish.PlatformResult;
import dev.podflow.domain.publish.PublishingOutcome;
import dev.podflow.domain.workflow.StageFailure;
import dev.podflow.domain.workflow.WorkflowResult;
import dev.podflow.domain.workflow.WorkflowState;
import dev.podflow.infrastructure.http.JsonSupport;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Writes run and publishing reports as JSON documents.
 * <p><strong>Why:</strong> CLI callers pass {@code report=FILE} to capture the outcome for downstream tooling.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Reports are written to a sibling temp file and moved into place.</p>
 *
 * @since 0.1.0
 */
public final class ReportWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes a workflow run report.
   *
   * @param result terminal run result
   * @param target destination file; parent directories are created
   * @throws IOException if the report cannot be written
   */
  public void write(WorkflowResult result, Path target) throws IOException {
    Objects.requireNonNull(result, "result");
    writeDocument(target, gen -> writeWorkflow(gen, result));
  }

  /**
   * Writes a publishing report.
   *
   * @param outcome publishing outcome
   * @param target destination file; parent directories are created
   * @throws IOException if the report cannot be written
   */
  public void write(PublishingOutcome outcome, Path target) throws IOException {
    Objects.requireNonNull(outcome, "outcome");
    writeDocument(target, gen -> writePublishing(gen, outcome));
  }

  private void writeDocument(Path target, JsonSupport.Writer body) throws IOException {
    Path absolute = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
        JsonGenerator gen = factory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      body.write(gen);
    }
    Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
  }

  private static void writeWorkflow(JsonGenerator gen, WorkflowResult result) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("run_id", result.runId());
    gen.writeStringField("state", result.state().name());
    gen.writeBooleanField("success", result.success());
    gen.writeStringField("audio", result.request().audioRef().toString());
    gen.writeStringField("language", result.request().languageCode());
    gen.writeNumberField("duration_millis", result.durationMillis());
    gen.writeArrayFieldStart("transitions");
    for (WorkflowState state : result.transitions()) {
      gen.writeString(state.name());
    }
    gen.writeEndArray();
    if (result.processedAudio().isPresent()) {
      writeAudio(gen, result.processedAudio().get());
    }
    if (result.transcript().isPresent()) {
      writeTranscript(gen, result.transcript().get());
    }
    if (result.content().isPresent()) {
      writeContent(gen, result.content().get());
    }
    if (result.publishing().isPresent()) {
      gen.writeFieldName("publishing");
      writePublishing(gen, result.publishing().get());
    }
    if (result.failure().isPresent()) {
      writeFailure(gen, result.failure().get());
    }
    gen.writeEndObject();
  }

  private static void writeAudio(JsonGenerator gen, ProcessedAudio audio) throws IOException {
    gen.writeObjectFieldStart("processed_audio");
    gen.writeStringField("processed_ref", audio.processedRef().toString());
    gen.writeNumberField("duration_seconds", audio.durationSeconds());
    gen.writeNumberField("sample_rate", audio.sampleRate());
    gen.writeNumberField("channels", audio.channels());
    gen.writeEndObject();
  }

  private static void writeTranscript(JsonGenerator gen, Transcript transcript) throws IOException {
    gen.writeObjectFieldStart("transcript");
    JsonSupport.writeOptional(gen, "detected_language", transcript.detectedLanguage());
    gen.writeNumberField("confidence", transcript.confidence());
    gen.writeNumberField("word_count", transcript.wordCount());
    gen.writeEndObject();
  }

  private static void writeContent(JsonGenerator gen, GeneratedContent content) throws IOException {
    gen.writeObjectFieldStart("content");
    gen.writeStringField("title", content.title());
    gen.writeStringField("description", content.description());
    gen.writeStringField("show_notes", content.showNotes());
    JsonSupport.writeOptional(gen, "summary", content.summary());
    writeStringMap(gen, "social_media", content.socialMedia());
    gen.writeBooleanField("fallback", content.fallback());
    gen.writeEndObject();
  }

  private static void writePublishing(JsonGenerator gen, PublishingOutcome outcome) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("episode_id", outcome.episodeId());
    JsonSupport.writeOptional(gen, "episode_url", outcome.episodeUrl());
    JsonSupport.writeStringArray(gen, "published", outcome.published());
    JsonSupport.writeStringArray(gen, "failed", outcome.failed());
    gen.writeObjectFieldStart("details");
    for (PlatformResult result : outcome.details().values()) {
      gen.writeObjectFieldStart(result.platform());
      gen.writeBooleanField("success", result.success());
      JsonSupport.writeOptional(gen, "url", result.publishedUrl());
      JsonSupport.writeOptional(gen, "id", result.remoteId());
      JsonSupport.writeOptional(gen, "error", result.error());
      if (!result.attributes().isEmpty()) {
        writeStringMap(gen, "attributes", result.attributes());
      }
      gen.writeEndObject();
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeFailure(JsonGenerator gen, StageFailure failure) throws IOException {
    gen.writeObjectFieldStart("failure");
    gen.writeStringField("stage", failure.stage().tag());
    gen.writeStringField("message", failure.message());
    if (!failure.missingFields().isEmpty()) {
      JsonSupport.writeStringArray(gen, "missing_fields", failure.missingFields());
    }
    gen.writeEndObject();
  }

  private static void writeStringMap(JsonGenerator gen, String name, Map<String, String> values)
      throws IOException {
    gen.writeObjectFieldStart(name);
    for (Map.Entry<String, String> e : values.entrySet()) {
      gen.writeStringField(e.getKey(), e.getValue());
    }
    gen.writeEndObject();
  }
}
