package dev.podflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.podflow.domain.error.ConfigurationException;
import dev.podflow.domain.workflow.Stage;
import dev.podflow.domain.workflow.StageFailure;
import dev.podflow.domain.workflow.WorkflowRequest;
import dev.podflow.domain.workflow.WorkflowResult;
import dev.podflow.domain.workflow.WorkflowState;
import dev.podflow.infrastructure.http.JsonSupport;
import dev.podflow.testutil.Fixtures;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingAudioReturnsInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {"language=en-US"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run audio=PATH"));
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {"audio"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("argument must be key=value")));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {
        "audio=" + tempDir.resolve("a.wav"), "config=" + tempDir.resolve("missing.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedYamlReturnsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "- just\n- a list\n");

    ExitCode code = RunCli.run(new String[] {"audio=" + tempDir.resolve("a.wav"), "config=" + yaml});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void malformedSettingReturnsConfigError() {
    ExitCode code = RunCli.run(new String[] {"audio=" + tempDir.resolve("a.wav"), "publishWorkers=0"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void nonexistentAudioReturnsIoError() {
    ExitCode code = RunCli.run(new String[] {
        "audio=" + tempDir.resolve("missing.wav"),
        "workDir=" + tempDir,
        "art19.enabled=false",
        "twitter.enabled=false",
        "website.contentApiUrl=http://localhost:9/api",
        "anthropic.apiKey="});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Audio file not found")));
  }

  @Test
  void dryRunPrintsPlanWithoutTouchingAudio() {
    ExitCode code = RunCli.run(new String[] {
        "audio=" + tempDir.resolve("show.wav"),
        "workDir=" + tempDir.resolve("work"),
        "art19.enabled=false",
        "twitter.enabled=false",
        "website.contentApiUrl=https://show.dev/api",
        "anthropic.apiKey=",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Run dry-run"));
    assertTrue(output.contains("Platforms        : website"));
    assertTrue(output.contains("transcript-derived fallback"));
    assertFalse(Files.exists(tempDir.resolve("work")));
  }

  @Test
  void runsEveryStageAndWritesReport() throws Exception {
    Path audio = Fixtures.writeWav(tempDir.resolve("show.wav"), 8000, 1);
    Files.writeString(tempDir.resolve("show.txt"),
        "Welcome to the show. Today we talk about event pipelines and how they scale. Thanks for listening.");
    Path report = tempDir.resolve("run.json");
    try (MockWebServer server = new MockWebServer()) {
      server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"episode_url\":\"https://show.dev/ep/1\"}"));
      server.start();

      ExitCode code = RunCli.run(new String[] {
          "audio=" + audio,
          "workDir=" + tempDir.resolve("work"),
          "art19.enabled=false",
          "twitter.enabled=false",
          "website.contentApiUrl=" + server.url("/api/episodes"),
          "anthropic.apiKey=",
          "title=Event Pipelines",
          "report=" + report});

      assertEquals(ExitCode.SUCCESS, code);
      RecordedRequest request = server.takeRequest();
      assertEquals("/api/episodes", request.getPath());
      Object body = new JsonSupport().parse(request.getBody().readUtf8());
      assertEquals(Optional.of("Event Pipelines"), JsonSupport.text(body, "episode", "title"));
    }
    assertTrue(buffer.toString().contains("COMPLETED_WITH_FALLBACK_CONTENT"));
    assertTrue(buffer.toString().contains("https://show.dev/ep/1"));
    Object document = new JsonSupport().parse(Files.readString(report));
    assertEquals(Optional.of("COMPLETED_WITH_FALLBACK_CONTENT"), JsonSupport.text(document, "state"));
  }

  @Test
  void exitCodeReflectsFailureCause() {
    WorkflowRequest request = WorkflowRequest.of(Path.of("/audio/a.wav"), "en");

    WorkflowResult completed = WorkflowResult.builder("r1", request)
        .complete(WorkflowState.COMPLETED_WITH_FALLBACK_CONTENT, 5);
    WorkflowResult config = WorkflowResult.builder("r2", request)
        .enter(WorkflowState.PUBLISHING)
        .fail(StageFailure.thrown(Stage.PUBLISHING, new ConfigurationException("no publishing platforms enabled")), 5);
    WorkflowResult interrupted = WorkflowResult.builder("r3", request)
        .fail(StageFailure.thrown(Stage.TRANSCRIPTION, new InterruptedException()), 5);
    WorkflowResult invalid = WorkflowResult.builder("r4", request)
        .fail(StageFailure.missingFields(Stage.CONTENT_GENERATION, List.of("title")), 5);

    assertEquals(ExitCode.SUCCESS, RunCli.exitCodeFor(completed));
    assertEquals(ExitCode.CONFIG_ERROR, RunCli.exitCodeFor(config));
    assertEquals(ExitCode.INTERRUPTED, RunCli.exitCodeFor(interrupted));
    assertEquals(ExitCode.STAGE_FAILED, RunCli.exitCodeFor(invalid));
  }
}
