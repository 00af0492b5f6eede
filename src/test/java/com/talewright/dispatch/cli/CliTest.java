package com.talewright.dispatch.cli;

import com.talewright.core.engine.RunLifecycleManager;
import com.talewright.core.events.EventBus;
import com.talewright.core.events.EventStreamer;
import com.talewright.core.events.EventTypes;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;
import com.talewright.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Talewright CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private static final String RUN_ID = "TLWR-2026-0001-abcd";

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(RunLifecycleManager manager, EventStreamer streamer) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GenerateCommand.class) {
                    return (K) new GenerateCommand(manager, streamer);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(RunLifecycleManager manager, EventStreamer streamer, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TalewrightCommand(), createFactory(manager, streamer));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(RunLifecycleManager.class), new EventStreamer(new EventBus(), Duration.ofSeconds(1)), args);
    }

    private static RunState completedState() {
        RunState state = RunState.create(RUN_ID, "default", "A keeper hears the sea speak",
                ModelConfig.of("test-model"), Instant.now());
        state.setPhase(Phase.POLISH);
        state.setTotalScenes(2);
        state.putArtifact(Phase.POLISH.outputArtifact(), Map.of("manuscript", "## Scene 1\n\nThe storm broke."));
        state.setCompleted(true);
        return state;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("generate"), "Help should list 'generate' subcommand");
            assertTrue(output.contains("status"), "Help should list 'status' subcommand");
            assertTrue(output.contains("watch"), "Help should list 'watch' subcommand");
            assertTrue(output.contains("serve"), "Help should list 'serve' subcommand");
            assertTrue(output.contains("Multi-agent narrative generation"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Talewright 0.1.0"));
        }

        @Test
        @DisplayName("generate without a seed idea is a usage error")
        void generateRequiresSeed() {
            CliResult result = execute("generate");
            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("streams the run's events and reports completion")
        void streamsUntilTerminal() {
            EventBus eventBus = new EventBus();
            eventBus.publish(RUN_ID, EventTypes.GENERATION_STARTED, Map.of("seedIdea", "A keeper"));
            eventBus.publish(RUN_ID, EventTypes.PHASE_START, Map.of("phase", "concept", "agent", "architect"));
            eventBus.publish(RUN_ID, EventTypes.GENERATION_COMPLETED, Map.of("runId", RUN_ID, "scenes", 2));
            RunLifecycleManager manager = mock(RunLifecycleManager.class);
            when(manager.startGeneration(eq("default"), eq("A keeper hears the sea speak"), any()))
                    .thenReturn(RUN_ID);
            when(manager.getRunStatus(RUN_ID)).thenReturn(Optional.of(completedState()));

            CliResult result = execute(manager, new EventStreamer(eventBus, Duration.ofSeconds(1)),
                    "generate", "A keeper hears the sea speak");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("[PHASE]"));
            assertTrue(output.contains("concept (architect)"));
            assertTrue(output.contains("[COMPLETE]"));
            assertTrue(output.contains("completed: 2 scene(s)"));
        }

        @Test
        @DisplayName("--output writes the manuscript")
        void writesManuscript(@TempDir Path dir) throws Exception {
            EventBus eventBus = new EventBus();
            eventBus.publish(RUN_ID, EventTypes.GENERATION_COMPLETED, Map.of("runId", RUN_ID));
            RunLifecycleManager manager = mock(RunLifecycleManager.class);
            when(manager.startGeneration(anyString(), anyString(), any())).thenReturn(RUN_ID);
            when(manager.getRunStatus(RUN_ID)).thenReturn(Optional.of(completedState()));
            Path out = dir.resolve("story.md");

            CliResult result = execute(manager, new EventStreamer(eventBus, Duration.ofSeconds(1)),
                    "generate", "A keeper hears the sea speak", "--model", "gpt-test", "-o", out.toString());

            assertEquals(0, result.exitCode());
            assertEquals("## Scene 1\n\nThe storm broke.", Files.readString(out));
        }

        @Test
        @DisplayName("a refused start is reported without streaming")
        void reportsRefusedStart() {
            RunLifecycleManager manager = mock(RunLifecycleManager.class);
            when(manager.startGeneration(anyString(), anyString(), any()))
                    .thenThrow(new IllegalStateException("Shutting down; no new runs are accepted"));

            CliResult result = execute(manager, new EventStreamer(new EventBus(), Duration.ofSeconds(1)),
                    "generate", "A keeper hears the sea speak");

            assertTrue(result.output().contains("Cannot start generation: Shutting down"));
        }
    }

    @Nested
    @DisplayName("watch stream parsing")
    class WatchParsing {

        @Test
        @DisplayName("tracks the last event id and prints one line per data frame")
        void parsesFrames() {
            ByteArrayOutputStream capture = new ByteArrayOutputStream();
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(capture, true));
            WatchCommand.SseLineParser parser = new WatchCommand.SseLineParser();
            try {
                parser.accept("id:3");
                parser.accept("event:scene_final");
                parser.accept("data:{\"sceneNumber\":1}");
                parser.accept("");
                parser.accept(":heartbeat 2026-01-01T00:00:00Z");
                parser.accept("id:4");
                parser.accept("event:generation_completed");
                parser.accept("data:{}");
            } finally {
                System.setOut(originalOut);
            }

            assertEquals(4, parser.lastId());
            String output = capture.toString();
            assertTrue(output.contains("[SCENE]"));
            assertTrue(output.contains("[COMPLETE]"));
            assertFalse(output.contains("heartbeat"));
        }
    }
}
