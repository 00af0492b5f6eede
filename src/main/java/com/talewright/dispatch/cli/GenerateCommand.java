package com.talewright.dispatch.cli;

import com.talewright.core.engine.RunLifecycleManager;
import com.talewright.core.events.EventSink;
import com.talewright.core.events.EventStreamer;
import com.talewright.core.events.RunEvent;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;
import com.talewright.core.model.RunStatus;
import com.talewright.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * CLI command: talewright generate "&lt;seed idea&gt;"
 * <p>
 * Starts a run in this process and follows its event stream on the console until the run
 * completes, fails or is cancelled. The manuscript can be written to a file with {@code --output}.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate a story from a seed idea")
@Component
public class GenerateCommand implements Runnable {

    @Parameters(index = "0", description = "Seed idea for the story")
    private String seedIdea;

    @Option(names = {"--project", "-p"}, description = "Project id (default: ${DEFAULT-VALUE})",
            defaultValue = "default")
    private String projectId;

    @Option(names = {"--model", "-m"}, description = "Model to use (default: configured model)")
    private String model;

    @Option(names = {"--temperature", "-t"}, description = "Sampling temperature (default: ${DEFAULT-VALUE})",
            defaultValue = "0.8")
    private double temperature;

    @Option(names = {"--output", "-o"}, description = "Write the final manuscript to this file")
    private Path output;

    private final RunLifecycleManager lifecycleManager;
    private final EventStreamer eventStreamer;

    public GenerateCommand(RunLifecycleManager lifecycleManager, EventStreamer eventStreamer) {
        this.lifecycleManager = lifecycleManager;
        this.eventStreamer = eventStreamer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        String runId;
        try {
            ModelConfig modelConfig = model != null ? new ModelConfig(model, temperature) : null;
            runId = lifecycleManager.startGeneration(projectId, seedIdea, modelConfig);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error("Cannot start generation: " + e.getMessage());
            return;
        }
        ConsoleOutput.info("Run " + runId + " started");
        System.out.println();

        eventStreamer.stream(runId, 0, new ConsoleSink());

        System.out.println();
        lifecycleManager.getRunStatus(runId).ifPresentOrElse(this::printResult,
                () -> ConsoleOutput.error("Run " + runId + " is no longer registered"));
    }

    private void printResult(RunState state) {
        RunStatus status = state.status();
        switch (status) {
            case COMPLETED -> ConsoleOutput.success("Run " + state.getRunId() + " completed: "
                    + state.getTotalScenes() + " scene(s)");
            case FAILED -> ConsoleOutput.error("Run " + state.getRunId() + " failed: " + state.getError());
            default -> ConsoleOutput.info("Run " + state.getRunId() + " stopped with status " + status);
        }
        if (status == RunStatus.COMPLETED && output != null) {
            writeManuscript(state);
        }
    }

    private void writeManuscript(RunState state) {
        Map<String, Object> finalDraft = state.artifact(Phase.POLISH.outputArtifact());
        Object manuscript = finalDraft.get("manuscript");
        if (manuscript == null) {
            ConsoleOutput.error("Run produced no manuscript");
            return;
        }
        try {
            Files.writeString(output, String.valueOf(manuscript));
            ConsoleOutput.success("Manuscript written to " + output);
        } catch (IOException e) {
            ConsoleOutput.error("Failed to write manuscript: " + e.getMessage());
        }
    }

    static final class ConsoleSink implements EventSink {

        @Override
        public void send(RunEvent event) {
            ConsoleOutput.event(event);
        }

        @Override
        public void heartbeat(String runId, Instant at) {
            // console stays quiet between events
        }
    }
}
