package com.talewright.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * CLI command: talewright status &lt;run-id&gt;
 * <p>
 * Queries a running Talewright server for the run and displays its position and outcome.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId);
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }
            print(mapper.readValue(response.body(), new TypeReference<Map<String, Object>>() {}));

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Talewright server at localhost:" + port);
            ConsoleOutput.info("Start the server first: talewright serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Status request interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
        }
    }

    private static void print(Map<String, Object> run) {
        System.out.println();
        System.out.println("RUN " + run.get("run_id"));
        System.out.println("Project: " + run.get("project_id"));
        System.out.println("Seed:    " + truncate(String.valueOf(run.get("seed_idea")), 70));

        String status = String.valueOf(run.get("status"));
        switch (status) {
            case "COMPLETED" -> ConsoleOutput.success("Status: " + status);
            case "FAILED", "CANCELLED" -> ConsoleOutput.error("Status: " + status);
            default -> ConsoleOutput.info("Status: " + status);
        }
        ConsoleOutput.info(String.format("Phase: %s | Scene: %s/%s | Words: %s",
                run.get("phase"), run.get("current_scene"), run.get("total_scenes"), run.get("word_count")));
        if (run.get("error") != null) {
            ConsoleOutput.error("Error: " + run.get("error"));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
