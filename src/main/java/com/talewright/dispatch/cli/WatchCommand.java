package com.talewright.dispatch.cli;

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
import java.util.stream.Stream;

/**
 * CLI command: talewright watch &lt;run-id&gt;
 * <p>
 * Follows a run's SSE stream on a running server. With {@code --last-event-id} the stream resumes
 * after that event instead of replaying the whole retained log.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Watch a run's live events")
@Component
public class WatchCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    @Option(names = {"--last-event-id"}, description = "Resume after this event id (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private long lastEventId;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching run " + runId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId + "/events");
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET();
            if (lastEventId > 0) {
                request.header("Last-Event-ID", Long.toString(lastEventId));
            }

            HttpResponse<Stream<String>> response = client.send(request.build(), HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            SseLineParser parser = new SseLineParser();
            response.body().forEach(parser::accept);

            System.out.println();
            ConsoleOutput.info("Stream ended after event #" + parser.lastId() + ".");

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Talewright server at localhost:" + port);
            ConsoleOutput.info("Start the server first: talewright serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }

    /**
     * Accumulates {@code id:}, {@code event:} and {@code data:} lines; a data line emits the event.
     */
    static final class SseLineParser {

        private String eventType = "";
        private long lastId;

        void accept(String line) {
            if (line.startsWith("id:")) {
                try {
                    lastId = Long.parseLong(line.substring(3).trim());
                } catch (NumberFormatException e) {
                    ConsoleOutput.error("Ignoring malformed event id: " + line);
                }
            } else if (line.startsWith("event:")) {
                eventType = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String data = line.substring(5).trim();
                ConsoleOutput.watchEvent(eventType.isEmpty() ? "message" : eventType, data);
                eventType = "";
            }
        }

        long lastId() {
            return lastId;
        }
    }
}
