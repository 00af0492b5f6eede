package com.talewright.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: talewright serve
 * <p>
 * Starts Talewright as a long-running HTTP server exposing the run API and SSE event streams.
 * The web server is enabled by {@link com.talewright.TalewrightApplication#main} detecting
 * "serve" in args; {@link CliRunner} then skips picocli and the banner is printed once the
 * embedded server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Talewright HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Talewright server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/runs");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/runs/{runId}/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
