package com.chronograph.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: chronograph serve
 * <p>
 * Starts the observability server: hook ingestion, dashboard API, SSE stream and
 * MCP tools. Also the mode used when no arguments are given. The web server is
 * enabled by {@link com.chronograph.ChronographApplication#main}, and
 * {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code CHRONOGRAPH_PORT=9000 chronograph serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Chronograph server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8765}")
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
        ConsoleOutput.info("Chronograph server running on port " + port);
        System.out.println();
        System.out.println("  State:   http://localhost:" + port + "/api/state");
        System.out.println("  Stream:  http://localhost:" + port + "/api/events/stream");
        System.out.println("  Hooks:   POST http://localhost:" + port + "/api/events");
        System.out.println("  MCP:     http://localhost:" + port + "/mcp");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
