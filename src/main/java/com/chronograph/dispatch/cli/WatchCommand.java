package com.chronograph.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.Callable;

/**
 * CLI command: chronograph watch
 * <p>
 * Tails the live SSE stream of a running server, one line per event.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Tail live pipeline events")
@Component
public class WatchCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = ServerClient.DEFAULT_PORT)
    private int port;

    private final ServerClient serverClient;

    public WatchCommand(ServerClient serverClient) {
        this.serverClient = serverClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching pipeline events (connecting to localhost:" + port + ")...");
        System.out.println();

        var parser = new SseLineParser();
        try {
            serverClient.streamEvents(port, parser::accept);
            System.out.println();
            ConsoleOutput.info("Stream ended.");
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Chronograph server at localhost:" + port);
            ConsoleOutput.info("Start the server first: chronograph serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
            return 1;
        }
    }

    /** Pairs {@code event:} and {@code data:} lines; comments and ids are ignored. */
    static final class SseLineParser {

        private String currentEventType = "";

        void accept(String line) {
            if (line.startsWith("event:")) {
                currentEventType = line.substring(6).trim();
            } else if (line.startsWith("data:")) {
                String eventType = currentEventType.isEmpty() ? "message" : currentEventType;
                ConsoleOutput.watchEvent(eventType, line.substring(5).trim());
                currentEventType = "";
            } else if (line.isEmpty()) {
                currentEventType = "";
            }
        }
    }
}
