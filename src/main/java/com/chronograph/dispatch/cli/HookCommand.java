package com.chronograph.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: chronograph hook
 * <p>
 * Registered as the assistant's lifecycle hook. Reads one JSON hook body from stdin
 * and forwards it to {@code POST /api/events}. Always exits 0 and prints nothing
 * on stdout: a missing or slow server must never disturb the observed pipeline.
 */
@Command(name = "hook", mixinStandardHelpOptions = true,
        description = "Forward a hook notification read from stdin to the server")
@Component
public class HookCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HookCommand.class);
    static final Duration POST_TIMEOUT = Duration.ofSeconds(5);

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = ServerClient.DEFAULT_PORT)
    private int port;

    private final ServerClient serverClient;
    private InputStream input = System.in;

    public HookCommand(ServerClient serverClient) {
        this.serverClient = serverClient;
    }

    HookCommand(ServerClient serverClient, InputStream input) {
        this.serverClient = serverClient;
        this.input = input;
    }

    @Override
    public Integer call() {
        try {
            String body = new String(input.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (body.isEmpty()) {
                return 0;
            }
            int status = serverClient.postEvent(port, body, POST_TIMEOUT);
            if (status >= 300) {
                log.debug("Hook forward answered HTTP {}", status);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.debug("Hook forward to localhost:{} failed: {}", port, e.getMessage());
        }
        return 0;
    }
}
