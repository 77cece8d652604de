package com.chronograph.dispatch.cli;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * HTTP access to a running Chronograph server on localhost, shared by the CLI commands.
 */
@Component
public class ServerClient {

    /** picocli default for {@code --port}: the CHRONOGRAPH_PORT system property or environment variable, else 8765. */
    static final String DEFAULT_PORT = "${CHRONOGRAPH_PORT:-8765}";
    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;

    public ServerClient() {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    ServerClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Fetches the pipeline snapshot as JSON.
     *
     * @throws IOException when the server is unreachable or answers with an error status
     */
    public String fetchState(int port) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, "/api/state"))
                .header("Accept", "application/json")
                .timeout(CONNECT_TIMEOUT)
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("Server returned HTTP " + response.statusCode());
        }
        return response.body();
    }

    /**
     * Posts a hook body to the event endpoint.
     *
     * @return the HTTP status code
     */
    public int postEvent(int port, String body, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, "/api/events"))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    /**
     * Opens the SSE stream and hands every raw line to {@code lineConsumer} until the server closes it.
     */
    public void streamEvents(int port, Consumer<String> lineConsumer) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri(port, "/api/events/stream"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            throw new IOException("Server returned HTTP " + response.statusCode());
        }
        try (Stream<String> lines = response.body()) {
            lines.forEach(lineConsumer);
        }
    }

    private static URI uri(int port, String path) {
        return URI.create("http://localhost:" + port + path);
    }
}
