package com.chronograph.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.Callable;

/**
 * CLI command: chronograph status
 * <p>
 * Fetches the snapshot of a running server and prints the status cards,
 * the delegation hierarchy and the size of the interaction timeline.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the current pipeline status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})",
            defaultValue = ServerClient.DEFAULT_PORT)
    private int port;

    private final ServerClient serverClient;
    private final ObjectMapper objectMapper;

    public StatusCommand(ServerClient serverClient, ObjectMapper objectMapper) {
        this.serverClient = serverClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        JsonNode state;
        try {
            state = objectMapper.readTree(serverClient.fetchState(port));
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Chronograph server at localhost:" + port);
            ConsoleOutput.info("Start the server first: chronograph serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
            return 1;
        }

        JsonNode agents = state.path("agents");
        System.out.println();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents observed yet.");
        } else {
            System.out.printf("  %-20s %-16s %-10s %-8s %s%n", "AGENT", "TYPE", "STATE", "PHASE", "LAST MESSAGE");
            System.out.println("  " + "-".repeat(72));
            for (JsonNode card : agents) {
                ConsoleOutput.card(
                        card.path("agent_id").asText(),
                        card.path("agent_type").asText(),
                        card.path("lifecycle_state").asText(),
                        phase(card),
                        truncate(card.path("last_message").asText(), 30));
            }
        }

        JsonNode forest = state.path("delegation_forest");
        if (!forest.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Delegation hierarchy:");
            for (JsonNode root : forest) {
                printNode(root, 1);
            }
        }

        System.out.println();
        ConsoleOutput.info(String.format("Events: %d | Interactions: %d | Last sequence: %d",
                state.path("event_count").asInt(),
                state.path("interactions").size(),
                state.path("last_sequence").asLong()));
        return 0;
    }

    private static void printNode(JsonNode node, int depth) {
        String summary = node.path("summary").asText("");
        System.out.println("  ".repeat(depth) + "- " + node.path("agent_id").asText()
                + (summary.isBlank() ? "" : "  (" + truncate(summary, 40) + ")"));
        for (JsonNode child : node.path("children")) {
            printNode(child, depth + 1);
        }
    }

    private static String phase(JsonNode card) {
        int total = card.path("total_phases").asInt();
        return total > 0 ? card.path("phase").asInt() + "/" + total : "-";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
