package com.chronograph.ingest;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventBroadcaster;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProgressLogWatcher}. Polls are driven by the test, not the scheduler.
 */
class ProgressLogWatcherTest {

    @TempDir
    Path workDir;

    private Path progressFile;
    private SimpleMeterRegistry registry;
    private EventStore store;
    private ProgressLogWatcher watcher;

    @BeforeEach
    void setUp() {
        progressFile = workDir.resolve("PROGRESS.md");
        var properties = new ChronographProperties();
        registry = new SimpleMeterRegistry();
        var metrics = new ChronographMetrics(registry);
        store = new EventStore(new EventBroadcaster(metrics, properties), metrics, properties);
        watcher = new ProgressLogWatcher(store, metrics, progressFile, Duration.ofMillis(100));
    }

    private static String line(int phase, String name) {
        return "[2026-03-01T10:0" + phase + ":00Z] [researcher] Phase " + phase + "/5: " + name + " -- step " + phase + "\n";
    }

    private void append(String text) throws IOException {
        Files.writeString(progressFile, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private List<String> phaseNames() {
        return store.snapshot().recentEvents().stream()
                .map(e -> e.payloadString(Event.PHASE_NAME).orElse(""))
                .toList();
    }

    @Nested
    @DisplayName("tailing")
    class TailingTests {

        @Test
        @DisplayName("lines present at start are skipped, appended lines are ingested")
        void skipsExistingContent() throws Exception {
            append("# Progress\n" + line(1, "plan"));
            assertEquals(0, watcher.poll());

            append(line(2, "search") + line(3, "read"));

            assertEquals(2, watcher.poll());
            assertEquals(List.of("search", "read"), phaseNames());
            assertTrue(watcher.isSourceAvailable());
            assertEquals(2, watcher.linesConsumed());
        }

        @Test
        @DisplayName("an unparseable phase number does not drop the rest of the batch")
        void oversizedPhaseNumberSkipped() throws Exception {
            append("");
            assertEquals(0, watcher.poll());

            append("[t] [researcher] Phase 99999999999/6: discovery -- x\n"
                    + "[t] [researcher] Phase 2/6: discovery -- ok\n");

            assertEquals(1, watcher.poll());
            assertEquals(0, watcher.poll());
            assertEquals(1, store.size());
            assertEquals(List.of("discovery"), phaseNames());
            assertEquals(2, watcher.linesConsumed());
        }

        @Test
        @DisplayName("a partially written line waits for its line break")
        void partialLineWaits() throws Exception {
            append("");
            watcher.poll();

            String full = line(1, "plan");
            append(full.substring(0, 20));
            assertEquals(0, watcher.poll());

            append(full.substring(20));
            assertEquals(1, watcher.poll());
        }

        @Test
        @DisplayName("non-phase lines are counted but not stored")
        void nonPhaseLinesIgnored() throws Exception {
            append("");
            watcher.poll();

            append("some note\n" + line(1, "plan"));

            assertEquals(1, watcher.poll());
            assertEquals(1.0, registry.find("chronograph.watch.lines").tag("matched", "false").counter().count());
            assertEquals(1.0, registry.find("chronograph.watch.lines").tag("matched", "true").counter().count());
        }

        @Test
        @DisplayName("phase lines create a placeholder card for the agent type")
        void createsPlaceholderCard() throws Exception {
            append("");
            watcher.poll();
            append(line(2, "search"));
            watcher.poll();

            var card = store.snapshot().agent("researcher").orElseThrow();
            assertEquals("search", card.currentPhase());
            assertFalse(card.startObserved());
        }
    }

    @Nested
    @DisplayName("source failures")
    class SourceFailureTests {

        @Test
        @DisplayName("missing file is retried and read from the start once it appears")
        void missingFileRetried() throws Exception {
            assertEquals(0, watcher.poll());
            assertFalse(watcher.isSourceAvailable());
            assertEquals(0, watcher.poll());

            append(line(1, "plan"));

            assertEquals(1, watcher.poll());
            assertTrue(watcher.isSourceAvailable());
        }

        @Test
        @DisplayName("truncated file is re-read without duplicating events")
        void truncatedFileReread() throws Exception {
            append("");
            watcher.poll();
            append(line(1, "plan") + line(2, "search"));
            assertEquals(2, watcher.poll());

            Files.writeString(progressFile, line(1, "plan"), StandardCharsets.UTF_8,
                    StandardOpenOption.TRUNCATE_EXISTING);
            watcher.poll();
            append(line(3, "read"));
            watcher.poll();

            assertEquals(List.of("plan", "search", "read"), phaseNames());
        }

        @Test
        @DisplayName("rotated file is read from its first line")
        void rotatedFileReread() throws Exception {
            append(line(1, "plan") + line(2, "search") + line(3, "read"));
            watcher.poll();

            Path replacement = workDir.resolve("PROGRESS.md.new");
            Files.writeString(replacement, line(4, "write"), StandardCharsets.UTF_8);
            Files.move(replacement, progressFile, StandardCopyOption.REPLACE_EXISTING);

            assertEquals(1, watcher.poll());
            assertEquals(List.of("write"), phaseNames());
        }

        @Test
        @DisplayName("disabled watcher never schedules")
        void disabledWatcher() {
            var metrics = new ChronographMetrics(new SimpleMeterRegistry());
            var disabled = new ProgressLogWatcher(store, metrics, null, Duration.ofSeconds(1));

            disabled.start();

            assertFalse(disabled.isEnabled());
            disabled.stop();
        }
    }
}
