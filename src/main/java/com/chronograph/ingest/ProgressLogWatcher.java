package com.chronograph.ingest;

import com.chronograph.core.config.ChronographProperties;
import com.chronograph.core.events.EventStore;
import com.chronograph.core.logging.MdcContext;
import com.chronograph.core.metrics.ChronographMetrics;
import com.chronograph.core.model.Event;
import com.chronograph.core.model.ValidationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fallback phase source: polls the progress log for appended lines and turns each
 * phase line into a phase-transition event.
 * <p>
 * Lines present when the watcher starts are skipped. Only complete lines are
 * consumed; a partially written last line waits for the next poll. A missing file
 * is retried on every poll, and a truncated or rotated file is re-read from the
 * start (the raw line is the de-dup nonce, so replayed lines are not stored twice).
 */
@Component
public class ProgressLogWatcher {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogWatcher.class);
    static final String SOURCE = "watcher";

    /** Upper bound on bytes consumed per poll. */
    static final int MAX_READ_BYTES = 1 << 20;

    private final EventStore eventStore;
    private final ChronographMetrics metrics;
    private final Path progressFile;
    private final Duration pollInterval;
    private final boolean enabled;

    private ScheduledExecutorService scheduler;

    // Only touched by the polling thread (or by the caller in tests).
    private boolean initialized;
    private long position;
    private Object fileKey;
    private boolean outageReported;

    private volatile boolean sourceAvailable;
    private volatile long linesConsumed;

    @Autowired
    public ProgressLogWatcher(EventStore eventStore, ChronographMetrics metrics, ChronographProperties properties) {
        this(eventStore, metrics,
                properties.getWatch().isEnabled() ? properties.getWatch().progressFile() : null,
                properties.getWatch().getPollInterval());
    }

    ProgressLogWatcher(EventStore eventStore, ChronographMetrics metrics, Path progressFile, Duration pollInterval) {
        this.eventStore = eventStore;
        this.metrics = metrics;
        this.progressFile = progressFile;
        this.pollInterval = pollInterval;
        this.enabled = progressFile != null;
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("Progress log watcher disabled (no watch directory configured)");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-watcher");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(50, pollInterval.toMillis());
        scheduler.scheduleWithFixedDelay(this::pollSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Watching {} for progress lines (interval={}ms)", progressFile, intervalMs);
    }

    @PreDestroy
    void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Progress log watcher stopped");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isSourceAvailable() {
        return sourceAvailable;
    }

    public long linesConsumed() {
        return linesConsumed;
    }

    public Path progressFile() {
        return progressFile;
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            // A scheduled task that throws is never run again.
            log.error("Progress log poll failed", e);
        }
    }

    /**
     * Reads and ingests lines appended since the previous poll.
     *
     * @return number of events appended
     */
    int poll() {
        List<String> lines;
        try {
            lines = readNewLines();
            if (outageReported) {
                log.info("Progress log {} available again", progressFile);
            }
            outageReported = false;
            sourceAvailable = true;
        } catch (WatchSourceUnavailableException e) {
            sourceAvailable = false;
            if (!outageReported) {
                log.warn("{}; retrying every {}ms", e.getMessage(), pollInterval.toMillis());
                outageReported = true;
            } else {
                log.debug("{}", e.getMessage());
            }
            return 0;
        }

        int appended = 0;
        for (String line : lines) {
            linesConsumed++;
            try {
                Optional<Event> parsed = ProgressLineParser.parse(line);
                metrics.recordWatchedLine(parsed.isPresent());
                if (parsed.isEmpty()) {
                    continue;
                }
                Event event = parsed.get();
                MdcContext.setEvent(event);
                eventStore.append(event);
                appended++;
            } catch (ValidationException e) {
                metrics.recordRejected(SOURCE);
                log.warn("Rejected progress line '{}': {}", line, e.getMessage());
            } catch (RuntimeException e) {
                // The offset is already past this batch.
                log.error("Failed to ingest progress line '{}'", line, e);
            } finally {
                MdcContext.clear();
            }
        }
        return appended;
    }

    List<String> readNewLines() throws WatchSourceUnavailableException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(progressFile, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            // A file that appears later is read from its first line.
            initialized = true;
            position = 0;
            fileKey = null;
            throw new WatchSourceUnavailableException(progressFile, "file does not exist", e);
        } catch (IOException e) {
            throw new WatchSourceUnavailableException(progressFile, e.getMessage(), e);
        }

        long size = attrs.size();
        Object key = attrs.fileKey();
        if (!initialized) {
            initialized = true;
            position = size;
            fileKey = key;
            log.debug("Progress log {} opened at offset {}", progressFile, size);
            return List.of();
        }
        if (fileKey != null && key != null && !Objects.equals(fileKey, key)) {
            log.info("Progress log {} was rotated, reading from the start", progressFile);
            position = 0;
        } else if (size < position) {
            log.info("Progress log {} was truncated ({} < {}), reading from the start", progressFile, size, position);
            position = 0;
        }
        fileKey = key;
        if (size == position) {
            return List.of();
        }

        byte[] bytes;
        try (SeekableByteChannel channel = Files.newByteChannel(progressFile, StandardOpenOption.READ)) {
            channel.position(position);
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(size - position, MAX_READ_BYTES));
            while (buffer.hasRemaining() && channel.read(buffer) > 0) {
                // fill
            }
            bytes = new byte[buffer.position()];
            buffer.flip();
            buffer.get(bytes);
        } catch (NoSuchFileException e) {
            throw new WatchSourceUnavailableException(progressFile, "file disappeared while reading", e);
        } catch (IOException e) {
            throw new WatchSourceUnavailableException(progressFile, e.getMessage(), e);
        }

        int lastNewline = lastIndexOf(bytes, (byte) '\n');
        if (lastNewline < 0) {
            if (bytes.length >= MAX_READ_BYTES) {
                log.warn("Skipping {} bytes of {} without a line break", bytes.length, progressFile);
                position += bytes.length;
            }
            return List.of();
        }
        position += lastNewline + 1;
        return new String(bytes, 0, lastNewline + 1, StandardCharsets.UTF_8).lines().toList();
    }

    private static int lastIndexOf(byte[] bytes, byte value) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == value) {
                return i;
            }
        }
        return -1;
    }
}
