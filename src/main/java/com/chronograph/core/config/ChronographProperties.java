package com.chronograph.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the chronograph event store, live stream and progress-log watcher.
 *
 * <pre>
 * chronograph:
 *   watch:
 *     dir: ${CHRONOGRAPH_WATCH_DIR:}
 *     file-name: PROGRESS.md
 *     poll-interval: 1s
 *   stream:
 *     queue-capacity: 256
 *     heartbeat-interval: 30s
 *     emitter-timeout: 30m
 *   store:
 *     recent-event-limit: 20
 *     default-event-limit: 20
 *     orphan-grace-period: 0s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "chronograph")
public class ChronographProperties {

    private Watch watch = new Watch();
    private Stream stream = new Stream();
    private Store store = new Store();

    public Watch getWatch() { return watch; }
    public void setWatch(Watch watch) { this.watch = watch; }
    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Watch {
        private String dir = "";
        private String fileName = "PROGRESS.md";
        private Duration pollInterval = Duration.ofSeconds(1);

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        /**
         * Returns {@code true} when a watch directory is configured. Phase tracking from the
         * progress log is disabled otherwise.
         */
        public boolean isEnabled() {
            return dir != null && !dir.isBlank();
        }

        public Path progressFile() {
            return Path.of(dir).resolve(fileName);
        }
    }

    public static class Stream {
        private int queueCapacity = 256;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration emitterTimeout = Duration.ofMinutes(30);

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Duration getEmitterTimeout() { return emitterTimeout; }
        public void setEmitterTimeout(Duration emitterTimeout) { this.emitterTimeout = emitterTimeout; }
    }

    public static class Store {
        private int recentEventLimit = 20;
        private int defaultEventLimit = 20;
        private Duration orphanGracePeriod = Duration.ZERO;

        public int getRecentEventLimit() { return recentEventLimit; }
        public void setRecentEventLimit(int recentEventLimit) { this.recentEventLimit = recentEventLimit; }
        public int getDefaultEventLimit() { return defaultEventLimit; }
        public void setDefaultEventLimit(int defaultEventLimit) { this.defaultEventLimit = defaultEventLimit; }
        public Duration getOrphanGracePeriod() { return orphanGracePeriod; }
        public void setOrphanGracePeriod(Duration orphanGracePeriod) { this.orphanGracePeriod = orphanGracePeriod; }
    }
}
