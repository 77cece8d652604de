package com.chronograph.ingest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The progress log could not be read: missing, unreadable or replaced mid-read.
 * The watcher logs it and retries on its next poll.
 */
public class WatchSourceUnavailableException extends IOException {

    private final Path path;

    public WatchSourceUnavailableException(Path path, String reason, Throwable cause) {
        super("Progress log " + path + " unavailable: " + reason, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
