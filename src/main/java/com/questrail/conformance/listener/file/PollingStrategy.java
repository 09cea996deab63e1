package com.questrail.conformance.listener.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Objects;

/**
 * Polls the file's size, modification time and identity at a fixed interval.
 */
public final class PollingStrategy implements FileWatchStrategy
{
    private static final Logger log = LoggerFactory.getLogger(PollingStrategy.class);

    private final Duration interval;
    private volatile Thread thread;

    public PollingStrategy(Duration interval) {
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    @Override
    public void start(Path file, FileChangeHandler handler) throws IOException {
        if (thread != null) {
            throw new IllegalStateException("Already watching");
        }
        Snapshot initial = Snapshot.of(file);
        Thread t = new Thread(() -> loop(file, handler, initial), "file-poll-" + file.getFileName());
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    private void loop(Path file, FileChangeHandler handler, Snapshot initial) {
        Snapshot last = initial;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(interval.toMillis());
                Snapshot now = Snapshot.of(file);
                if (!last.exists() && now.exists()) {
                    handler.onCreated();
                } else if (last.exists() && !now.exists()) {
                    handler.onDeleted();
                } else if (now.exists() && !Objects.equals(last.fileKey(), now.fileKey())) {
                    handler.onDeleted();
                    handler.onCreated();
                } else if (now.exists() && !now.equals(last)) {
                    handler.onModified();
                }
                last = now;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            log.error("Polling {} failed", file, e);
        }
    }

    @Override
    public void close() {
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
        thread = null;
    }

    private record Snapshot(boolean exists, long size, long modified, Object fileKey) {
        static Snapshot of(Path file) throws IOException {
            try {
                BasicFileAttributes a = Files.readAttributes(file, BasicFileAttributes.class);
                return new Snapshot(true, a.size(), a.lastModifiedTime().toMillis(), a.fileKey());
            } catch (NoSuchFileException e) {
                return new Snapshot(false, 0, 0, null);
            }
        }
    }
}
