package com.questrail.conformance.listener.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the parent directory with the JDK {@link WatchService} and forwards
 * events for the watched file name only.
 */
public final class WatchServiceStrategy implements FileWatchStrategy
{
    private static final Logger log = LoggerFactory.getLogger(WatchServiceStrategy.class);

    private volatile WatchService watchService;
    private volatile Thread thread;

    @Override
    public void start(Path file, FileChangeHandler handler) throws IOException {
        if (watchService != null) {
            throw new IllegalStateException("Already watching");
        }
        Path directory = file.getParent();
        Path name = file.getFileName();

        WatchService ws = FileSystems.getDefault().newWatchService();
        directory.register(ws, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        watchService = ws;

        Thread t = new Thread(() -> loop(ws, name, handler), "file-watch-" + name);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    private static void loop(WatchService ws, Path name, FileChangeHandler handler) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = ws.take();
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == OVERFLOW) {
                        handler.onModified();
                        continue;
                    }
                    if (!name.equals(event.context())) {
                        continue;
                    }
                    if (event.kind() == ENTRY_CREATE) {
                        handler.onCreated();
                    } else if (event.kind() == ENTRY_MODIFY) {
                        handler.onModified();
                    } else if (event.kind() == ENTRY_DELETE) {
                        handler.onDeleted();
                    }
                }
                if (!key.reset()) {
                    log.warn("Watch on directory of {} is no longer valid", name);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service for {} closed", name);
        } catch (RuntimeException e) {
            log.error("File watch for {} failed", name, e);
        }
    }

    @Override
    public void close() {
        WatchService ws = watchService;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
        if (ws != null) {
            try {
                ws.close();
            } catch (IOException e) {
                log.warn("Could not close watch service: {}", e.getMessage());
            }
        }
        thread = null;
    }
}
