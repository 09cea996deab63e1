package com.questrail.conformance.listener.file;

import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.listener.ListenerStartupException;
import com.questrail.conformance.listener.TriggerLineParser;
import com.questrail.conformance.listener.TriggerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FileTailListener
 * =============================================================================
 * Follows one text file that hosts append trigger lines to.
 *
 * <p>On create the file is opened and drained from the start; on modify it is
 * drained from the last read position (from 0 if it was truncated); on delete
 * the remainder is drained and the handle closed. A trailing fragment without
 * a newline is held until the line is completed, or emitted when the file
 * goes away.</p>
 *
 * <p>{@link #stop()} renames the consumed file to {@code <file>.bak}.</p>
 */
public final class FileTailListener implements TriggerListener, FileChangeHandler
{
    private static final Logger log = LoggerFactory.getLogger(FileTailListener.class);

    private static final int READ_CHUNK = 8192;

    private final ListenerDestination.TailFile destination;
    private final BlockingQueue<TriggerEvent> sink;
    private final FileWatchStrategy strategy;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    // guarded by this
    private FileChannel channel;
    private Object openedKey;
    private long position;
    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

    public FileTailListener(ListenerDestination.TailFile destination,
                            BlockingQueue<TriggerEvent> sink,
                            FileWatchStrategy strategy)
    {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    @Override
    public ListenerDestination destination() {
        return destination;
    }

    private Path file() {
        return destination.path();
    }

    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("listener already started: " + destination);
        }
        try {
            Files.createDirectories(file().getParent());
            strategy.start(file(), this);
        } catch (IOException | RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ListenerStartupException("cannot watch " + file(), e));
        }
        if (Files.exists(file())) {
            onCreated();
        }
        log.info("Tailing triggers from {}", file());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized void onCreated() {
        if (channel != null && Objects.equals(openedKey, currentKey())) {
            // same file already open
            drain();
            return;
        }
        closeChannel();
        position = 0;
        partial.reset();
        drain();
    }

    private Object currentKey() {
        try {
            return Files.readAttributes(file(), BasicFileAttributes.class).fileKey();
        } catch (IOException e) {
            return null;
        }
    }

    @Override
    public synchronized void onModified() {
        drain();
    }

    @Override
    public synchronized void onDeleted() {
        drain();
        flushPartial();
        closeChannel();
        position = 0;
    }

    private void drain() {
        if (stopped.get()) {
            return;
        }
        try {
            if (channel == null) {
                channel = FileChannel.open(file(), StandardOpenOption.READ);
                openedKey = currentKey();
                position = 0;
            }
            long size = channel.size();
            if (size < position) {
                log.debug("{} was truncated; reading from the start", file());
                position = 0;
                partial.reset();
            }
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
            while (position < size) {
                buffer.clear();
                int n = channel.read(buffer, position);
                if (n <= 0) {
                    break;
                }
                position += n;
                consume(buffer.array(), n);
            }
        } catch (NoSuchFileException e) {
            log.debug("{} not present yet", file());
        } catch (IOException e) {
            log.warn("Failed reading {}: {}", file(), e.getMessage());
            closeChannel();
        }
    }

    private void consume(byte[] bytes, int length) {
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (bytes[i] == '\n') {
                partial.write(bytes, start, i - start);
                emit(partial.toString(StandardCharsets.UTF_8));
                partial.reset();
                start = i + 1;
            }
        }
        partial.write(bytes, start, length - start);
    }

    private void flushPartial() {
        if (partial.size() > 0) {
            emit(partial.toString(StandardCharsets.UTF_8));
            partial.reset();
        }
    }

    private void emit(String line) {
        TriggerLineParser.parse(line).ifPresent(event -> {
            log.debug("Read trigger {} '{}'", event.attribute(), event.value());
            if (!sink.offer(event)) {
                log.warn("Trigger queue full; dropped {}", event.attribute());
            }
        });
    }

    private void closeChannel() {
        FileChannel c = channel;
        channel = null;
        openedKey = null;
        if (c != null) {
            try {
                c.close();
            } catch (IOException e) {
                log.debug("Closing {} failed: {}", file(), e.getMessage());
            }
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        strategy.close();
        synchronized (this) {
            closeChannel();
        }
        Path backup = file().resolveSibling(file().getFileName() + ".bak");
        try {
            if (Files.exists(file())) {
                Files.move(file(), backup, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Could not move {} to {}: {}", file(), backup, e.getMessage());
        }
        log.debug("Listener on {} stopped", destination);
    }
}
