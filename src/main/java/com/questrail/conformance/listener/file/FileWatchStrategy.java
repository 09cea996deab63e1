package com.questrail.conformance.listener.file;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Delivers change notifications for exactly one file.
 *
 * <p>Implementations call the {@link FileChangeHandler} from a single thread
 * of their own. {@link #close()} stops that thread and is idempotent.</p>
 */
public interface FileWatchStrategy extends AutoCloseable
{
    void start(Path file, FileChangeHandler handler) throws IOException;

    @Override
    void close();

    /**
     * The JDK watch service, except on macOS where it is itself a slow poller
     * and direct attribute polling reacts faster.
     */
    static FileWatchStrategy forPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return new PollingStrategy(Duration.ofMillis(100));
        }
        return new WatchServiceStrategy();
    }
}
