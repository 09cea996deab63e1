package com.questrail.conformance.listener.file;

import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.listener.ListenerDestination;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class FileTailListenerTest {

    @TempDir
    Path dir;

    private final BlockingQueue<TriggerEvent> queue = new LinkedBlockingQueue<>();
    private final List<FileTailListener> listeners = new ArrayList<>();

    @AfterEach
    void tearDown() {
        listeners.forEach(FileTailListener::stop);
    }

    private FileTailListener start(Path file, FileWatchStrategy strategy) throws Exception {
        FileTailListener listener = new FileTailListener(new ListenerDestination.TailFile(file), queue, strategy);
        listeners.add(listener);
        listener.start().get(5, TimeUnit.SECONDS);
        return listener;
    }

    private static FileWatchStrategy strategy(String kind) {
        return "polling".equals(kind) ? new PollingStrategy(Duration.ofMillis(20)) : new WatchServiceStrategy();
    }

    private static void append(Path file, String text) throws Exception {
        Files.writeString(file, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private List<TriggerEvent> drainEventually(int expected) {
        await().atMost(Duration.ofSeconds(10)).until(() -> queue.size() >= expected);
        List<TriggerEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    @ParameterizedTest
    @ValueSource(strings = {"polling", "watch"})
    void readsLinesAppendedAfterCreation(String kind) throws Exception {
        Path file = dir.resolve("t.txt");
        start(file, strategy(kind));

        append(file, "A 1\n");
        assertEquals(List.of(new TriggerEvent("A", "1")), drainEventually(1));

        append(file, "B 2\nC 3\n");
        assertEquals(List.of(new TriggerEvent("B", "2"), new TriggerEvent("C", "3")), drainEventually(2));
    }

    @Test
    void existingContentIsReadOnStart() throws Exception {
        Path file = dir.resolve("t.txt");
        append(file, "A 1\n");
        start(file, strategy("polling"));

        assertEquals(List.of(new TriggerEvent("A", "1")), drainEventually(1));
    }

    @Test
    void partialLineWaitsForItsNewline() throws Exception {
        Path file = dir.resolve("t.txt");
        start(file, strategy("polling"));

        append(file, "Reply-Message hel");
        Thread.sleep(200);
        assertTrue(queue.isEmpty());

        append(file, "lo\n");
        assertEquals(List.of(new TriggerEvent("Reply-Message", "hello")), drainEventually(1));
    }

    @Test
    void truncatedFileIsReadFromTheStart() throws Exception {
        Path file = dir.resolve("t.txt");
        start(file, strategy("polling"));

        append(file, "A first-value-that-is-long\n");
        drainEventually(1);

        Files.writeString(file, "B 2\n", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
        assertEquals(List.of(new TriggerEvent("B", "2")), drainEventually(1));
    }

    @Test
    void survivesDeleteAndRecreate() throws Exception {
        Path file = dir.resolve("t.txt");
        start(file, strategy("polling"));

        append(file, "A 1\n");
        drainEventually(1);
        Files.delete(file);
        Thread.sleep(100);
        append(file, "B 2\n");

        assertEquals(List.of(new TriggerEvent("B", "2")), drainEventually(1));
    }

    @Test
    void stopRenamesFileToBackup() throws Exception {
        Path file = dir.resolve("t.txt");
        FileTailListener listener = start(file, strategy("polling"));
        append(file, "A 1\n");
        drainEventually(1);

        listener.stop();
        listener.stop();

        assertFalse(Files.exists(file));
        assertEquals("A 1\n", Files.readString(dir.resolve("t.txt.bak")));
    }
}
