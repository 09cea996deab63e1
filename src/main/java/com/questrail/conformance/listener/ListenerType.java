package com.questrail.conformance.listener;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Listener kind selected in the harness configuration.
 */
public enum ListenerType
{
    SOCKET(".sock"),
    FILE(".txt");

    private final String extension;

    ListenerType(String extension) {
        this.extension = extension;
    }

    /**
     * {@code <directory>/<testName>.sock} or {@code <directory>/<testName>.txt}.
     */
    public ListenerDestination destinationFor(Path directory, String testName) {
        Path path = directory.resolve(testName + extension);
        return this == SOCKET
                ? new ListenerDestination.UnixSocket(path)
                : new ListenerDestination.TailFile(path);
    }

    public static ListenerType fromName(String name) {
        return valueOf(name.strip().toUpperCase(Locale.ROOT));
    }
}
