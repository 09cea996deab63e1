package com.questrail.conformance.listener;

import com.questrail.conformance.api.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Splits a trigger line into attribute and value.
 *
 * <p>The line is stripped, then split on the first space. A line without a
 * space has no value and is dropped.</p>
 */
public final class TriggerLineParser
{
    private static final Logger log = LoggerFactory.getLogger(TriggerLineParser.class);

    private TriggerLineParser() {
    }

    public static Optional<TriggerEvent> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return Optional.empty();
        }
        int space = stripped.indexOf(' ');
        if (space < 0) {
            log.warn("Dropping malformed trigger line (no value): '{}'", stripped);
            return Optional.empty();
        }
        return Optional.of(new TriggerEvent(stripped.substring(0, space), stripped.substring(space + 1)));
    }
}
