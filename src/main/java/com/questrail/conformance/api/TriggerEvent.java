package com.questrail.conformance.api;

import java.util.Objects;

/**
 * An observation delivered by a host under test: the attribute that fired and
 * the raw value it fired with.
 *
 * <p>One {@code TriggerEvent} corresponds to exactly one wire line
 * {@code "<attribute> <value>"}. The value may contain spaces but never a
 * newline.</p>
 */
public record TriggerEvent(String attribute, String value) {
    public TriggerEvent {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(value, "value");
    }
}
