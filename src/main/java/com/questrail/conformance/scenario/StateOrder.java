package com.questrail.conformance.scenario;

import java.util.Locale;

/**
 * Order in which a test runs its states.
 */
public enum StateOrder
{
    SEQUENCE,
    RANDOM;

    /**
     * {@code random}, {@code unordered} and {@code shuffle} select
     * {@link #RANDOM}; {@code sequence} or nothing selects {@link #SEQUENCE}.
     */
    public static StateOrder fromName(String name) {
        if (name == null || name.isBlank()) {
            return SEQUENCE;
        }
        switch (name.strip().toLowerCase(Locale.ROOT)) {
            case "sequence":
                return SEQUENCE;
            case "random":
            case "unordered":
            case "shuffle":
                return RANDOM;
            default:
                throw new ScenarioConfigurationException("unknown state_order: " + name);
        }
    }
}
