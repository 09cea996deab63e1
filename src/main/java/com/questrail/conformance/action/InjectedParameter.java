package com.questrail.conformance.action;

/**
 * Parameters the harness fills in for an action instead of taking them from
 * the scenario file.
 */
public enum InjectedParameter
{
    /** {@code <test>-<host>-1}: the container the action runs from. */
    SOURCE("source"),
    /** {@code <test>-<target>-1}, rewritten from the scenario's short target name. */
    TARGET("target"),
    TEST_NAME("test_name"),
    /** The per-test SLF4J logger. */
    LOGGER("logger");

    private final String key;

    InjectedParameter(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
