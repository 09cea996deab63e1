package com.questrail.conformance.rules.script;

/**
 * Executes user supplied rule fragments in isolation from the harness.
 *
 * <p>The fragment sees the trigger value as {@code string} and a restricted
 * {@code logger}. Any failure, including a timeout, is a non-match.</p>
 */
public interface ScriptSandbox
{
    boolean evaluate(String source, String value);

    /**
     * A sandbox that refuses every fragment. Used when scripting is disabled.
     */
    static ScriptSandbox disabled() {
        return (source, value) -> {
            throw new IllegalStateException("code rules are disabled");
        };
    }
}
