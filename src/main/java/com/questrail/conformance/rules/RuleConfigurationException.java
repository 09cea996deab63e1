package com.questrail.conformance.rules;

/**
 * A trigger condition could not be compiled: unknown condition name, missing or
 * malformed parameters, or a capability (scripting) that is not enabled.
 */
public final class RuleConfigurationException extends RuntimeException
{
    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
