package com.questrail.conformance.scenario;

/**
 * A scenario file is invalid. The test it describes is skipped.
 */
public final class ScenarioConfigurationException extends RuntimeException
{
    public ScenarioConfigurationException(String message) {
        super(message);
    }

    public ScenarioConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
