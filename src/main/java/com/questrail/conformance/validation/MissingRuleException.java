package com.questrail.conformance.validation;

/**
 * An event arrived for an attribute that has no rules registered in the
 * current state. Expected during normal runs; callers log it and move on.
 */
public final class MissingRuleException extends RuntimeException
{
    private final String attribute;

    public MissingRuleException(String attribute) {
        super("No rules defined for attribute: " + attribute);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
