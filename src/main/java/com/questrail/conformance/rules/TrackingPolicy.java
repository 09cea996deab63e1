package com.questrail.conformance.rules;

/**
 * How the validator accounts for a rule.
 */
public enum TrackingPolicy {
    /** Must match at least once; starts failed. */
    REQUIRED,
    /** Asserts the attribute never fires; starts passed and is never moved by evaluation. */
    FORBIDDEN,
    /** Evaluated and logged, never counted. */
    ADVISORY
}
