package com.questrail.conformance.scenario;

/**
 * Final verdict of a test.
 */
public enum TestStatus
{
    /** Every state completed. */
    PASSED,
    /** A state timed out with failures or was aborted. */
    FAILED,
    /** The overall test deadline passed first. */
    TIMED_OUT,
    /** The harness was shut down while the test was running. */
    ABORTED
}
