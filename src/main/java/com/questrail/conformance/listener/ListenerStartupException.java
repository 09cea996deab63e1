package com.questrail.conformance.listener;

/**
 * A listener could not bind its socket or open its file.
 */
public final class ListenerStartupException extends RuntimeException
{
    public ListenerStartupException(String message, Throwable cause) {
        super(message, cause);
    }

    public ListenerStartupException(String message) {
        super(message);
    }
}
