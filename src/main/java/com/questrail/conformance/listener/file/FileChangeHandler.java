package com.questrail.conformance.listener.file;

/**
 * Callbacks from a {@link FileWatchStrategy}.
 */
public interface FileChangeHandler
{
    void onCreated();

    void onModified();

    void onDeleted();
}
