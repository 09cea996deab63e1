package com.questrail.conformance.listener;

import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.listener.file.FileTailListener;
import com.questrail.conformance.listener.file.FileWatchStrategy;
import com.questrail.conformance.listener.netty.NettyStreamListener;

import java.util.concurrent.BlockingQueue;

/**
 * Creates the listener variant matching a {@link ListenerDestination}.
 */
public interface ListenerFactory
{
    TriggerListener create(ListenerDestination destination, BlockingQueue<TriggerEvent> sink);

    static ListenerFactory defaults() {
        return (destination, sink) -> {
            if (destination instanceof ListenerDestination.TailFile file) {
                return new FileTailListener(file, sink, FileWatchStrategy.forPlatform());
            }
            return new NettyStreamListener(destination, sink);
        };
    }
}
