package com.questrail.conformance.listener;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a test's listener receives triggers. Two running tests must never share
 * a destination.
 */
public sealed interface ListenerDestination
        permits ListenerDestination.UnixSocket, ListenerDestination.Tcp, ListenerDestination.TailFile
{
    record UnixSocket(Path path) implements ListenerDestination {
        public UnixSocket {
            path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        }

        @Override
        public String toString() {
            return "unix:" + path;
        }
    }

    record Tcp(InetSocketAddress address) implements ListenerDestination {
        public Tcp {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public String toString() {
            return "tcp:" + address.getHostString() + ":" + address.getPort();
        }
    }

    record TailFile(Path path) implements ListenerDestination {
        public TailFile {
            path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        }

        @Override
        public String toString() {
            return "file:" + path;
        }
    }
}
