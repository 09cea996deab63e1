package com.questrail.conformance.listener.netty;

import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.listener.ListenerStartupException;
import com.questrail.conformance.listener.TriggerLineParser;
import com.questrail.conformance.listener.TriggerListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * NettyStreamListener
 * =============================================================================
 * Netty-backed stream listener for Unix domain sockets and TCP.
 *
 * <h2>Framing</h2>
 * Newline delimited UTF-8; each line goes through {@link TriggerLineParser}.
 * Malformed bytes are replaced rather than rejected. An over-long line closes
 * only the offending connection.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package. Callers see only
 * {@link TriggerListener} and {@link TriggerEvent}.
 *
 * <h2>Unix sockets</h2>
 * Unix domain sockets need the epoll transport. A stale file or directory at
 * the socket path is removed before binding, the socket is made world
 * writable once bound and the path is unlinked on {@link #stop()}.
 */
public final class NettyStreamListener implements TriggerListener
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamListener.class);

    static final int MAX_LINE_LENGTH = 64 * 1024;

    private final ListenerDestination destination;
    private final BlockingQueue<TriggerEvent> sink;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final ChannelGroup connections = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile EventLoopGroup group;
    private volatile Channel serverChannel;

    public NettyStreamListener(ListenerDestination destination, BlockingQueue<TriggerEvent> sink) {
        this.destination = Objects.requireNonNull(destination, "destination");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (destination instanceof ListenerDestination.TailFile) {
            throw new IllegalArgumentException("NettyStreamListener does not tail files: " + destination);
        }
    }

    @Override
    public ListenerDestination destination() {
        return destination;
    }

    /**
     * The address actually bound, once {@link #start()} has completed. For TCP
     * with port 0 this carries the chosen port.
     */
    public Optional<SocketAddress> boundAddress() {
        Channel ch = serverChannel;
        return ch == null ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("listener already started: " + destination);
        }
        CompletableFuture<Void> ready = new CompletableFuture<>();

        ServerBootstrap bootstrap = new ServerBootstrap();
        SocketAddress bindAddress;
        try {
            if (destination instanceof ListenerDestination.UnixSocket unix) {
                if (!Epoll.isAvailable()) {
                    throw new ListenerStartupException(
                            "Unix domain sockets need the epoll transport", Epoll.unavailabilityCause());
                }
                prepareSocketPath(unix.path());
                group = new EpollEventLoopGroup(1);
                bootstrap.group(group).channel(EpollServerDomainSocketChannel.class);
                bindAddress = new DomainSocketAddress(unix.path().toFile());
            } else {
                ListenerDestination.Tcp tcp = (ListenerDestination.Tcp) destination;
                group = new NioEventLoopGroup(1);
                bootstrap.group(group).channel(NioServerSocketChannel.class);
                bindAddress = tcp.address();
            }
        } catch (ListenerStartupException e) {
            ready.completeExceptionally(e);
            return ready;
        } catch (IOException | RuntimeException e) {
            ready.completeExceptionally(new ListenerStartupException("cannot prepare " + destination, e));
            return ready;
        }

        bootstrap.childHandler(new ChannelInitializer<Channel>() {
            @Override
            protected void initChannel(Channel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH, true, true));
                p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                p.addLast(new TriggerHandler());
            }
        });

        bootstrap.bind(bindAddress).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                ready.completeExceptionally(
                        new ListenerStartupException("failed to bind " + destination, future.cause()));
                return;
            }
            serverChannel = future.channel();
            if (destination instanceof ListenerDestination.UnixSocket unix) {
                try {
                    Files.setPosixFilePermissions(unix.path(), PosixFilePermissions.fromString("rwxrwxrwx"));
                } catch (IOException | UnsupportedOperationException e) {
                    ready.completeExceptionally(
                            new ListenerStartupException("cannot open permissions on " + unix.path(), e));
                    return;
                }
            }
            log.info("Listening for triggers on {}", destination);
            ready.complete(null);
        });
        return ready;
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        connections.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
        }
        EventLoopGroup g = group;
        if (g != null) {
            g.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(2, TimeUnit.SECONDS);
        }
        if (destination instanceof ListenerDestination.UnixSocket unix) {
            try {
                Files.deleteIfExists(unix.path());
            } catch (IOException e) {
                log.warn("Could not remove socket file {}: {}", unix.path(), e.getMessage());
            }
        }
        log.debug("Listener on {} stopped", destination);
    }

    private static void prepareSocketPath(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.isDirectory(path)) {
            try (Stream<Path> tree = Files.walk(path)) {
                for (Path p : (Iterable<Path>) tree.sorted(Comparator.reverseOrder())::iterator) {
                    Files.delete(p);
                }
            }
        } else {
            Files.deleteIfExists(path);
        }
    }

    /**
     * TriggerHandler
     * -------------------------------------------------------------------------
     * One instance per connection. Forwards parsed lines to the sink in arrival
     * order.
     */
    private final class TriggerHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            connections.add(ctx.channel());
            log.debug("Trigger connection opened on {}", destination);
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            TriggerLineParser.parse(line).ifPresent(event -> {
                log.debug("Received trigger {} '{}'", event.attribute(), event.value());
                if (!sink.offer(event)) {
                    log.warn("Trigger queue full; dropped {}", event.attribute());
                }
            });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof TooLongFrameException) {
                log.warn("Closing connection on {}: line exceeds {} bytes", destination, MAX_LINE_LENGTH);
            } else {
                log.warn("Closing connection on {} after error: {}", destination, cause.toString());
            }
            ctx.close();
        }
    }
}
