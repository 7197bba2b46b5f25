package io.unitledger.core.feed;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.unitledger.core.audit.AuditEntry;
import io.unitledger.core.audit.AuditLog;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Streams the audit log to TCP subscribers.
 *
 * <p>A client sends {@code subscribe{fromSequence}}; the server replays every stored
 * entry from that sequence, sends {@code caught_up}, then forwards new entries as they
 * are appended. Each subscriber sees every sequence exactly once and in order.
 * Subscribers also receive periodic {@code heartbeat} frames carrying the log's
 * next sequence.
 */
public final class AuditFeedServer {
    private static final Logger LOG = Logger.getLogger(AuditFeedServer.class.getName());
    private static final AttributeKey<Subscriber> SUB_KEY = AttributeKey.valueOf("feed-subscriber");
    private static final long DEFAULT_HEARTBEAT_MS = 10_000L;

    private final AuditLog audit;
    private final int port;
    private final long heartbeatMillis;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Map<Channel, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Consumer<AuditEntry> fanOut = this::onAppended;

    private ScheduledExecutorService housekeeping;
    private Channel serverChannel;

    public AuditFeedServer(AuditLog audit, int port) {
        this(audit, port, DEFAULT_HEARTBEAT_MS);
    }

    public AuditFeedServer(AuditLog audit, int port, long heartbeatMillis) {
        this.audit = audit;
        this.port = port;
        this.heartbeatMillis = Math.max(50L, heartbeatMillis);
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            FeedCodec.configure(ch.pipeline());
                            ch.pipeline().addLast(new SubscriberHandler());
                        }
                    });
            serverChannel = bootstrap.bind(port).sync().channel();
            channels.add(serverChannel);
            audit.subscribe(fanOut);
            LOG.info(() -> "Audit feed listening on port " + boundPort());
            startHousekeeping();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting audit feed", e);
        }
    }

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void stop() {
        audit.unsubscribe(fanOut);
        if (housekeeping != null) {
            housekeeping.shutdownNow();
            housekeeping = null;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        subscribers.clear();
        LOG.info("Audit feed stopped");
    }

    private void startHousekeeping() {
        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "audit-feed-heartbeat");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(this::sendHeartbeats, heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
    }

    private void sendHeartbeats() {
        try {
            FeedMessage beat = FeedMessage.heartbeat(audit.nextSequence());
            for (Subscriber sub : subscribers.values()) {
                if (sub.channel.isActive()) {
                    sub.channel.writeAndFlush(beat);
                }
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Audit feed heartbeat failed", e);
        }
    }

    private void onAppended(AuditEntry entry) {
        for (Subscriber sub : subscribers.values()) {
            sub.deliver(entry);
        }
    }

    private final class SubscriberHandler extends SimpleChannelInboundHandler<FeedMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channels.add(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            subscribers.remove(ctx.channel());
            channels.remove(ctx.channel());
            LOG.fine(() -> "Feed subscriber left: " + ctx.channel().remoteAddress());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FeedMessage msg) {
            if (!FeedMessage.SUBSCRIBE.equals(msg.type())) {
                ctx.writeAndFlush(FeedMessage.error("unsupported message type: " + msg.type()));
                return;
            }
            if (ctx.channel().attr(SUB_KEY).get() != null) {
                ctx.writeAndFlush(FeedMessage.error("already subscribed"));
                return;
            }
            long from = msg.longField("fromSequence", 0L);
            if (from < 0) {
                ctx.writeAndFlush(FeedMessage.error("fromSequence must be >= 0"));
                return;
            }
            Subscriber sub = new Subscriber(ctx.channel(), from);
            ctx.channel().attr(SUB_KEY).set(sub);
            sub.replay();
            LOG.fine(() -> "Feed subscriber " + ctx.channel().remoteAddress() + " from sequence " + from);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Audit feed channel error", cause);
            ctx.close();
        }
    }

    private final class Subscriber {
        final Channel channel;
        private long next;

        Subscriber(Channel channel, long from) {
            this.channel = channel;
            this.next = from;
        }

        // Registered before reading the backlog so appends racing the replay are not lost;
        // the sequence cursor drops whatever the replay already sent.
        synchronized void replay() {
            subscribers.put(channel, this);
            for (AuditEntry entry : audit.entriesSince(next)) {
                send(entry);
            }
            channel.writeAndFlush(FeedMessage.caughtUp(next));
        }

        synchronized void deliver(AuditEntry entry) {
            if (entry.sequence() >= next && channel.isActive()) {
                send(entry);
            }
        }

        private void send(AuditEntry entry) {
            channel.writeAndFlush(new FeedMessage(FeedMessage.ENTRY, FeedCodec.toPayload(entry)));
            next = entry.sequence() + 1;
        }
    }
}
