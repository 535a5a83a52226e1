package site.rstream.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.core.RedisCore;
import site.rstream.core.RedisCoreImpl;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.handler.RespDecoder;
import site.rstream.protocol.handler.RespEncoder;
import site.rstream.rdb.RdbManager;
import site.rstream.replication.ReplicationCoordinator;
import site.rstream.replication.host.ReplicationHost;
import site.rstream.replication.link.ReplicationLink;
import site.rstream.server.blocking.WaitingReaderRegistry;
import site.rstream.server.command.CommandDispatcher;
import site.rstream.server.config.RedisServerConfig;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.connection.ConnectionListener;
import site.rstream.server.context.RedisContext;
import site.rstream.server.context.RedisContextImpl;
import site.rstream.server.handler.RespCommandHandler;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Redis服务器的轻量级实现
 *
 * <p>监听、客户端连接、主节点复制连接和定时任务共用一个单线程事件循环，
 * 命令因此按到达顺序串行执行，数据结构不需要加锁。
 *
 * <ul>
 *     <li>Linux 上使用 Epoll，其他平台使用 NIO</li>
 *     <li>每 {@code blockedReaderSweepMillis} 毫秒检查阻塞读超时</li>
 *     <li>每 {@code saveCheckMillis} 毫秒检查RDB保存策略</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisMiniServer implements RedisServer, ReplicationHost, ConnectionListener {

    private final RedisServerConfig config;

    private final EventLoopGroup eventLoop;

    private final Class<? extends ServerChannel> serverChannelClass;

    private final Class<? extends Channel> clientChannelClass;

    private final RedisCore redisCore;

    private final RdbManager rdbManager;

    private final WaitingReaderRegistry waitingReaderRegistry;

    private final ReplicationCoordinator replicationCoordinator;

    private final RedisContextImpl redisContext;

    private final CommandDispatcher dispatcher;

    private Channel serverChannel;

    private ReplicationLink replicationLink;

    private ScheduledFuture<?> sweepTask;

    private ScheduledFuture<?> saveTask;

    public RedisMiniServer(final RedisServerConfig config) {
        config.validate();
        this.config = config;

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup");
            this.eventLoop = new EpollEventLoopGroup(1, new DefaultThreadFactory("redis-epoll"));
            this.serverChannelClass = EpollServerSocketChannel.class;
            this.clientChannelClass = EpollSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup");
            this.eventLoop = new NioEventLoopGroup(1, new DefaultThreadFactory("redis-nio"));
            this.serverChannelClass = NioServerSocketChannel.class;
            this.clientChannelClass = NioSocketChannel.class;
        }

        this.redisCore = new RedisCoreImpl();
        this.rdbManager = new RdbManager(redisCore, config.getDir(), config.getDbFileName(),
                config.getSaveSeconds(), config.getSaveChanges());
        this.waitingReaderRegistry = new WaitingReaderRegistry(redisCore);
        this.replicationCoordinator = new ReplicationCoordinator(this, eventLoop.next());
        this.redisContext = new RedisContextImpl(redisCore, config, replicationCoordinator, waitingReaderRegistry);
        this.dispatcher = new CommandDispatcher(redisContext);
    }

    @Override
    public void start() {
        rdbManager.loadOnStartup();

        if (config.isReplica()) {
            connectToMaster();
        }

        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(eventLoop, eventLoop)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(new RespCommandHandler(RedisMiniServer.this));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("启动被中断", e);
        } catch (Exception e) {
            stop();
            throw new IllegalStateException("无法绑定 " + config.getHost() + ":" + config.getPort(), e);
        }

        sweepTask = eventLoop.scheduleAtFixedRate(
                () -> waitingReaderRegistry.expireTimedOut(redisCore.currentTimeMillis()),
                config.getBlockedReaderSweepMillis(), config.getBlockedReaderSweepMillis(), TimeUnit.MILLISECONDS);
        saveTask = eventLoop.scheduleAtFixedRate(rdbManager::saveIfNeeded,
                config.getSaveCheckMillis(), config.getSaveCheckMillis(), TimeUnit.MILLISECONDS);

        log.info("Redis server started at {}:{} ({})", config.getHost(), config.getPort(),
                config.isReplica() ? "replica of " + config.getReplicaOfHost() + ":" + config.getReplicaOfPort() : "master");
    }

    /**
     * 连接主节点并等待握手和快照加载完成，失败时抛出异常
     */
    private void connectToMaster() {
        replicationLink = new ReplicationLink(config.getReplicaOfHost(), config.getReplicaOfPort(), config.getPort(),
                this, eventLoop, clientChannelClass);
        redisContext.setReplicationLink(replicationLink);
        final Future<Void> handshake = replicationLink.connect();
        try {
            handshake.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("等待复制握手时被中断", e);
        }
        if (!handshake.isSuccess()) {
            stop();
            throw new IllegalStateException("与主节点握手失败: " + handshake.cause().getMessage(), handshake.cause());
        }
        log.info("已完成与主节点 {}:{} 的同步", config.getReplicaOfHost(), config.getReplicaOfPort());
    }

    @Override
    public void stop() {
        if (eventLoop.isShuttingDown()) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (replicationLink != null) {
                replicationLink.close();
            }
            if (sweepTask != null) {
                sweepTask.cancel(false);
            }
            if (saveTask != null) {
                saveTask.cancel(false);
            }
            // 保存在事件循环线程上执行，避免与命令并发修改数据
            eventLoop.submit(rdbManager::saveOnShutdown).sync();
        } catch (InterruptedException e) {
            log.error("Redis server stop error", e);
            Thread.currentThread().interrupt();
        } finally {
            eventLoop.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            log.info("Redis server stopped");
        }
    }

    @Override
    public RedisContext getRedisContext() {
        return redisContext;
    }

    // ========== ConnectionListener ==========

    @Override
    public void onCommand(final ClientConnection connection, final RespArray command) {
        dispatcher.dispatch(connection, command);
    }

    @Override
    public void onDisconnect(final int connectionId) {
        dispatcher.onDisconnect(connectionId);
        waitingReaderRegistry.remove(connectionId);
        replicationCoordinator.onDisconnect(connectionId);
    }

    // ========== ReplicationHost ==========

    @Override
    public void executeReplicated(final RespArray command) {
        dispatcher.executeReplicated(command);
    }

    @Override
    public byte[] generateRdbSnapshot() throws IOException {
        return rdbManager.generateSnapshot();
    }

    @Override
    public void loadRdbSnapshot(final byte[] snapshot) throws IOException {
        final int loaded = rdbManager.loadSnapshot(snapshot);
        log.info("从主节点快照加载 {} 个键", loaded);
    }
}
