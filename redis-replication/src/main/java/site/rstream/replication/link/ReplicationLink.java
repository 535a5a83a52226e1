package site.rstream.replication.link;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.protocol.handler.RespEncoder;
import site.rstream.replication.ReplicationException;
import site.rstream.replication.host.ReplicationHost;

/**
 * 从节点到主节点的复制连接
 *
 * <p>连接运行在与客户端连接相同的事件循环上，复制命令的执行因此与客户端命令串行。
 * 断开后不会自动重连。
 *
 * @author rstream
 * @since 1.0.0
 */
@Slf4j
@Getter
public class ReplicationLink {

    private final String masterHost;

    private final int masterPort;

    private final int listeningPort;

    private final ReplicationHost host;

    private final EventLoopGroup group;

    private final Class<? extends Channel> channelClass;

    private volatile Channel channel;

    private volatile ReplicationHandler handler;

    public ReplicationLink(final String masterHost, final int masterPort, final int listeningPort,
                           final ReplicationHost host, final EventLoopGroup group,
                           final Class<? extends Channel> channelClass) {
        this.masterHost = masterHost;
        this.masterPort = masterPort;
        this.listeningPort = listeningPort;
        this.host = host;
        this.group = group;
        this.channelClass = channelClass;
    }

    /**
     * 连接主节点并执行握手
     *
     * @return 握手完成（快照已加载）时成功，握手失败或连接失败时失败
     */
    public Future<Void> connect() {
        final Promise<Void> handshake = group.next().newPromise();
        handler = new ReplicationHandler(host, listeningPort, handshake);
        final ReplicationHandler linkHandler = handler;

        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(channelClass)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(final Channel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(linkHandler);
                    }
                });

        log.info("正在连接主节点 {}:{}", masterHost, masterPort);
        bootstrap.connect(masterHost, masterPort).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            } else {
                handshake.tryFailure(new ReplicationException(
                        "无法连接主节点 " + masterHost + ":" + masterPort, future.cause()));
            }
        });
        return handshake;
    }

    public long getOffset() {
        final ReplicationHandler current = handler;
        return current == null ? 0 : current.getOffset();
    }

    public String getMasterReplId() {
        final ReplicationHandler current = handler;
        return current == null ? null : current.getMasterReplId();
    }

    public ReplicationState getState() {
        final ReplicationHandler current = handler;
        return current == null ? ReplicationState.CONNECTING : current.getState();
    }

    public void close() {
        final Channel current = channel;
        if (current != null && current.isOpen()) {
            current.close();
        }
    }
}
