package site.rstream.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.connection.ConnectionListener;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 客户端命令处理器
 *
 * <p>在 RespDecoder/RespEncoder 之后，运行在服务器唯一的事件循环线程上。
 * 连接建立时分配句柄，断开时通知服务器清理该句柄下的状态。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    static final AttributeKey<ClientConnection> CONNECTION = AttributeKey.valueOf("rstream.connection");

    /** 非数组的请求 */
    private static final Errors UNSUPPORTED_REQUEST = new Errors("ERR Protocol error: expected array of bulk strings");

    private static final AtomicInteger NEXT_ID = new AtomicInteger(ClientConnection.MASTER_LINK_ID + 1);

    private final ConnectionListener listener;

    public RespCommandHandler(final ConnectionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener不能为null");
        }
        this.listener = listener;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        final ClientConnection connection = new ClientConnection(NEXT_ID.getAndIncrement(), ctx.channel());
        ctx.channel().attr(CONNECTION).set(connection);
        log.debug("{} 已连接", connection);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final ClientConnection connection = ctx.channel().attr(CONNECTION).get();
        if (msg instanceof RespArray) {
            listener.onCommand(connection, (RespArray) msg);
        } else {
            ctx.writeAndFlush(UNSUPPORTED_REQUEST);
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        final ClientConnection connection = ctx.channel().attr(CONNECTION).getAndSet(null);
        if (connection != null) {
            log.debug("{} 已断开", connection);
            listener.onDisconnect(connection.getId());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("连接异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
