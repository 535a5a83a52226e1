package site.rstream.replication.link;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.concurrent.Promise;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.SimpleString;
import site.rstream.replication.ReplicationException;
import site.rstream.replication.host.ReplicationHost;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 从节点侧的复制处理器
 *
 * <p>握手顺序：PING → REPLCONF listening-port → REPLCONF capa psync2 → PSYNC ? -1，
 * 随后接收 FULLRESYNC 状态行和不带结尾CRLF的RDB数据，然后进入命令流模式。
 *
 * <p>命令流模式下每条命令按其线上字节数累加偏移量。
 * REPLCONF GETACK 先以处理前的偏移量回复 ACK，再累加自身长度。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class ReplicationHandler extends ByteToMessageDecoder {

    private final ReplicationHost host;

    private final int listeningPort;

    private final Promise<Void> handshakePromise;

    @Getter
    private volatile ReplicationState state = ReplicationState.CONNECTING;

    /** 已处理的复制流字节数 */
    @Getter
    private volatile long offset;

    @Getter
    private volatile String masterReplId;

    public ReplicationHandler(final ReplicationHost host, final int listeningPort,
                              final Promise<Void> handshakePromise) {
        this.host = host;
        this.listeningPort = listeningPort;
        this.handshakePromise = handshakePromise;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.info("已连接主节点 {}，开始握手", ctx.channel().remoteAddress());
        send(ctx, RespArray.ofCommand("PING"));
        state = ReplicationState.WAIT_PONG;
        super.channelActive(ctx);
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable() && state != ReplicationState.CLOSED) {
            final boolean progressed;
            switch (state) {
                case WAIT_RDB:
                    progressed = readSnapshot(ctx, in);
                    break;
                case STREAMING:
                    progressed = readCommand(ctx, in);
                    break;
                default:
                    progressed = readHandshakeReply(ctx, in);
                    break;
            }
            if (!progressed) {
                return;
            }
        }
    }

    private boolean readHandshakeReply(final ChannelHandlerContext ctx, final ByteBuf in) {
        final Resp reply;
        try {
            reply = Resp.decode(in);
        } catch (IllegalArgumentException e) {
            fail(ctx, "握手回复格式错误: " + e.getMessage());
            return false;
        }
        if (reply == null) {
            return false;
        }
        if (!(reply instanceof SimpleString)) {
            final String detail = reply instanceof Errors ? ((Errors) reply).getContent() : reply.getClass().getSimpleName();
            fail(ctx, "握手阶段 " + state + " 收到意外回复: " + detail);
            return false;
        }
        final String text = ((SimpleString) reply).getContent();
        switch (state) {
            case WAIT_PONG:
                if (!expect(ctx, text, "PONG")) {
                    return false;
                }
                send(ctx, RespArray.ofCommand("REPLCONF", "listening-port", String.valueOf(listeningPort)));
                state = ReplicationState.WAIT_PORT_OK;
                break;
            case WAIT_PORT_OK:
                if (!expect(ctx, text, "OK")) {
                    return false;
                }
                send(ctx, RespArray.ofCommand("REPLCONF", "capa", "psync2"));
                state = ReplicationState.WAIT_CAPA_OK;
                break;
            case WAIT_CAPA_OK:
                if (!expect(ctx, text, "OK")) {
                    return false;
                }
                send(ctx, RespArray.ofCommand("PSYNC", "?", "-1"));
                state = ReplicationState.WAIT_FULLRESYNC;
                break;
            case WAIT_FULLRESYNC:
                final String[] parts = text.split(" ");
                if (parts.length != 3 || !"FULLRESYNC".equalsIgnoreCase(parts[0])) {
                    fail(ctx, "期望FULLRESYNC，实际: " + text);
                    return false;
                }
                masterReplId = parts[1];
                log.info("主节点接受全量同步: replid={}, offset={}", parts[1], parts[2]);
                state = ReplicationState.WAIT_RDB;
                break;
            default:
                fail(ctx, "非法的握手状态: " + state);
                return false;
        }
        return true;
    }

    private boolean expect(final ChannelHandlerContext ctx, final String actual, final String expected) {
        if (!expected.equalsIgnoreCase(actual)) {
            fail(ctx, "握手阶段 " + state + " 期望 " + expected + "，实际: " + actual);
            return false;
        }
        log.info("握手步骤 {} 完成", state);
        return true;
    }

    /**
     * 读取 {@code $<len>\r\n<bytes>}，没有结尾CRLF
     */
    private boolean readSnapshot(final ChannelHandlerContext ctx, final ByteBuf in) {
        final int start = in.readerIndex();
        if (in.getByte(start) != '$') {
            fail(ctx, "期望RDB数据，实际类型标识: " + (char) in.getByte(start));
            return false;
        }
        final int lineEnd = in.indexOf(start, in.writerIndex(), (byte) '\n');
        if (lineEnd < 0) {
            return false;
        }
        final String header = in.toString(start + 1, lineEnd - start - 1, StandardCharsets.US_ASCII).trim();
        final int length;
        try {
            length = Integer.parseInt(header);
        } catch (NumberFormatException e) {
            fail(ctx, "RDB长度无效: " + header);
            return false;
        }
        if (length < 0) {
            fail(ctx, "RDB长度无效: " + header);
            return false;
        }
        if (in.writerIndex() - (lineEnd + 1) < length) {
            return false;
        }
        final byte[] snapshot = new byte[length];
        in.readerIndex(lineEnd + 1);
        in.readBytes(snapshot);

        try {
            host.loadRdbSnapshot(snapshot);
            log.info("已加载主节点快照，{} 字节", length);
        } catch (IOException | RuntimeException e) {
            log.warn("主节点快照无法解析，已丢弃: {}", e.getMessage());
        }
        offset = 0;
        state = ReplicationState.STREAMING;
        handshakePromise.trySuccess(null);
        log.info("复制握手完成，进入命令流模式");
        return true;
    }

    private boolean readCommand(final ChannelHandlerContext ctx, final ByteBuf in) {
        final int start = in.readerIndex();
        final Resp resp;
        try {
            resp = Resp.decode(in);
        } catch (IllegalArgumentException e) {
            log.error("复制流格式错误，断开与主节点的连接: {}", e.getMessage());
            state = ReplicationState.CLOSED;
            ctx.close();
            return false;
        }
        if (resp == null) {
            return false;
        }
        final long consumed = in.readerIndex() - start;
        if (!(resp instanceof RespArray) || ((RespArray) resp).isNull() || ((RespArray) resp).getContent().length == 0) {
            offset += consumed;
            log.debug("忽略复制流中的非命令数据: {}", resp.getClass().getSimpleName());
            return true;
        }
        final RespArray command = (RespArray) resp;
        if (isGetAck(command)) {
            send(ctx, RespArray.ofCommand("REPLCONF", "ACK", String.valueOf(offset)));
            offset += consumed;
            return true;
        }
        offset += consumed;
        try {
            host.executeReplicated(command);
        } catch (RuntimeException e) {
            log.warn("执行复制命令失败: {}", e.getMessage());
        }
        return true;
    }

    private static boolean isGetAck(final RespArray command) {
        final Resp[] parts = command.getContent();
        return parts.length >= 2
                && parts[0] instanceof BulkString && "REPLCONF".equalsIgnoreCase(parts[0].toString())
                && parts[1] instanceof BulkString && "GETACK".equalsIgnoreCase(parts[1].toString());
    }

    private void send(final ChannelHandlerContext ctx, final Resp message) {
        ctx.channel().writeAndFlush(message);
    }

    private void fail(final ChannelHandlerContext ctx, final String reason) {
        if (state == ReplicationState.CLOSED) {
            return;
        }
        log.error("复制握手失败: {}", reason);
        state = ReplicationState.CLOSED;
        handshakePromise.tryFailure(new ReplicationException(reason));
        ctx.close();
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (!handshakePromise.isDone()) {
            handshakePromise.tryFailure(new ReplicationException("握手完成前主节点关闭了连接"));
        } else {
            log.warn("与主节点的复制连接已断开，偏移量 {}", offset);
        }
        state = ReplicationState.CLOSED;
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (state.isHandshaking()) {
            fail(ctx, cause.getMessage());
            return;
        }
        log.error("复制连接异常", cause);
        ctx.close();
    }
}
