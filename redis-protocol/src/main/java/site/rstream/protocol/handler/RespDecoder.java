package site.rstream.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>支持标准RESP格式和INLINE命令格式（如 "PING\r\n"）。
 *
 * <ul>
 *     <li>数据不完整 - 保持读索引不变，等待更多数据</li>
 *     <li>格式错误 - 回复 "-ERR Protocol error"，丢弃已缓冲的数据，连接保持打开</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final byte firstByte = in.getByte(in.readerIndex());

            // 1. 跳过前导的换行符
            if (firstByte == '\n' || firstByte == '\r') {
                in.skipBytes(1);
                continue;
            }

            // 2. 判断是RESP格式还是INLINE格式
            if (isValidRespType(firstByte)) {
                try {
                    final Resp resp = Resp.decode(in);
                    if (resp != null) {
                        out.add(resp);
                        log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
                    }
                } catch (IllegalArgumentException e) {
                    rejectMalformed(ctx, in, e.getMessage());
                }
                return;
            }

            final Resp inlineResp = decodeInlineCommand(ctx, in);
            if (inlineResp != null) {
                out.add(inlineResp);
                log.debug("成功解码INLINE命令");
            }
            return;
        }
    }

    private void rejectMalformed(final ChannelHandlerContext ctx, final ByteBuf in, final String detail) {
        log.warn("RESP格式错误，丢弃 {} 字节: {}", in.readableBytes(), detail);
        in.skipBytes(in.readableBytes());
        // 从pipeline尾部写出，保证经过RespEncoder
        ctx.channel().writeAndFlush(new Errors("ERR Protocol error: " + detail));
    }

    /**
     * 解码INLINE格式命令
     *
     * @return 解码结果，数据不完整或空行时返回null
     */
    private Resp decodeInlineCommand(final ChannelHandlerContext ctx, final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int lfIndex = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (lfIndex < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                rejectMalformed(ctx, in, "too big inline request");
            }
            return null;
        }
        int endIndex = lfIndex;
        if (endIndex > startIndex && in.getByte(endIndex - 1) == '\r') {
            endIndex--;
        }
        final byte[] lineBytes = new byte[endIndex - startIndex];
        in.getBytes(startIndex, lineBytes);
        in.readerIndex(lfIndex + 1);

        final BulkString[] parts = parseCommandParts(new String(lineBytes, StandardCharsets.UTF_8));
        if (parts.length == 0) {
            return null;
        }
        return new RespArray(parts);
    }

    /** 按空白分割命令行 */
    private BulkString[] parseCommandParts(final String commandLine) {
        final List<BulkString> parts = new ArrayList<>(8);
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            final char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    parts.add(BulkString.wrapTrusted(current.toString().getBytes(StandardCharsets.UTF_8)));
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(BulkString.wrapTrusted(current.toString().getBytes(StandardCharsets.UTF_8)));
        }
        return parts.toArray(new BulkString[0]);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private boolean isValidRespType(final byte b) {
        return b == '+' || b == '-' || b == ':' || b == '$' || b == '*';
    }
}
