package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP简单字符串
 *
 * <p>预定义常量：OK、PONG、QUEUED。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    public static final SimpleString OK = new SimpleString("OK");

    public static final SimpleString PONG = new SimpleString("PONG");

    public static final SimpleString QUEUED = new SimpleString("QUEUED");

    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }

    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        } else if ("QUEUED".equals(content)) {
            return QUEUED;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(((SimpleString) resp).content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
