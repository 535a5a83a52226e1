package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP错误消息，格式 "-ERR message\r\n"
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {
    private final String content;

    public Errors(final String content) {
        this.content = content;
    }

    /** 参数个数错误的标准回复 */
    public static Errors wrongArity(final String commandName) {
        return new Errors("ERR wrong number of arguments for '" + commandName.toLowerCase() + "' command");
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(((Errors) resp).getContent().getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
