package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP数组
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();

    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    public static final RespArray NULL = new RespArray((Resp[]) null);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /** 由字符串参数构造命令数组，如 {@code REPLCONF GETACK *} */
    public static RespArray ofCommand(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(array);
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final Resp[] arrayContent = ((RespArray) resp).getContent();
        if (arrayContent == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (arrayContent.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }
        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, arrayContent.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : arrayContent) {
            element.encode(element, byteBuf);
        }
    }
}
