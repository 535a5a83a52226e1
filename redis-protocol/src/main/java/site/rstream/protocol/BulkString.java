package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.rstream.datastructure.RedisBytes;

/**
 * RESP批量字符串
 *
 * <p>内容为null时编码为 "$-1\r\n"。内部解码路径使用 {@link #wrapTrusted(byte[])} 避免拷贝，
 * 外部数据使用 {@link #create(byte[])}。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** null 批量字符串，对应 "$-1\r\n" */
    public static final BulkString NULL = new BulkString((RedisBytes) null);

    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(new RedisBytes(content));
    }

    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final RedisBytes value = ((BulkString) resp).content;
        if (value == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = value.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * @return 字符串内容，null批量字符串返回null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
