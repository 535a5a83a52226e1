package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * 全量同步时跟在 FULLRESYNC 状态行之后的快照数据。
 *
 * <p>编码为 "$&lt;len&gt;\r\n&lt;bytes&gt;"，末尾没有 CRLF，因此它不是一个可以直接被
 * {@link Resp#decode(ByteBuf)} 解析的RESP值，接收方需要单独处理。
 */
@Getter
public class RdbPayload extends Resp {
    private final byte[] content;

    public RdbPayload(final byte[] content) {
        this.content = content;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final byte[] bytes = ((RdbPayload) resp).content;
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
    }
}
