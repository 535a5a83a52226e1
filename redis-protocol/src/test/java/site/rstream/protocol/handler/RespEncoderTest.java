package site.rstream.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.RdbPayload;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.RespInteger;
import site.rstream.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespEncoderTest {

    private static String writeAndRead(final Resp resp) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(resp));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
            channel.finish();
        }
    }

    @Test
    public void testEncodeExecResult() {
        RespArray execResult = new RespArray(new Resp[]{SimpleString.OK, RespInteger.valueOf(2)});
        assertEquals("*2\r\n+OK\r\n:2\r\n", writeAndRead(execResult));
    }

    @Test
    public void testEncodeFullResyncPayload() {
        assertEquals("$3\r\nabc", writeAndRead(new RdbPayload("abc".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    public void testEncodeBulkString() {
        assertEquals("$5\r\nhello\r\n", writeAndRead(BulkString.fromString("hello")));
    }
}
