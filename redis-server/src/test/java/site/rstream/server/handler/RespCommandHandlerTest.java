package site.rstream.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.SimpleString;
import site.rstream.protocol.handler.RespDecoder;
import site.rstream.protocol.handler.RespEncoder;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.connection.ConnectionListener;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("客户端命令处理器测试")
class RespCommandHandlerTest {

    @Mock
    private ConnectionListener listener;

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new RespCommandHandler(listener));
    }

    private static String readString(final EmbeddedChannel ch) {
        final ByteBuf buf = ch.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    @DisplayName("连接建立时分配句柄，命令交给监听器")
    void dispatchesCommands() {
        final ClientConnection connection = channel.attr(RespCommandHandler.CONNECTION).get();
        assertNotNull(connection);
        assertNotEquals(ClientConnection.MASTER_LINK_ID, connection.getId());

        channel.writeInbound(channel.alloc().buffer().writeBytes("*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8)));
        final ArgumentCaptor<RespArray> captor = ArgumentCaptor.forClass(RespArray.class);
        verify(listener).onCommand(eq(connection), captor.capture());
        assertEquals(1, captor.getValue().getContent().length);
    }

    @Test
    @DisplayName("连接的回复经过编码器")
    void replyIsEncoded() {
        channel.attr(RespCommandHandler.CONNECTION).get().reply(SimpleString.OK);
        assertEquals("+OK\r\n", readString(channel));
    }

    @Test
    @DisplayName("非数组请求回复协议错误")
    void rejectsNonArray() {
        channel.writeInbound(channel.alloc().buffer().writeBytes(":1\r\n".getBytes(StandardCharsets.UTF_8)));
        assertEquals("-ERR Protocol error: expected array of bulk strings\r\n", readString(channel));
        verify(listener, never()).onCommand(any(), any());
    }

    @Test
    @DisplayName("断开时通知监听器清理")
    void notifiesDisconnect() {
        final int id = channel.attr(RespCommandHandler.CONNECTION).get().getId();
        channel.close();
        verify(listener).onDisconnect(id);
    }
}
