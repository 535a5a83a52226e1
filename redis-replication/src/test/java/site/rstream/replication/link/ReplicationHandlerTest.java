package site.rstream.replication.link;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.Promise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.handler.RespEncoder;
import site.rstream.replication.ReplicationException;
import site.rstream.replication.host.ReplicationHost;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("从节点复制处理器测试")
class ReplicationHandlerTest {

    private static final String SET_FOO_BAR = "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n";

    private static final String GETACK = "*3\r\n$8\r\nREPLCONF\r\n$6\r\nGETACK\r\n$1\r\n*\r\n";

    @Mock
    private ReplicationHost host;

    private EmbeddedChannel channel;

    private ReplicationHandler handler;

    private Promise<Void> handshake;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        handshake = channel.eventLoop().newPromise();
        handler = new ReplicationHandler(host, 6380, handshake);
        channel.pipeline().addLast(new RespEncoder(), handler);
        // 注册时通道已激活，手动触发握手起点
        channel.pipeline().fireChannelActive();
    }

    private String readOutbound() {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "期望有发往主节点的数据");
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    private void feed(String text) {
        channel.writeInbound(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    private void completeHandshake() {
        assertEquals("*1\r\n$4\r\nPING\r\n", readOutbound());
        feed("+PONG\r\n");
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$14\r\nlistening-port\r\n$4\r\n6380\r\n", readOutbound());
        feed("+OK\r\n");
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$4\r\ncapa\r\n$6\r\npsync2\r\n", readOutbound());
        feed("+OK\r\n");
        assertEquals("*3\r\n$5\r\nPSYNC\r\n$1\r\n?\r\n$2\r\n-1\r\n", readOutbound());
    }

    @Test
    @DisplayName("完整握手后加载快照并进入命令流模式")
    void testHandshake() throws IOException {
        completeHandshake();
        assertFalse(handshake.isDone());

        feed("+FULLRESYNC 8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb 0\r\n$5\r\nREDIS");

        assertTrue(handshake.isSuccess());
        assertEquals(ReplicationState.STREAMING, handler.getState());
        assertEquals("8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb", handler.getMasterReplId());
        verify(host).loadRdbSnapshot("REDIS".getBytes(StandardCharsets.US_ASCII));
        assertEquals(0, handler.getOffset());
    }

    @Test
    @DisplayName("快照与后续命令在同一个数据包中到达")
    void testSnapshotAndCommandsInOnePacket() {
        completeHandshake();

        feed("+FULLRESYNC abc 0\r\n$3\r\nRDB" + SET_FOO_BAR + SET_FOO_BAR.substring(0, 10));

        ArgumentCaptor<RespArray> command = ArgumentCaptor.forClass(RespArray.class);
        verify(host, times(1)).executeReplicated(command.capture());
        assertEquals("SET", command.getValue().getContent()[0].toString());
        assertEquals(31, handler.getOffset());

        feed(SET_FOO_BAR.substring(10));
        verify(host, times(2)).executeReplicated(any());
        assertEquals(62, handler.getOffset());
        assertNull(channel.readOutbound(), "普通复制命令不回复");
    }

    @Test
    @DisplayName("GETACK以处理前的偏移量回复")
    void testGetAck() {
        completeHandshake();
        feed("+FULLRESYNC abc 0\r\n$3\r\nRDB");

        feed(GETACK);
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$3\r\nACK\r\n$1\r\n0\r\n", readOutbound());
        assertEquals(37, handler.getOffset());

        feed(SET_FOO_BAR + GETACK);
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$3\r\nACK\r\n$2\r\n68\r\n", readOutbound());
        assertEquals(105, handler.getOffset());
    }

    @Test
    @DisplayName("握手阶段收到错误回复时失败并关闭连接")
    void testHandshakeFailure() {
        readOutbound();
        feed("-ERR not allowed\r\n");

        assertTrue(handshake.isDone());
        assertFalse(handshake.isSuccess());
        assertInstanceOf(ReplicationException.class, handshake.cause());
        assertFalse(channel.isActive());
        assertEquals(ReplicationState.CLOSED, handler.getState());
    }

    @Test
    @DisplayName("握手完成前主节点断开")
    void testMasterClosedDuringHandshake() {
        readOutbound();
        channel.close();

        assertFalse(handshake.isSuccess());
        assertInstanceOf(ReplicationException.class, handshake.cause());
    }

    @Test
    @DisplayName("无法解析的快照被丢弃，握手仍然完成")
    void testUnparsableSnapshot() throws IOException {
        doThrow(new IOException("bad")).when(host).loadRdbSnapshot(any());
        completeHandshake();

        feed("+FULLRESYNC abc 0\r\n$3\r\nXYZ");

        assertTrue(handshake.isSuccess());
        assertEquals(ReplicationState.STREAMING, handler.getState());
    }
}
