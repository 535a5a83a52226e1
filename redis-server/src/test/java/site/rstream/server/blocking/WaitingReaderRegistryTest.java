package site.rstream.server.blocking;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.rstream.core.RedisCoreImpl;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.RespArray;
import site.rstream.server.ServerFixture;
import site.rstream.server.connection.ClientConnection;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("阻塞读登记表测试")
class WaitingReaderRegistryTest {

    private static final RedisBytes STREAM = RedisBytes.fromString("events");

    private ServerFixture.SteppingClock clock;

    private RedisCoreImpl core;

    private WaitingReaderRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ServerFixture.SteppingClock(1_000L);
        core = new RedisCoreImpl(clock);
        registry = new WaitingReaderRegistry(core);
    }

    private ClientConnection park(final int id, final long timeoutMillis) {
        final ClientConnection connection = new ClientConnection(id, new EmbeddedChannel());
        registry.register(new WaitingReader(connection, List.of(STREAM), List.of(StreamEntryId.MIN), -1,
                timeoutMillis, core.currentTimeMillis()));
        return connection;
    }

    private void xadd(final String id) {
        core.xadd(STREAM, id, List.of(RedisBytes.fromString("f"), RedisBytes.fromString("v")));
        registry.signalKeyAsReady(STREAM);
    }

    @Test
    @DisplayName("就绪键上的等待者按登记顺序全部被唤醒")
    void servesAllReadersOnKey() {
        final ClientConnection first = park(1, 0);
        final ClientConnection second = park(2, 0);

        xadd("1-1");
        assertEquals(2, registry.serveReadyKeys());
        assertInstanceOf(RespArray.class, ServerFixture.lastReply(first));
        assertInstanceOf(RespArray.class, ServerFixture.lastReply(second));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("没有标记就绪时不唤醒")
    void nothingReady() {
        final ClientConnection connection = park(1, 0);
        assertEquals(0, registry.serveReadyKeys());
        assertNull(ServerFixture.lastReply(connection));
        assertTrue(registry.isWaiting(1));
    }

    @Test
    @DisplayName("没有等待者的键不会被记为就绪")
    void signalWithoutWaiters() {
        xadd("1-1");
        assertEquals(0, registry.serveReadyKeys());
    }

    @Test
    @DisplayName("超时只作用于设置了超时的等待者")
    void expiresOnlyTimedReaders() {
        final ClientConnection timed = park(1, 50);
        park(2, 0);

        clock.advance(49);
        assertEquals(0, registry.expireTimedOut(clock.millis()));
        clock.advance(1);
        assertEquals(1, registry.expireTimedOut(clock.millis()));
        assertSame(BulkString.NULL, ServerFixture.lastReply(timed));
        assertFalse(registry.isWaiting(1));
        assertTrue(registry.isWaiting(2));
    }

    @Test
    @DisplayName("移除后不再回复")
    void removeSilently() {
        final ClientConnection connection = park(1, 0);
        registry.remove(1);
        xadd("1-1");
        assertEquals(0, registry.serveReadyKeys());
        assertNull(ServerFixture.lastReply(connection));
    }

    @Test
    @DisplayName("同一连接再次登记时替换之前的登记")
    void reRegisterReplaces() {
        park(1, 0);
        park(1, 0);
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("键与ID数量不一致时拒绝")
    void mismatchedSizes() {
        final ClientConnection connection = new ClientConnection(1, new EmbeddedChannel());
        assertThrows(IllegalArgumentException.class, () -> new WaitingReader(connection,
                List.of(STREAM), List.of(), -1, 0, 0));
    }
}
