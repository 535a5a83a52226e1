package site.rstream.server.command;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.RdbPayload;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.RespInteger;
import site.rstream.protocol.SimpleString;
import site.rstream.replication.host.ReplicationHost;
import site.rstream.server.ServerFixture;
import site.rstream.server.config.RedisServerConfig;
import site.rstream.server.connection.ClientConnection;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
@DisplayName("命令分发器测试")
class CommandDispatcherTest {

    @Mock
    private ReplicationHost host;

    @Mock
    private ScheduledExecutorService scheduler;

    private ServerFixture server;

    private ClientConnection client;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(host.generateRdbSnapshot()).thenReturn(new byte[]{'R', 'E', 'D', 'I', 'S'});
        server = new ServerFixture(RedisServerConfig.builder().port(6380).dir("/tmp/rdb-test").build(), host, scheduler);
        client = server.connect();
    }

    private static String bulk(final Resp resp) {
        return ((BulkString) resp).getContent().getString();
    }

    /** 记录写出顺序的出站处理器 */
    private static ChannelOutboundHandlerAdapter recorder(final String name, final List<String> order) {
        return new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(final ChannelHandlerContext ctx, final Object msg, final ChannelPromise promise) throws Exception {
                order.add(name);
                super.write(ctx, msg, promise);
            }
        };
    }

    private static String error(final Resp resp) {
        return assertInstanceOf(Errors.class, resp).getContent();
    }

    @Nested
    @DisplayName("基础命令")
    class BasicCommands {

        @Test
        @DisplayName("PING 和 ECHO")
        void pingAndEcho() {
            assertSame(SimpleString.PONG, server.send(client, "PING"));
            assertEquals("hello", bulk(server.send(client, "ECHO", "hello")));
        }

        @Test
        @DisplayName("命令名大小写不敏感")
        void caseInsensitiveCommandName() {
            assertSame(SimpleString.OK, server.send(client, "set", "k", "v"));
            assertEquals("v", bulk(server.send(client, "gEt", "k")));
        }

        @Test
        @DisplayName("未知命令回复带参数的错误")
        void unknownCommand() {
            assertEquals("ERR unknown command 'FOO', with args beginning with: 'a' 'b' ",
                    error(server.send(client, "FOO", "a", "b", "c")));
        }

        @Test
        @DisplayName("参数个数错误")
        void wrongArity() {
            assertEquals("ERR wrong number of arguments for 'get' command", error(server.send(client, "GET")));
            assertEquals("ERR wrong number of arguments for 'xadd' command",
                    error(server.send(client, "XADD", "s", "*", "f")));
        }

        @Test
        @DisplayName("SET PX 到期后读取为空")
        void setWithExpiry() {
            server.send(client, "SET", "k", "v", "PX", "100");
            assertEquals("v", bulk(server.send(client, "GET", "k")));
            server.clock.advance(100);
            assertSame(BulkString.NULL, server.send(client, "GET", "k"));
        }

        @Test
        @DisplayName("过期时间溢出时拒绝 SET")
        void setWithOverflowingExpiry() {
            assertEquals("ERR invalid expire time in 'set' command",
                    error(server.send(client, "SET", "k", "v", "PX", "9223372036854775807")));
            assertEquals("ERR invalid expire time in 'set' command",
                    error(server.send(client, "SET", "k", "v", "EX", "9223372036854775")));
            assertSame(BulkString.NULL, server.send(client, "GET", "k"));
        }

        @Test
        @DisplayName("INCR 对非整数回复错误")
        void incrNotInteger() {
            server.send(client, "SET", "k", "abc");
            assertEquals("ERR value is not an integer or out of range", error(server.send(client, "INCR", "k")));
        }

        @Test
        @DisplayName("对流执行 GET 回复 WRONGTYPE")
        void wrongType() {
            server.send(client, "XADD", "s", "1-1", "f", "v");
            assertTrue(error(server.send(client, "GET", "s")).startsWith("WRONGTYPE "));
            assertEquals("stream", ((SimpleString) server.send(client, "TYPE", "s")).getContent());
        }

        @Test
        @DisplayName("CONFIG GET dir")
        void configGet() {
            final RespArray reply = (RespArray) server.send(client, "CONFIG", "GET", "dir");
            assertEquals(2, reply.getContent().length);
            assertEquals("dir", bulk(reply.getContent()[0]));
            assertEquals("/tmp/rdb-test", bulk(reply.getContent()[1]));
        }

        @Test
        @DisplayName("INFO replication 报告主节点角色")
        void infoReplication() {
            final String info = bulk(server.send(client, "INFO", "replication"));
            assertTrue(info.contains("role:master\r\n"));
            assertTrue(info.contains("master_replid:8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb\r\n"));
            assertTrue(info.contains("master_repl_offset:0\r\n"));
        }
    }

    @Nested
    @DisplayName("事务")
    class Transactions {

        @Test
        @DisplayName("MULTI 之后的命令排队，EXEC 依次执行")
        void execRunsQueuedCommands() {
            assertSame(SimpleString.OK, server.send(client, "MULTI"));
            assertSame(SimpleString.QUEUED, server.send(client, "SET", "counter", "1"));
            assertSame(SimpleString.QUEUED, server.send(client, "INCR", "counter"));
            assertSame(BulkString.NULL, server.send(server.connect(), "GET", "counter"));

            final RespArray reply = (RespArray) server.send(client, "EXEC");
            assertEquals(2, reply.getContent().length);
            assertSame(SimpleString.OK, reply.getContent()[0]);
            assertEquals(RespInteger.valueOf(2), reply.getContent()[1]);
        }

        @Test
        @DisplayName("单个命令失败不影响其他命令")
        void failureInsideExec() {
            server.send(client, "SET", "text", "abc");
            server.send(client, "MULTI");
            server.send(client, "INCR", "text");
            server.send(client, "INCR", "other");
            final RespArray reply = (RespArray) server.send(client, "EXEC");
            assertInstanceOf(Errors.class, reply.getContent()[0]);
            assertEquals(RespInteger.ONE, reply.getContent()[1]);
        }

        @Test
        @DisplayName("空事务回复空数组")
        void emptyExec() {
            server.send(client, "MULTI");
            assertEquals(0, ((RespArray) server.send(client, "EXEC")).getContent().length);
        }

        @Test
        @DisplayName("没有 MULTI 的 EXEC 和 DISCARD")
        void withoutMulti() {
            assertEquals("ERR EXEC without MULTI", error(server.send(client, "EXEC")));
            assertEquals("ERR DISCARD without MULTI", error(server.send(client, "DISCARD")));
        }

        @Test
        @DisplayName("嵌套 MULTI 回复错误且不影响队列")
        void nestedMulti() {
            server.send(client, "MULTI");
            server.send(client, "SET", "k", "v");
            assertEquals("ERR MULTI calls can not be nested", error(server.send(client, "MULTI")));
            assertEquals(1, ((RespArray) server.send(client, "EXEC")).getContent().length);
        }

        @Test
        @DisplayName("DISCARD 丢弃队列")
        void discard() {
            server.send(client, "MULTI");
            server.send(client, "SET", "k", "v");
            assertSame(SimpleString.OK, server.send(client, "DISCARD"));
            assertSame(BulkString.NULL, server.send(client, "GET", "k"));
            assertEquals("ERR EXEC without MULTI", error(server.send(client, "EXEC")));
        }

        @Test
        @DisplayName("事务状态按连接隔离")
        void perConnection() {
            final ClientConnection other = server.connect();
            server.send(client, "MULTI");
            assertSame(SimpleString.OK, server.send(other, "SET", "k", "v"));
            assertSame(SimpleString.QUEUED, server.send(client, "GET", "k"));
        }

        @Test
        @DisplayName("断开连接丢弃事务")
        void disconnectDropsTransaction() {
            server.send(client, "MULTI");
            server.send(client, "SET", "k", "v");
            server.dispatcher.onDisconnect(client.getId());
            assertEquals("ERR EXEC without MULTI", error(server.send(client, "EXEC")));
        }
    }

    @Nested
    @DisplayName("复制传播与 WAIT")
    class Replication {

        private ClientConnection replica;

        @BeforeEach
        void attachReplica() {
            replica = server.connect();
            assertSame(SimpleString.OK, server.send(replica, "REPLCONF", "listening-port", "6381"));
            assertSame(SimpleString.OK, server.send(replica, "REPLCONF", "capa", "psync2"));
            assertInstanceOf(RdbPayload.class, server.send(replica, "PSYNC", "?", "-1"));
        }

        @Test
        @DisplayName("PSYNC 回复 FULLRESYNC 和快照")
        void fullResync() {
            server.connect();
            final ClientConnection second = server.connect();
            server.dispatcher.dispatch(second, RespArray.ofCommand("PSYNC", "?", "-1"));
            final List<Object> out = ServerFixture.drain(second);
            assertEquals(2, out.size());
            assertEquals("FULLRESYNC 8371b4fb1155b71f4a04d3e1bc3e18c4a990aeeb 0",
                    ((SimpleString) out.get(0)).getContent());
            assertInstanceOf(RdbPayload.class, out.get(1));
            assertEquals(2, server.coordinator.replicaCount());
        }

        @Test
        @DisplayName("成功的写命令被传播，读命令和失败的写命令不传播")
        void propagatesSuccessfulWrites() {
            ServerFixture.drain(replica);
            server.send(client, "SET", "foo", "bar");
            server.send(client, "GET", "foo");
            server.send(client, "INCR", "foo");

            final List<Object> propagated = ServerFixture.drain(replica);
            assertEquals(1, propagated.size());
            assertInstanceOf(ByteBuf.class, propagated.get(0));
            assertEquals(31, server.coordinator.getMasterOffset());
        }

        @Test
        @DisplayName("写命令先回复客户端再传播")
        void repliesBeforePropagating() {
            final List<String> order = new ArrayList<>();
            final ClientConnection recordedReplica = server.connect(new EmbeddedChannel(recorder("replica", order)));
            server.send(recordedReplica, "REPLCONF", "listening-port", "6382");
            server.dispatcher.dispatch(recordedReplica, RespArray.ofCommand("PSYNC", "?", "-1"));
            ServerFixture.drain(recordedReplica);
            final ClientConnection writer = server.connect(new EmbeddedChannel(recorder("client", order)));
            order.clear();

            server.send(writer, "SET", "foo", "bar");

            assertEquals(List.of("client", "replica"), order);
        }

        @Test
        @DisplayName("XADD 以生成好的 ID 传播")
        void xaddPropagatesResolvedId() {
            ServerFixture.drain(replica);
            final String id = bulk(server.send(client, "XADD", "s", "*", "f", "v"));
            assertEquals("1700000000000-0", id);

            final ByteBuf propagated = ((EmbeddedChannel) replica.getChannel()).readOutbound();
            final String wire;
            try {
                wire = propagated.toString(StandardCharsets.UTF_8);
            } finally {
                propagated.release();
            }
            assertEquals("*5\r\n$4\r\nXADD\r\n$1\r\ns\r\n$15\r\n1700000000000-0\r\n$1\r\nf\r\n$1\r\nv\r\n", wire);
        }

        @Test
        @DisplayName("EXEC 结束后按顺序传播事务中的写命令")
        void propagatesAfterExec() {
            ServerFixture.drain(replica);
            server.send(client, "MULTI");
            server.send(client, "SET", "foo", "bar");
            server.send(client, "GET", "foo");
            server.send(client, "SET", "foo", "baz");
            server.send(client, "EXEC");
            assertEquals(2, ServerFixture.drain(replica).size());
            assertEquals(62, server.coordinator.getMasterOffset());
        }

        @Test
        @DisplayName("没有写命令时 WAIT 立即回复从节点数")
        void waitWithoutWrites() {
            assertEquals(RespInteger.ONE, server.send(client, "WAIT", "1", "500"));
        }

        @Test
        @DisplayName("WAIT 在从节点确认后回复")
        void waitForAck() {
            server.send(client, "SET", "foo", "bar");
            assertNull(server.send(client, "WAIT", "1", "0"));
            // SET(31) + GETACK(37)
            assertEquals(68, server.coordinator.getMasterOffset());
            ServerFixture.drain(replica);

            assertNull(server.send(replica, "REPLCONF", "ACK", "31"));
            assertEquals(RespInteger.ONE, ServerFixture.lastReply(client));
        }

        @Test
        @DisplayName("确认偏移量不足时继续等待")
        void partialAckKeepsWaiting() {
            server.send(client, "SET", "foo", "bar");
            server.send(client, "WAIT", "1", "0");
            ServerFixture.drain(replica);
            assertNull(server.send(replica, "REPLCONF", "ACK", "10"));
            assertNull(ServerFixture.lastReply(client));
        }

        @Test
        @DisplayName("EXEC 中的 WAIT 立即回复")
        void waitInsideExec() {
            server.send(client, "SET", "foo", "bar");
            server.send(client, "MULTI");
            server.send(client, "WAIT", "1", "0");
            final RespArray reply = (RespArray) server.send(client, "EXEC");
            assertEquals(RespInteger.ZERO, reply.getContent()[0]);
        }

        @Test
        @DisplayName("负数超时回复错误")
        void negativeTimeout() {
            assertEquals("ERR timeout is negative", error(server.send(client, "WAIT", "1", "-1")));
        }
    }

    @Nested
    @DisplayName("流和阻塞读")
    class Streams {

        @Test
        @DisplayName("XADD 后 XRANGE 读取")
        void xaddThenXrange() {
            assertEquals("1-1", bulk(server.send(client, "XADD", "s", "1-1", "a", "1")));
            assertEquals("1-2", bulk(server.send(client, "XADD", "s", "1-*", "b", "2")));
            final RespArray range = (RespArray) server.send(client, "XRANGE", "s", "-", "+");
            assertEquals(2, range.getContent().length);
            final RespArray first = (RespArray) range.getContent()[0];
            assertEquals("1-1", bulk(first.getContent()[0]));
        }

        @Test
        @DisplayName("XADD 的ID不递增时回复错误")
        void xaddNotIncreasing() {
            server.send(client, "XADD", "s", "5-5", "a", "1");
            assertEquals("ERR The ID specified in XADD is equal or smaller than the target stream top item",
                    error(server.send(client, "XADD", "s", "5-5", "a", "1")));
            assertEquals("ERR The ID specified in XADD must be greater than 0-0",
                    error(server.send(client, "XADD", "t", "0-0", "a", "1")));
        }

        @Test
        @DisplayName("XRANGE COUNT 限制条数")
        void xrangeCount() {
            server.send(client, "XADD", "s", "1-1", "a", "1");
            server.send(client, "XADD", "s", "2-1", "a", "1");
            assertEquals(1, ((RespArray) server.send(client, "XRANGE", "s", "-", "+", "COUNT", "1")).getContent().length);
        }

        @Test
        @DisplayName("非阻塞 XREAD 没有数据时回复空")
        void xreadNoData() {
            assertSame(RespArray.NULL, server.send(client, "XREAD", "STREAMS", "s", "0-0"));
        }

        @Test
        @DisplayName("XREAD 参数校验")
        void xreadValidation() {
            assertEquals("ERR Unbalanced XREAD list of streams: for each stream key an ID or '$' must be specified.",
                    error(server.send(client, "XREAD", "STREAMS", "a", "b", "0-0")));
            assertEquals("ERR syntax error", error(server.send(client, "XREAD", "COUNT", "1", "a", "0-0")));
            assertEquals("ERR timeout is negative",
                    error(server.send(client, "XREAD", "BLOCK", "-1", "STREAMS", "s", "0-0")));
        }

        @Test
        @DisplayName("XREAD BLOCK $ 被之后的 XADD 唤醒")
        void blockUntilXadd() {
            assertNull(server.send(client, "XREAD", "BLOCK", "0", "STREAMS", "s", "$"));
            assertTrue(server.registry.isWaiting(client.getId()));

            final ClientConnection writer = server.connect();
            assertEquals("3-1", bulk(server.send(writer, "XADD", "s", "3-1", "f", "v")));

            final RespArray woken = (RespArray) ServerFixture.lastReply(client);
            final RespArray stream = (RespArray) woken.getContent()[0];
            assertEquals("s", bulk(stream.getContent()[0]));
            assertEquals(1, ((RespArray) stream.getContent()[1]).getContent().length);
            assertFalse(server.registry.isWaiting(client.getId()));
        }

        @Test
        @DisplayName("已有数据时 XREAD BLOCK 立即返回")
        void blockWithExistingData() {
            server.send(client, "XADD", "s", "1-1", "f", "v");
            assertInstanceOf(RespArray.class, server.send(client, "XREAD", "BLOCK", "1000", "STREAMS", "s", "0-0"));
            assertEquals(0, server.registry.size());
        }

        @Test
        @DisplayName("阻塞读超时回复空")
        void blockTimeout() {
            assertNull(server.send(client, "XREAD", "BLOCK", "100", "STREAMS", "s", "0-0"));
            server.clock.advance(99);
            assertEquals(0, server.registry.expireTimedOut(server.core.currentTimeMillis()));
            server.clock.advance(1);
            assertEquals(1, server.registry.expireTimedOut(server.core.currentTimeMillis()));
            assertSame(BulkString.NULL, ServerFixture.lastReply(client));
        }

        @Test
        @DisplayName("EXEC 中的 XREAD BLOCK 不阻塞")
        void blockInsideExec() {
            server.send(client, "MULTI");
            server.send(client, "XREAD", "BLOCK", "0", "STREAMS", "s", "$");
            final RespArray reply = (RespArray) server.send(client, "EXEC");
            assertSame(RespArray.NULL, reply.getContent()[0]);
            assertEquals(0, server.registry.size());
        }

        @Test
        @DisplayName("多个流时 COUNT 限制总条数")
        void xreadCountAcrossStreams() {
            server.send(client, "XADD", "a", "1-1", "f", "v");
            server.send(client, "XADD", "a", "1-2", "f", "v");
            server.send(client, "XADD", "b", "1-1", "f", "v");
            final RespArray reply = (RespArray) server.send(client,
                    "XREAD", "COUNT", "2", "STREAMS", "a", "b", "0-0", "0-0");
            int total = 0;
            for (final Resp stream : reply.getContent()) {
                total += ((RespArray) ((RespArray) stream).getContent()[1]).getContent().length;
            }
            assertEquals(2, total);
        }
    }
}
