package site.rstream.rdb;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import site.rstream.core.RedisCore;
import site.rstream.core.RedisCoreImpl;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisString;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RdbManager测试")
class RdbManagerTest {

    @TempDir
    Path tempDir;

    private SteppingClock clock;

    private RedisCore redisCore;

    private RdbManager manager;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(1_700_000_000_000L);
        redisCore = new RedisCoreImpl(clock);
        manager = new RdbManager(redisCore, tempDir.toString(), "dump.rdb", 60, 3);
    }

    private void setKey(String key, String value) {
        redisCore.set(RedisBytes.fromString(key), new RedisString(RedisBytes.fromString(value)), -1);
    }

    @Test
    @DisplayName("文件不存在时以空库启动")
    void testLoadMissingFile() {
        assertFalse(manager.loadOnStartup());
        assertEquals(0, redisCore.getDatabase().size());
    }

    @Test
    @DisplayName("损坏的文件不阻止启动")
    void testLoadCorruptFile() throws IOException {
        Files.write(tempDir.resolve("dump.rdb"), new byte[]{1, 2, 3});
        assertFalse(manager.loadOnStartup());
        assertEquals(0, redisCore.getDatabase().size());
    }

    @Test
    @DisplayName("变更数达到阈值时保存")
    void testSaveOnChangeThreshold() {
        setKey("a", "1");
        setKey("b", "2");
        assertFalse(manager.saveIfNeeded());
        setKey("c", "3");
        assertTrue(manager.saveIfNeeded());
        assertTrue(Files.exists(tempDir.resolve("dump.rdb")));
        assertFalse(Files.exists(tempDir.resolve("dump.rdb.tmp")));
        assertEquals(0, manager.pendingChanges());
    }

    @Test
    @DisplayName("超过时间间隔且有变更时保存")
    void testSaveOnElapsedTime() {
        assertFalse(manager.saveIfNeeded());
        clock.advance(61_000);
        assertFalse(manager.saveIfNeeded(), "没有变更时不保存");
        setKey("a", "1");
        assertTrue(manager.saveIfNeeded());
    }

    @Test
    @DisplayName("保存后重新启动可以恢复数据")
    void testSaveAndReload() {
        setKey("greeting", "hello");
        assertTrue(manager.save());

        RedisCore restarted = new RedisCoreImpl(clock);
        RdbManager reloaded = new RdbManager(restarted, tempDir.toString(), "dump.rdb");
        assertTrue(reloaded.loadOnStartup());
        RedisString value = (RedisString) restarted.get(RedisBytes.fromString("greeting"));
        assertEquals("hello", value.getValue().getString());
        assertEquals(0, reloaded.pendingChanges());
    }

    @Test
    @DisplayName("关闭时保存未持久化的变更")
    void testSaveOnShutdown() {
        manager.saveOnShutdown();
        assertFalse(Files.exists(tempDir.resolve("dump.rdb")));
        setKey("a", "1");
        manager.saveOnShutdown();
        assertTrue(Files.exists(tempDir.resolve("dump.rdb")));
    }

    @Test
    @DisplayName("加载快照会替换现有数据")
    void testLoadSnapshotReplacesData() throws IOException {
        setKey("old", "x");
        RedisCore master = new RedisCoreImpl(clock);
        master.set(RedisBytes.fromString("new"), new RedisString(RedisBytes.fromString("y")), -1);
        byte[] snapshot = new RdbManager(master, tempDir.toString(), "m.rdb").generateSnapshot();

        assertEquals(1, manager.loadSnapshot(snapshot));
        assertNull(redisCore.get(RedisBytes.fromString("old")));
        assertNotNull(redisCore.get(RedisBytes.fromString("new")));
    }

    @Test
    @DisplayName("全量同步快照只携带字符串，不携带流")
    void testSnapshotSkipsStreams() throws IOException {
        setKey("name", "v");
        redisCore.xadd(RedisBytes.fromString("events"), "1-1",
                List.of(RedisBytes.fromString("f"), RedisBytes.fromString("x")));
        byte[] snapshot = manager.generateSnapshot();

        RedisCore replica = new RedisCoreImpl(clock);
        assertEquals(1, new RdbManager(replica, tempDir.toString(), "r.rdb").loadSnapshot(snapshot));
        assertNotNull(replica.get(RedisBytes.fromString("name")));
        assertNull(replica.get(RedisBytes.fromString("events")));
    }

    private static final class SteppingClock extends Clock {

        private long millis;

        SteppingClock(long millis) {
            this.millis = millis;
        }

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
