package site.rstream.server.blocking;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.impl.stream.StreamReplies;
import site.rstream.core.RedisCore;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntry;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 阻塞读登记表
 *
 * <p>XADD 成功后把键标记为就绪，当前命令的回复写出后再统一尝试唤醒登记在这些键上的连接。
 * 超时由事件循环定期调用 {@link #expireTimedOut(long)} 处理。只在事件循环线程上访问。
 *
 * @author rstream
 * @since 1.0.0
 */
@Slf4j
public class WaitingReaderRegistry {

    private final RedisCore redisCore;

    /** 流键到按登记顺序排列的等待者 */
    private final Map<RedisBytes, LinkedHashSet<WaitingReader>> byKey = new HashMap<>();

    /** 连接句柄到等待者，一个连接同时最多阻塞一次 */
    private final Map<Integer, WaitingReader> byConnection = new LinkedHashMap<>();

    private final Set<RedisBytes> readyKeys = new LinkedHashSet<>();

    public WaitingReaderRegistry(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    public void register(final WaitingReader reader) {
        remove(reader.getConnectionId());
        byConnection.put(reader.getConnectionId(), reader);
        for (final RedisBytes key : reader.getKeys()) {
            byKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(reader);
        }
        log.debug("{} 阻塞在 {} 上，超时 {}ms", reader.getConnection(), reader.getKeys(), reader.getTimeoutMillis());
    }

    /**
     * 标记键有新数据，由 XADD 调用
     */
    public void signalKeyAsReady(final RedisBytes key) {
        if (byKey.containsKey(key)) {
            readyKeys.add(key);
        }
    }

    /**
     * 对就绪键上的等待者重新读取，有数据的立即回复并移除
     *
     * @return 被唤醒的等待者数量
     */
    public int serveReadyKeys() {
        if (readyKeys.isEmpty()) {
            return 0;
        }
        int served = 0;
        final List<RedisBytes> keys = new ArrayList<>(readyKeys);
        readyKeys.clear();
        for (final RedisBytes key : keys) {
            final LinkedHashSet<WaitingReader> readers = byKey.get(key);
            if (readers == null) {
                continue;
            }
            for (final WaitingReader reader : new ArrayList<>(readers)) {
                final Map<RedisBytes, List<StreamEntry>> result;
                try {
                    result = redisCore.xread(reader.getKeys(), reader.getAfterIds(), reader.getCount());
                } catch (RuntimeException e) {
                    log.warn("{} 的阻塞读失败: {}", reader.getConnection(), e.getMessage());
                    remove(reader.getConnectionId());
                    reader.getConnection().reply(new Errors(e.getMessage()));
                    continue;
                }
                if (!result.isEmpty()) {
                    remove(reader.getConnectionId());
                    reader.getConnection().reply(StreamReplies.xread(result));
                    served++;
                }
            }
        }
        return served;
    }

    /**
     * 超时的等待者收到空回复并被移除
     *
     * @return 超时的数量
     */
    public int expireTimedOut(final long nowMillis) {
        int expired = 0;
        final Iterator<WaitingReader> it = byConnection.values().iterator();
        while (it.hasNext()) {
            final WaitingReader reader = it.next();
            if (reader.isExpired(nowMillis)) {
                it.remove();
                unlinkKeys(reader);
                reader.getConnection().reply(BulkString.NULL);
                expired++;
            }
        }
        if (expired > 0) {
            log.debug("{} 个阻塞读超时", expired);
        }
        return expired;
    }

    /**
     * 连接断开时移除，不回复
     */
    public void remove(final int connectionId) {
        final WaitingReader reader = byConnection.remove(connectionId);
        if (reader != null) {
            unlinkKeys(reader);
        }
    }

    private void unlinkKeys(final WaitingReader reader) {
        for (final RedisBytes key : reader.getKeys()) {
            final LinkedHashSet<WaitingReader> readers = byKey.get(key);
            if (readers != null) {
                readers.remove(reader);
                if (readers.isEmpty()) {
                    byKey.remove(key);
                }
            }
        }
    }

    public boolean isWaiting(final int connectionId) {
        return byConnection.containsKey(connectionId);
    }

    public int size() {
        return byConnection.size();
    }
}
