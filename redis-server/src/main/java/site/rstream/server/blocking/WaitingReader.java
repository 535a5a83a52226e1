package site.rstream.server.blocking;

import lombok.Getter;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.server.connection.ClientConnection;

import java.util.List;

/**
 * 一个阻塞在 XREAD BLOCK 上的连接
 */
@Getter
public class WaitingReader {

    private final ClientConnection connection;

    private final List<RedisBytes> keys;

    /** 与 keys 一一对应，已把 $ 解析为具体ID */
    private final List<StreamEntryId> afterIds;

    /** 负数表示不限制 */
    private final int count;

    /** 0 表示一直等待 */
    private final long timeoutMillis;

    private final long registeredAt;

    public WaitingReader(final ClientConnection connection, final List<RedisBytes> keys,
                         final List<StreamEntryId> afterIds, final int count,
                         final long timeoutMillis, final long registeredAt) {
        if (keys.size() != afterIds.size()) {
            throw new IllegalArgumentException("keys and ids must have the same size");
        }
        this.connection = connection;
        this.keys = List.copyOf(keys);
        this.afterIds = List.copyOf(afterIds);
        this.count = count;
        this.timeoutMillis = timeoutMillis;
        this.registeredAt = registeredAt;
    }

    public int getConnectionId() {
        return connection.getId();
    }

    public boolean isExpired(final long nowMillis) {
        return timeoutMillis > 0 && nowMillis - registeredAt >= timeoutMillis;
    }
}
