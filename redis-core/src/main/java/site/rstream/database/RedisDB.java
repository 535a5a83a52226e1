package site.rstream.database;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisData;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 键空间：值表加过期表。
 *
 * <p>过期采用惰性删除，任何读取、存在性检查和遍历在访问前先检查截止时间，
 * 没有后台清理线程。过期表中存在记录表示该键有TTL。
 *
 * <p>只在事件循环线程上访问，不做同步。
 */
@Slf4j
public class RedisDB {

    private final Map<RedisBytes, RedisData> data = new HashMap<>();

    /** 键 -> 绝对过期时间（毫秒时间戳） */
    private final Map<RedisBytes, Long> expires = new HashMap<>();

    @Getter
    private final Clock clock;

    public RedisDB(final Clock clock) {
        this.clock = clock;
    }

    public RedisData get(final RedisBytes key) {
        if (expireIfNeeded(key)) {
            return null;
        }
        return data.get(key);
    }

    /**
     * 写入值，覆盖旧值并清除或设置过期时间
     *
     * @param expireAtMs 绝对过期时间，小于0表示不过期
     */
    public void put(final RedisBytes key, final RedisData value, final long expireAtMs) {
        data.put(key, value);
        if (expireAtMs >= 0) {
            expires.put(key, expireAtMs);
        } else {
            expires.remove(key);
        }
    }

    /** 替换值但保留已有的过期时间，用于INCR、XADD */
    public void replaceKeepTtl(final RedisBytes key, final RedisData value) {
        data.put(key, value);
    }

    public boolean exist(final RedisBytes key) {
        return !expireIfNeeded(key) && data.containsKey(key);
    }

    public boolean delete(final RedisBytes key) {
        expires.remove(key);
        return data.remove(key) != null;
    }

    /**
     * @return 未过期的键，顺序不定
     */
    public List<RedisBytes> keys() {
        final List<RedisBytes> result = new ArrayList<>(data.size());
        for (final RedisBytes key : new ArrayList<>(data.keySet())) {
            if (!expireIfNeeded(key)) {
                result.add(key);
            }
        }
        return result;
    }

    /**
     * @return 键的过期时间，没有TTL返回-1
     */
    public long getExpireAt(final RedisBytes key) {
        final Long deadline = expires.get(key);
        return deadline == null ? -1 : deadline;
    }

    public Map<RedisBytes, RedisData> getData() {
        return Collections.unmodifiableMap(data);
    }

    public int size() {
        return data.size();
    }

    public void clear() {
        data.clear();
        expires.clear();
    }

    /**
     * 如果键已过期则删除
     *
     * @return 键是否因过期被删除
     */
    private boolean expireIfNeeded(final RedisBytes key) {
        final Long deadline = expires.get(key);
        if (deadline == null || clock.millis() < deadline) {
            return false;
        }
        data.remove(key);
        expires.remove(key);
        log.debug("键已过期并被删除: {}", key);
        return true;
    }
}
