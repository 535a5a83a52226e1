package site.rstream.core;

import lombok.extern.slf4j.Slf4j;
import site.rstream.database.RedisDB;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisData;
import site.rstream.datastructure.RedisStream;
import site.rstream.datastructure.RedisString;
import site.rstream.datastructure.StreamEntry;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.exception.WrongTypeException;
import site.rstream.utils.GlobPattern;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据引擎的内存实现，单库。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RedisCoreImpl implements RedisCore {

    private final RedisDB database;

    private long dirty;

    public RedisCoreImpl() {
        this(Clock.systemUTC());
    }

    public RedisCoreImpl(final Clock clock) {
        this.database = new RedisDB(clock);
    }

    @Override
    public RedisData get(final RedisBytes key) {
        return database.get(key);
    }

    @Override
    public void set(final RedisBytes key, final RedisData value, final long ttlMillis) {
        final long deadline = ttlMillis < 0 ? -1 : currentTimeMillis() + ttlMillis;
        database.put(key, value, deadline);
        dirty++;
    }

    @Override
    public void setWithDeadline(final RedisBytes key, final RedisData value, final long expireAtMs) {
        database.put(key, value, expireAtMs);
    }

    @Override
    public boolean exists(final RedisBytes key) {
        return database.exist(key);
    }

    @Override
    public boolean delete(final RedisBytes key) {
        final boolean removed = database.delete(key);
        if (removed) {
            dirty++;
        }
        return removed;
    }

    @Override
    public List<RedisBytes> keys(final GlobPattern pattern) {
        final List<RedisBytes> result = new ArrayList<>();
        for (final RedisBytes key : database.keys()) {
            if (pattern.matchesAll() || pattern.matches(key.getBytesUnsafe())) {
                result.add(key);
            }
        }
        Collections.sort(result);
        return result;
    }

    @Override
    public String typeOf(final RedisBytes key) {
        final RedisData data = database.get(key);
        return data == null ? "none" : data.getTypeName();
    }

    @Override
    public long incr(final RedisBytes key) {
        final RedisData data = database.get(key);
        final long value;
        if (data == null) {
            value = 1;
            database.put(key, new RedisString(RedisBytes.fromString("1")), -1);
        } else if (data instanceof RedisString) {
            value = ((RedisString) data).incr();
            database.replaceKeepTtl(key, new RedisString(RedisBytes.fromString(Long.toString(value))));
        } else {
            throw new WrongTypeException();
        }
        dirty++;
        return value;
    }

    @Override
    public StreamEntryId xadd(final RedisBytes key, final String idSpec, final List<RedisBytes> fieldsAndValues) {
        final RedisData data = database.get(key);
        final RedisStream stream;
        if (data == null) {
            stream = new RedisStream();
        } else if (data instanceof RedisStream) {
            stream = (RedisStream) data;
        } else {
            throw new WrongTypeException();
        }
        // ID校验失败时不能留下空流
        final StreamEntryId id = stream.add(idSpec, fieldsAndValues, currentTimeMillis());
        if (data == null) {
            database.put(key, stream, -1);
        }
        dirty++;
        return id;
    }

    @Override
    public List<StreamEntry> xrange(final RedisBytes key, final StreamEntryId start, final StreamEntryId end,
                                    final int count) {
        final RedisStream stream = getStream(key);
        if (stream == null) {
            return Collections.emptyList();
        }
        return stream.range(start, end, count);
    }

    @Override
    public Map<RedisBytes, List<StreamEntry>> xread(final List<RedisBytes> keys, final List<StreamEntryId> afterIds,
                                                     final int count) {
        if (keys.size() != afterIds.size()) {
            throw new IllegalArgumentException("keys and ids must have the same size");
        }
        final Map<RedisBytes, List<StreamEntry>> perKey = new LinkedHashMap<>();
        if (count == 0) {
            return perKey;
        }
        for (int i = 0; i < keys.size(); i++) {
            final RedisStream stream = getStream(keys.get(i));
            if (stream == null) {
                continue;
            }
            final List<StreamEntry> entries = stream.readAfter(afterIds.get(i), count);
            if (!entries.isEmpty()) {
                perKey.merge(keys.get(i), entries, (a, b) -> {
                    final List<StreamEntry> merged = new ArrayList<>(a);
                    merged.addAll(b);
                    return merged;
                });
            }
        }
        if (count < 0 || perKey.size() <= 1) {
            return perKey;
        }
        return truncateGlobally(perKey, count);
    }

    /** 多个流的结果按ID全局排序后截断到count，再按键分组 */
    private Map<RedisBytes, List<StreamEntry>> truncateGlobally(final Map<RedisBytes, List<StreamEntry>> perKey,
                                                                final int count) {
        final List<Map.Entry<RedisBytes, StreamEntry>> pooled = new ArrayList<>();
        for (final Map.Entry<RedisBytes, List<StreamEntry>> e : perKey.entrySet()) {
            for (final StreamEntry entry : e.getValue()) {
                pooled.add(Map.entry(e.getKey(), entry));
            }
        }
        pooled.sort(Comparator.comparing(e -> e.getValue().getId()));
        final List<Map.Entry<RedisBytes, StreamEntry>> kept = pooled.subList(0, Math.min(count, pooled.size()));

        final Map<RedisBytes, List<StreamEntry>> result = new LinkedHashMap<>();
        for (final RedisBytes key : perKey.keySet()) {
            final List<StreamEntry> entries = new ArrayList<>();
            for (final Map.Entry<RedisBytes, StreamEntry> e : kept) {
                if (e.getKey().equals(key)) {
                    entries.add(e.getValue());
                }
            }
            if (!entries.isEmpty()) {
                result.put(key, entries);
            }
        }
        return result;
    }

    @Override
    public StreamEntryId lastStreamId(final RedisBytes key) {
        final RedisStream stream = getStream(key);
        return stream == null ? StreamEntryId.MIN : stream.getLastId();
    }

    private RedisStream getStream(final RedisBytes key) {
        final RedisData data = database.get(key);
        if (data == null) {
            return null;
        }
        if (!(data instanceof RedisStream)) {
            throw new WrongTypeException();
        }
        return (RedisStream) data;
    }

    @Override
    public long getDirty() {
        return dirty;
    }

    @Override
    public long currentTimeMillis() {
        return database.getClock().millis();
    }

    @Override
    public RedisDB getDatabase() {
        return database;
    }

    @Override
    public void flushAll() {
        database.clear();
        dirty++;
        log.info("数据库已清空");
    }
}
