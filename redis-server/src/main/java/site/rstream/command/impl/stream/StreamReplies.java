package site.rstream.command.impl.stream;

import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntry;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;

import java.util.List;
import java.util.Map;

/**
 * 流条目的回复格式
 */
public final class StreamReplies {

    private StreamReplies() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * 单个条目：{@code [id, [field, value, ...]]}
     */
    public static RespArray entry(final StreamEntry entry) {
        final List<RedisBytes> fields = entry.getFieldsAndValues();
        final Resp[] pairs = new Resp[fields.size()];
        for (int i = 0; i < pairs.length; i++) {
            pairs[i] = BulkString.create(fields.get(i));
        }
        return new RespArray(new Resp[]{
                BulkString.fromString(entry.getId().toString()),
                RespArray.valueOf(pairs)
        });
    }

    public static RespArray entries(final List<StreamEntry> entries) {
        final Resp[] result = new Resp[entries.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = entry(entries.get(i));
        }
        return RespArray.valueOf(result);
    }

    /**
     * XREAD 结果：{@code [[key, entries], ...]}
     */
    public static RespArray xread(final Map<RedisBytes, List<StreamEntry>> result) {
        final Resp[] streams = new Resp[result.size()];
        int i = 0;
        for (final Map.Entry<RedisBytes, List<StreamEntry>> stream : result.entrySet()) {
            streams[i++] = new RespArray(new Resp[]{BulkString.create(stream.getKey()), entries(stream.getValue())});
        }
        return RespArray.valueOf(streams);
    }
}
