package site.rstream.datastructure;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 流中的一条记录：ID加上按写入顺序排列的字段/值对。
 */
@Getter
public final class StreamEntry {

    private final StreamEntryId id;

    /** 字段和值交替排列 */
    private final List<RedisBytes> fieldsAndValues;

    public StreamEntry(final StreamEntryId id, final List<RedisBytes> fieldsAndValues) {
        this.id = id;
        this.fieldsAndValues = Collections.unmodifiableList(fieldsAndValues);
    }
}
