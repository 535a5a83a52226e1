package site.rstream.datastructure;

import lombok.Getter;
import site.rstream.exception.StreamIdException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 流类型
 *
 * <p>条目保存在只追加的数组中，追加时保证ID严格大于当前最大ID，因此数组始终按ID有序，
 * 范围查询和增量读取都用二分查找定位。
 *
 * <p>ID规格的解析规则：
 * <ul>
 *     <li>{@code *} - 毫秒取当前时间（不早于最后一条的毫秒），同毫秒时序号为上一条加一，否则为0</li>
 *     <li>{@code ms-*} - 序号自动生成；空流且毫秒为0时序号从1开始</li>
 *     <li>{@code ms-seq} - 必须严格大于最后一条ID，{@code 0-0} 总是被拒绝</li>
 * </ul>
 */
public class RedisStream implements RedisData {

    private final List<StreamEntry> entries = new ArrayList<>();

    /** 最后一条ID，空流时为 0-0 */
    @Getter
    private StreamEntryId lastId = StreamEntryId.MIN;

    @Override
    public String getTypeName() {
        return "stream";
    }

    public int size() {
        return entries.size();
    }

    /**
     * 追加一条记录
     *
     * @param idSpec ID规格
     * @param fieldsAndValues 字段/值对
     * @param nowMs 当前时间毫秒
     * @return 实际分配的ID
     * @throws StreamIdException ID非法或不递增
     */
    public StreamEntryId add(final String idSpec, final List<RedisBytes> fieldsAndValues, final long nowMs) {
        final StreamEntryId id = resolveId(idSpec, nowMs);
        entries.add(new StreamEntry(id, new ArrayList<>(fieldsAndValues)));
        lastId = id;
        return id;
    }

    StreamEntryId resolveId(final String idSpec, final long nowMs) {
        if ("*".equals(idSpec)) {
            final long ms = Math.max(nowMs, lastId.getMs());
            if (!entries.isEmpty() && ms == lastId.getMs()) {
                return nextSequence(ms);
            }
            // 时钟为0时不能分配 0-0
            return new StreamEntryId(ms, ms == 0 ? 1 : 0);
        }

        final int dash = idSpec.indexOf('-');
        if (dash > 0 && idSpec.endsWith("-*") && dash == idSpec.length() - 2) {
            final long ms = StreamEntryId.parse(idSpec.substring(0, dash)).getMs();
            if (entries.isEmpty()) {
                return new StreamEntryId(ms, ms == 0 ? 1 : 0);
            }
            if (ms < lastId.getMs()) {
                throw new StreamIdException(StreamIdException.NOT_INCREASING);
            }
            if (ms > lastId.getMs()) {
                return new StreamEntryId(ms, 0);
            }
            return nextSequence(ms);
        }

        final StreamEntryId explicit = StreamEntryId.parse(idSpec);
        if (explicit.isZero()) {
            throw new StreamIdException(StreamIdException.ZERO_ID);
        }
        if (explicit.compareTo(lastId) <= 0) {
            throw new StreamIdException(StreamIdException.NOT_INCREASING);
        }
        return explicit;
    }

    private StreamEntryId nextSequence(final long ms) {
        if (lastId.getSeq() == Long.MAX_VALUE) {
            throw new StreamIdException(StreamIdException.NOT_INCREASING);
        }
        return new StreamEntryId(ms, lastId.getSeq() + 1);
    }

    /**
     * 闭区间 [start, end] 范围查询
     *
     * @param count 最多返回条数，负数表示不限制
     */
    public List<StreamEntry> range(final StreamEntryId start, final StreamEntryId end, final int count) {
        if (start.compareTo(end) > 0 || count == 0) {
            return Collections.emptyList();
        }
        final int from = firstIndexAtLeast(start);
        final int to = firstIndexGreaterThan(end);
        return slice(from, to, count);
    }

    /**
     * 返回ID严格大于 afterId 的条目
     *
     * @param count 最多返回条数，负数表示不限制
     */
    public List<StreamEntry> readAfter(final StreamEntryId afterId, final int count) {
        if (count == 0) {
            return Collections.emptyList();
        }
        return slice(firstIndexGreaterThan(afterId), entries.size(), count);
    }

    private List<StreamEntry> slice(final int from, final int to, final int count) {
        if (from >= to) {
            return Collections.emptyList();
        }
        final int end = count < 0 ? to : (int) Math.min(to, (long) from + count);
        return new ArrayList<>(entries.subList(from, end));
    }

    private int firstIndexAtLeast(final StreamEntryId id) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (entries.get(mid).getId().compareTo(id) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private int firstIndexGreaterThan(final StreamEntryId id) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (entries.get(mid).getId().compareTo(id) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
