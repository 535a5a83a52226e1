package site.rstream.datastructure;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.rstream.exception.StreamIdException;

/**
 * 流条目ID，(毫秒, 序号) 二元组，按字典序全序。
 *
 * <p>两个分量都非负，{@link #MAX} 作为 {@code +} 的上界。
 */
@Getter
@EqualsAndHashCode
public final class StreamEntryId implements Comparable<StreamEntryId> {

    public static final StreamEntryId MIN = new StreamEntryId(0, 0);

    public static final StreamEntryId MAX = new StreamEntryId(Long.MAX_VALUE, Long.MAX_VALUE);

    private final long ms;

    private final long seq;

    public StreamEntryId(final long ms, final long seq) {
        if (ms < 0 || seq < 0) {
            throw StreamIdException.invalid();
        }
        this.ms = ms;
        this.seq = seq;
    }

    /**
     * 解析完整的 {@code ms-seq} 或只有毫秒部分的ID。
     *
     * @param text ID文本
     * @param defaultSeq 缺少序号时使用的值
     * @return 解析结果
     * @throws StreamIdException 格式非法
     */
    public static StreamEntryId parse(final String text, final long defaultSeq) {
        final int dash = text.indexOf('-');
        if (dash < 0) {
            return new StreamEntryId(parsePart(text), defaultSeq);
        }
        return new StreamEntryId(parsePart(text.substring(0, dash)), parsePart(text.substring(dash + 1)));
    }

    public static StreamEntryId parse(final String text) {
        return parse(text, 0);
    }

    /** XRANGE 起始边界，{@code -} 表示最小ID */
    public static StreamEntryId parseRangeStart(final String text) {
        if ("-".equals(text)) {
            return MIN;
        }
        return parse(text, 0);
    }

    /** XRANGE 结束边界，{@code +} 表示最大ID */
    public static StreamEntryId parseRangeEnd(final String text) {
        if ("+".equals(text)) {
            return MAX;
        }
        return parse(text, Long.MAX_VALUE);
    }

    private static long parsePart(final String part) {
        if (part.isEmpty() || part.length() > 19) {
            throw StreamIdException.invalid();
        }
        for (int i = 0; i < part.length(); i++) {
            final char c = part.charAt(i);
            if (c < '0' || c > '9') {
                throw StreamIdException.invalid();
            }
        }
        try {
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            throw StreamIdException.invalid();
        }
    }

    public boolean isZero() {
        return ms == 0 && seq == 0;
    }

    @Override
    public int compareTo(final StreamEntryId other) {
        final int byMs = Long.compare(ms, other.ms);
        return byMs != 0 ? byMs : Long.compare(seq, other.seq);
    }

    @Override
    public String toString() {
        return ms + "-" + seq;
    }
}
