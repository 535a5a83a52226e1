package site.rstream.datastructure;

import lombok.Getter;

/**
 * 字符串值
 *
 * <p>INCR 在原值上解析十进制整数，结果以新实例返回，原实例不变。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RedisString implements RedisData {

    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";

    public static final String OVERFLOW = "ERR increment or decrement would overflow";

    private final RedisBytes value;

    public RedisString(final RedisBytes value) {
        this.value = value;
    }

    @Override
    public String getTypeName() {
        return "string";
    }

    /**
     * @return 加一后的数值
     * @throws IllegalStateException 值不是64位有符号整数或加一溢出
     */
    public long incr() {
        final long current = parseLong(value);
        if (current == Long.MAX_VALUE) {
            throw new IllegalStateException(OVERFLOW);
        }
        return current + 1;
    }

    static long parseLong(final RedisBytes bytes) {
        final byte[] raw = bytes.getBytesUnsafe();
        // 不接受前导空白、'+' 号和多余的前导零，与Redis的 string2ll 一致
        if (raw.length == 0 || raw.length > 20) {
            throw new IllegalStateException(NOT_AN_INTEGER);
        }
        if (raw.length > 1 && (raw[0] == '0' || (raw[0] == '-' && raw[1] == '0'))) {
            throw new IllegalStateException(NOT_AN_INTEGER);
        }
        try {
            return Long.parseLong(bytes.getString());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(NOT_AN_INTEGER, e);
        }
    }
}
