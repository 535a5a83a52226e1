package site.rstream.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 二进制安全的不可变字节序列，作为键、字符串值和命令名的统一载体。
 *
 * <p>普通构造会拷贝入参；{@link #wrapTrusted(byte[])} 直接持有数组，
 * 只用于解码器等能保证数组不再被修改的内部路径。
 *
 * <p>排序按无符号字节的字典序，KEYS 的结果排序依赖这一点。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    public static final Charset CHARSET = StandardCharsets.UTF_8;

    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /** 命令名缓存，命令解析时可以复用实例 */
    private static final Map<String, RedisBytes> COMMAND_CACHE = new ConcurrentHashMap<>(32);

    static {
        final String[] commands = {
                "PING", "ECHO", "GET", "SET", "DEL", "EXISTS", "INCR", "TYPE", "KEYS",
                "MULTI", "EXEC", "DISCARD", "XADD", "XRANGE", "XREAD",
                "REPLCONF", "PSYNC", "WAIT", "INFO", "CONFIG"
        };
        for (final String cmd : commands) {
            final RedisBytes bytes = new RedisBytes(cmd.getBytes(CHARSET), true);
            bytes.stringValue = cmd;
            COMMAND_CACHE.put(cmd, bytes);
        }
    }

    private final byte[] bytes;

    private final int hashCode;

    private volatile String stringValue;

    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝包装，调用方保证数组之后不会被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return 包装后的实例，入参为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes cached = COMMAND_CACHE.get(str);
        if (cached != null) {
            return cached;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /** 返回内容副本 */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /** 直接返回内部数组，调用方不得修改 */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.bytes.length != bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            byte a = bytes[i];
            byte b = other.bytes[i];
            if (a == b) {
                continue;
            }
            if (a >= 'A' && a <= 'Z') {
                a += 32;
            }
            if (b >= 'A' && b <= 'Z') {
                b += 32;
            }
            if (a != b) {
                return false;
            }
        }
        return true;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((RedisBytes) obj).bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public int compareTo(final RedisBytes other) {
        if (other == null) {
            return 1;
        }
        if (this == other) {
            return 0;
        }
        final int minLength = Math.min(bytes.length, other.bytes.length);
        for (int i = 0; i < minLength; i++) {
            final int a = bytes[i] & 0xFF;
            final int b = other.bytes[i] & 0xFF;
            if (a != b) {
                return a - b;
            }
        }
        return Integer.compare(bytes.length, other.bytes.length);
    }

    @Override
    public String toString() {
        return getString();
    }
}
