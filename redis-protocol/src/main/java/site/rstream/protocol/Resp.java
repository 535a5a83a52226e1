package site.rstream.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

/**
 * RESP协议基础类
 *
 * <p>所有RESP数据类型的基类，负责解码入口和共享的编码工具方法。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * <p>解码只消费一个完整值的字节，调用方通过读索引前后的差值得到消费的字节数。
 * 数据不完整时不区分是否格式错误，统一返回null并回滚读索引。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = {'\r', '\n'};

    /** 0-255 的十进制字节缓存 */
    private static final byte[][] NUMBERS = new byte[256][];

    private static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;
    private static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    static {
        for (int i = 0; i < NUMBERS.length; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes();
        }
    }

    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value < NUMBERS.length) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes());
        }
    }

    /**
     * RESP 解码
     *
     * @param buffer 输入缓冲区
     * @return 解码后的对象，数据不完整时返回null且读索引不变
     * @throws IllegalArgumentException 数据格式不符合RESP规范
     */
    public static Resp decode(final ByteBuf buffer) {
        if (buffer.readableBytes() <= 0) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeValue(buffer);
        } catch (IllegalStateException e) {
            // 数据不完整，回滚等待更多数据
            buffer.readerIndex(initialIndex);
            return null;
        } catch (RuntimeException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeValue(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            throw new IllegalStateException("数据不完整：缺少类型标识");
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return SimpleString.valueOf(getString(buffer));
            case '-':
                return new Errors(getString(buffer));
            case ':':
                return RespInteger.valueOf(getNumber(buffer));
            case '$':
                return decodeBulkString(buffer);
            case '*':
                return decodeArray(buffer);
            default:
                log.debug("无法识别的RESP类型标识, 字节值: {}", typeIndicator & 0xFF);
                throw new IllegalArgumentException("invalid type byte '" + (char) typeIndicator + "'");
        }
    }

    private static Resp decodeBulkString(final ByteBuf buffer) {
        final long length = getNumber(buffer);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > PROTO_MAX_BULK_LEN) {
            throw new IllegalArgumentException("invalid bulk length");
        }
        final int len = (int) length;
        if (buffer.readableBytes() < len + 2) {
            throw new IllegalStateException("数据不完整：BulkString内容长度不足");
        }
        final byte[] content = new byte[len];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new IllegalArgumentException("expected CRLF after bulk string");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Resp decodeArray(final ByteBuf buffer) {
        final long number = getNumber(buffer);
        if (number > PROTO_MAX_ARRAY_LEN) {
            throw new IllegalArgumentException("invalid multibulk length");
        }
        if (number < 0) {
            return RespArray.NULL;
        }
        if (number == 0) {
            return RespArray.EMPTY;
        }
        final Resp[] array = new Resp[(int) number];
        for (int i = 0; i < array.length; i++) {
            array[i] = decodeValue(buffer);
        }
        return new RespArray(array);
    }

    /**
     * 编码到缓冲区，由子类实现
     *
     * @param resp 响应对象
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(Resp resp, ByteBuf byteBuf);

    /** 读取到 \r\n 为止的文本行 */
    static String getString(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        final byte[] bytes = new byte[endIndex - startIndex];
        buffer.readBytes(bytes);
        buffer.skipBytes(2);
        return new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
    }

    /** 读取到 \r\n 为止的十进制整数 */
    static long getNumber(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findLineEnd(buffer);
        if (endIndex == startIndex) {
            throw new IllegalArgumentException("empty number");
        }
        boolean negative = false;
        int i = startIndex;
        if (buffer.getByte(i) == '-') {
            negative = true;
            i++;
            if (i == endIndex) {
                throw new IllegalArgumentException("invalid number");
            }
        }
        long value = 0;
        for (; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new IllegalArgumentException("invalid number");
            }
            try {
                value = Math.addExact(Math.multiplyExact(value, 10), b - '0');
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("number out of range", e);
            }
        }
        buffer.readerIndex(endIndex + 2);
        return negative ? -value : value;
    }

    private static int findLineEnd(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw new IllegalStateException("数据不完整：没有找到换行符");
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new IllegalArgumentException("expected LF after CR");
        }
        return endIndex;
    }
}
