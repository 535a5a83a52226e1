package site.rstream.rdb;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * RDB长度编码与字符串编码的读写工具
 *
 * <p>长度编码：
 * <ul>
 *     <li>00xxxxxx - 6位长度</li>
 *     <li>01xxxxxx xxxxxxxx - 14位长度</li>
 *     <li>10000000 + 4字节大端 - 32位长度</li>
 *     <li>10000001 + 8字节大端 - 64位长度</li>
 *     <li>11xxxxxx - 特殊编码，低6位为整数编码类型</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RdbUtils {

    private RdbUtils() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    public static void writeLength(final DataOutputStream dos, final long length) throws IOException {
        if (length < 0x40) {
            dos.writeByte((int) length);
        } else if (length < 0x4000) {
            dos.writeByte((int) (0x40 | (length >> 8)));
            dos.writeByte((int) (length & 0xFF));
        } else if (length <= 0xFFFFFFFFL) {
            dos.writeByte(RdbConstants.RDB_32BITLEN);
            dos.writeInt((int) length);
        } else {
            dos.writeByte(RdbConstants.RDB_64BITLEN);
            dos.writeLong(length);
        }
    }

    public static void writeString(final DataOutputStream dos, final byte[] bytes) throws IOException {
        writeLength(dos, bytes.length);
        dos.write(bytes);
    }

    public static void writeString(final DataOutputStream dos, final String value) throws IOException {
        writeString(dos, value.getBytes(StandardCharsets.UTF_8));
    }

    /** 写入 0xC0 编码的8位整数，辅助字段 redis-bits 使用 */
    public static void writeInt8(final DataOutputStream dos, final int value) throws IOException {
        dos.writeByte(0xC0 | RdbConstants.RDB_ENC_INT8);
        dos.writeByte(value);
    }

    /** 小端序写入8字节 */
    public static void writeLongLE(final DataOutputStream dos, final long value) throws IOException {
        for (int i = 0; i < 8; i++) {
            dos.writeByte((int) (value >>> (i * 8)) & 0xFF);
        }
    }

    public static long readLongLE(final DataInputStream dis) throws IOException {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value |= ((long) dis.readUnsignedByte()) << (i * 8);
        }
        return value;
    }

    public static long readIntLE(final DataInputStream dis) throws IOException {
        long value = 0;
        for (int i = 0; i < 4; i++) {
            value |= ((long) dis.readUnsignedByte()) << (i * 8);
        }
        return value;
    }

    /**
     * 读取长度编码
     *
     * @throws IOException 遇到特殊编码（调用方应使用 {@link #readString(DataInputStream)}）
     */
    public static long readLength(final DataInputStream dis) throws IOException {
        final int first = dis.readUnsignedByte();
        if ((first >> 6) == RdbConstants.RDB_ENCVAL) {
            throw new IOException("期望长度编码，实际为特殊编码: 0x" + Integer.toHexString(first));
        }
        return readLength(dis, first);
    }

    private static long readLength(final DataInputStream dis, final int first) throws IOException {
        final int type = (first & 0xC0) >> 6;
        if (type == RdbConstants.RDB_6BITLEN) {
            return first & 0x3F;
        }
        if (type == RdbConstants.RDB_14BITLEN) {
            return ((first & 0x3F) << 8) | dis.readUnsignedByte();
        }
        if (first == RdbConstants.RDB_32BITLEN) {
            return dis.readInt() & 0xFFFFFFFFL;
        }
        if (first == RdbConstants.RDB_64BITLEN) {
            return dis.readLong();
        }
        throw new IOException("未知的长度编码: 0x" + Integer.toHexString(first));
    }

    /**
     * 读取字符串，支持整数编码，不支持LZF压缩
     */
    public static byte[] readString(final DataInputStream dis) throws IOException {
        final int first = dis.readUnsignedByte();
        if ((first >> 6) == RdbConstants.RDB_ENCVAL) {
            final int encoding = first & 0x3F;
            final long value;
            switch (encoding) {
                case RdbConstants.RDB_ENC_INT8:
                    value = dis.readByte();
                    break;
                case RdbConstants.RDB_ENC_INT16:
                    value = (short) (dis.readUnsignedByte() | (dis.readUnsignedByte() << 8));
                    break;
                case RdbConstants.RDB_ENC_INT32:
                    value = (int) readIntLE(dis);
                    break;
                default:
                    throw new IOException("不支持的字符串编码: " + encoding);
            }
            return Long.toString(value).getBytes(StandardCharsets.UTF_8);
        }
        final long length = readLength(dis, first);
        if (length > Integer.MAX_VALUE - 8) {
            throw new IOException("字符串过长: " + length);
        }
        final byte[] bytes = new byte[(int) length];
        dis.readFully(bytes);
        return bytes;
    }
}
