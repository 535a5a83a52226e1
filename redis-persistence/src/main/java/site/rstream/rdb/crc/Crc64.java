package site.rstream.rdb.crc;

/**
 * Redis使用的CRC-64（Jones多项式，反射输入输出）。
 *
 * <p>对 "123456789" 的校验值为 0xe9c6d914c4b8d9ca。
 */
public final class Crc64 {

    /** Jones多项式的反射形式 */
    private static final long POLY = 0x95ac9329ac4bc9b5L;

    private static final long[] TABLE = new long[256];

    static {
        for (int i = 0; i < 256; i++) {
            long crc = i;
            for (int j = 0; j < 8; j++) {
                if ((crc & 1) != 0) {
                    crc = (crc >>> 1) ^ POLY;
                } else {
                    crc >>>= 1;
                }
            }
            TABLE[i] = crc;
        }
    }

    private Crc64() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * 在已有校验值上继续计算
     *
     * @param crc 之前的校验值，初始为0
     */
    public static long crc64(long crc, final byte[] data, final int offset, final int length) {
        if (data == null) {
            throw new IllegalArgumentException("数据不能为null");
        }
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("无效的偏移量或长度参数");
        }
        for (int i = offset; i < offset + length; i++) {
            crc = TABLE[(int) ((crc ^ data[i]) & 0xFF)] ^ (crc >>> 8);
        }
        return crc;
    }

    public static long crc64(final byte[] data) {
        return crc64(0L, data, 0, data.length);
    }
}
