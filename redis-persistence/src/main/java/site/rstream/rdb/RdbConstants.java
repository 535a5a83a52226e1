package site.rstream.rdb;

/**
 * RDB文件格式常量
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RdbConstants {

    public static final String RDB_MAGIC = "REDIS";

    public static final String RDB_VERSION = "0011";

    // ========== 操作码 ==========

    public static final int RDB_OPCODE_AUX = 0xFA;

    public static final int RDB_OPCODE_RESIZEDB = 0xFB;

    public static final int RDB_OPCODE_EXPIRETIME_MS = 0xFC;

    public static final int RDB_OPCODE_EXPIRETIME = 0xFD;

    public static final int RDB_OPCODE_SELECTDB = 0xFE;

    public static final int RDB_OPCODE_EOF = 0xFF;

    // ========== 数据类型 ==========

    public static final int STRING_TYPE = 0x00;

    // ========== 长度编码 ==========

    public static final int RDB_6BITLEN = 0;
    public static final int RDB_14BITLEN = 1;
    public static final int RDB_32BITLEN = 0x80;
    public static final int RDB_64BITLEN = 0x81;
    public static final int RDB_ENCVAL = 3;

    public static final int RDB_ENC_INT8 = 0;
    public static final int RDB_ENC_INT16 = 1;
    public static final int RDB_ENC_INT32 = 2;
    public static final int RDB_ENC_LZF = 3;

    // ========== 快照策略默认值 ==========

    public static final long DEFAULT_SAVE_SECONDS = 60L;

    public static final long DEFAULT_SAVE_CHANGES = 100L;

    private RdbConstants() {
        throw new UnsupportedOperationException("常量类不允许实例化");
    }
}
