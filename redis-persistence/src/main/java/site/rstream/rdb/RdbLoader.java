package site.rstream.rdb;

import lombok.extern.slf4j.Slf4j;
import site.rstream.core.RedisCore;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisString;
import site.rstream.rdb.crc.Crc64;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * RDB加载器
 *
 * <p>支持字符串类型与两种过期时间操作码，辅助字段和resizedb提示被忽略。
 * 加载时已过期的键直接丢弃。校验和为0表示写入方关闭了校验，此时跳过验证。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RdbLoader {

    private final RedisCore redisCore;

    public RdbLoader(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    /**
     * 加载RDB内容到数据引擎
     *
     * @param content 完整的RDB字节
     * @return 加载的键数量
     * @throws IOException 格式错误或校验失败
     */
    public int load(final byte[] content) throws IOException {
        final DataInputStream dis = new DataInputStream(new ByteArrayInputStream(content));

        // 1. 检查头部
        final byte[] header = new byte[9];
        dis.readFully(header);
        final String magic = new String(header, 0, 5, StandardCharsets.US_ASCII);
        if (!RdbConstants.RDB_MAGIC.equals(magic)) {
            throw new IOException("RDB文件头不正确");
        }

        // 2. 逐条读取
        final long now = redisCore.currentTimeMillis();
        int loaded = 0;
        long expireAt = -1;
        while (true) {
            final int opcode = dis.readUnsignedByte();
            switch (opcode) {
                case RdbConstants.RDB_OPCODE_EOF:
                    verifyChecksum(dis, content);
                    log.info("RDB加载完成，共 {} 个键", loaded);
                    return loaded;
                case RdbConstants.RDB_OPCODE_AUX:
                    RdbUtils.readString(dis);
                    RdbUtils.readString(dis);
                    break;
                case RdbConstants.RDB_OPCODE_SELECTDB:
                    final long dbIndex = RdbUtils.readLength(dis);
                    if (dbIndex != 0) {
                        log.warn("只支持单库，数据库 {} 的内容合并到库0", dbIndex);
                    }
                    break;
                case RdbConstants.RDB_OPCODE_RESIZEDB:
                    RdbUtils.readLength(dis);
                    RdbUtils.readLength(dis);
                    break;
                case RdbConstants.RDB_OPCODE_EXPIRETIME_MS:
                    expireAt = RdbUtils.readLongLE(dis);
                    break;
                case RdbConstants.RDB_OPCODE_EXPIRETIME:
                    expireAt = RdbUtils.readIntLE(dis) * 1000L;
                    break;
                case RdbConstants.STRING_TYPE:
                    final byte[] key = RdbUtils.readString(dis);
                    final byte[] value = RdbUtils.readString(dis);
                    if (expireAt >= 0 && expireAt <= now) {
                        log.debug("跳过已过期的键: {}", new String(key, StandardCharsets.UTF_8));
                    } else {
                        redisCore.setWithDeadline(RedisBytes.wrapTrusted(key),
                                new RedisString(RedisBytes.wrapTrusted(value)), expireAt);
                        loaded++;
                    }
                    expireAt = -1;
                    break;
                default:
                    throw new IOException("不支持的数据类型: 0x" + Integer.toHexString(opcode));
            }
        }
    }

    private void verifyChecksum(final DataInputStream dis, final byte[] content) throws IOException {
        if (dis.available() < 8) {
            log.debug("RDB没有校验和尾部");
            return;
        }
        final long expected = RdbUtils.readLongLE(dis);
        if (expected == 0) {
            return;
        }
        final int covered = content.length - 8 - dis.available();
        final long actual = Crc64.crc64(0L, content, 0, covered);
        if (actual != expected) {
            throw new IOException("RDB校验和不匹配");
        }
    }
}
