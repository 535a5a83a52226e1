package site.rstream.rdb;

import lombok.extern.slf4j.Slf4j;
import site.rstream.database.RedisDB;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisData;
import site.rstream.datastructure.RedisString;
import site.rstream.rdb.crc.Crc64;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * RDB写入器
 *
 * <p>只序列化字符串类型的键，流类型在快照中被跳过。已过期的键不会被写入。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RdbWriter {

    private static final String REDIS_VERSION = "7.2.0";

    /**
     * 把数据库序列化为完整的RDB字节
     *
     * @param db 数据库
     * @param nowMs 当前时间，用于过滤已过期的键
     * @return RDB内容，含EOF和CRC64尾部
     */
    public byte[] toBytes(final RedisDB db, final long nowMs) throws IOException {
        final ByteArrayOutputStream bos = new ByteArrayOutputStream(256);
        final DataOutputStream dos = new DataOutputStream(bos);

        // 1. 文件头与辅助字段
        dos.write((RdbConstants.RDB_MAGIC + RdbConstants.RDB_VERSION).getBytes(StandardCharsets.US_ASCII));
        writeAux(dos, "redis-ver", REDIS_VERSION);
        dos.writeByte(RdbConstants.RDB_OPCODE_AUX);
        RdbUtils.writeString(dos, "redis-bits");
        RdbUtils.writeInt8(dos, 64);

        // 2. 数据库内容
        final List<Map.Entry<RedisBytes, RedisData>> strings = collectStrings(db, nowMs);
        if (!strings.isEmpty()) {
            int expiring = 0;
            for (final Map.Entry<RedisBytes, RedisData> entry : strings) {
                if (db.getExpireAt(entry.getKey()) >= 0) {
                    expiring++;
                }
            }
            dos.writeByte(RdbConstants.RDB_OPCODE_SELECTDB);
            RdbUtils.writeLength(dos, 0);
            dos.writeByte(RdbConstants.RDB_OPCODE_RESIZEDB);
            RdbUtils.writeLength(dos, strings.size());
            RdbUtils.writeLength(dos, expiring);
            for (final Map.Entry<RedisBytes, RedisData> entry : strings) {
                writeStringEntry(dos, db, entry.getKey(), (RedisString) entry.getValue());
            }
        }

        // 3. EOF与校验和
        dos.writeByte(RdbConstants.RDB_OPCODE_EOF);
        dos.flush();
        final long checksum = Crc64.crc64(bos.toByteArray());
        RdbUtils.writeLongLE(dos, checksum);
        dos.flush();
        return bos.toByteArray();
    }

    /**
     * 写入文件：先写临时文件再原子重命名
     */
    public void writeToFile(final RedisDB db, final Path target, final long nowMs) throws IOException {
        final byte[] content = toBytes(db, nowMs);
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temp, content);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("RDB快照已写入: {} ({} 字节)", target, content.length);
    }

    private List<Map.Entry<RedisBytes, RedisData>> collectStrings(final RedisDB db, final long nowMs) {
        final List<Map.Entry<RedisBytes, RedisData>> result = new ArrayList<>();
        for (final Map.Entry<RedisBytes, RedisData> entry : db.getData().entrySet()) {
            if (!(entry.getValue() instanceof RedisString)) {
                continue;
            }
            final long expireAt = db.getExpireAt(entry.getKey());
            if (expireAt >= 0 && expireAt <= nowMs) {
                continue;
            }
            result.add(entry);
        }
        return result;
    }

    private void writeStringEntry(final DataOutputStream dos, final RedisDB db, final RedisBytes key,
                                  final RedisString value) throws IOException {
        final long expireAt = db.getExpireAt(key);
        if (expireAt >= 0) {
            dos.writeByte(RdbConstants.RDB_OPCODE_EXPIRETIME_MS);
            RdbUtils.writeLongLE(dos, expireAt);
        }
        dos.writeByte(RdbConstants.STRING_TYPE);
        RdbUtils.writeString(dos, key.getBytesUnsafe());
        RdbUtils.writeString(dos, value.getValue().getBytesUnsafe());
    }

    private void writeAux(final DataOutputStream dos, final String name, final String value) throws IOException {
        dos.writeByte(RdbConstants.RDB_OPCODE_AUX);
        RdbUtils.writeString(dos, name);
        RdbUtils.writeString(dos, value);
    }
}
