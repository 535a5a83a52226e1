package site.rstream.rdb;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.core.RedisCore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * RDB持久化管理器
 *
 * <p>负责启动加载、按策略自动保存、关闭时保存，以及为全量同步生成内存快照。
 * 所有方法都在事件循环线程上调用。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RdbManager {

    private final RedisCore redisCore;

    private final Path file;

    /** 距上次保存超过该秒数且有变更时保存 */
    private final long saveSeconds;

    /** 变更数达到该值时保存 */
    private final long saveChanges;

    private final RdbWriter writer;

    private final RdbLoader loader;

    private long lastSaveTime;

    private long lastSaveDirty;

    public RdbManager(final RedisCore redisCore, final String dir, final String fileName) {
        this(redisCore, dir, fileName, RdbConstants.DEFAULT_SAVE_SECONDS, RdbConstants.DEFAULT_SAVE_CHANGES);
    }

    public RdbManager(final RedisCore redisCore, final String dir, final String fileName,
                      final long saveSeconds, final long saveChanges) {
        this.redisCore = redisCore;
        this.file = Paths.get(dir, fileName);
        this.saveSeconds = saveSeconds;
        this.saveChanges = saveChanges;
        this.writer = new RdbWriter();
        this.loader = new RdbLoader(redisCore);
        this.lastSaveTime = redisCore.currentTimeMillis();
        this.lastSaveDirty = redisCore.getDirty();
    }

    /**
     * 启动时加载快照文件
     *
     * <p>文件不存在或损坏时以空库启动，不会中止服务。
     *
     * @return 是否加载成功
     */
    public boolean loadOnStartup() {
        if (!Files.isRegularFile(file)) {
            log.info("RDB文件不存在，以空库启动: {}", file);
            return false;
        }
        try {
            final int loaded = loader.load(Files.readAllBytes(file));
            log.info("从 {} 加载了 {} 个键", file, loaded);
            resetDirtyMark();
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("RDB文件加载失败，以空库启动: {}", file, e);
            redisCore.flushAll();
            resetDirtyMark();
            return false;
        }
    }

    /**
     * 根据保存策略判断是否需要保存，满足条件时同步保存
     *
     * @return 本次是否执行了保存
     */
    public boolean saveIfNeeded() {
        final long changes = pendingChanges();
        if (changes <= 0) {
            return false;
        }
        final long elapsedSeconds = (redisCore.currentTimeMillis() - lastSaveTime) / 1000;
        if (changes >= saveChanges || elapsedSeconds >= saveSeconds) {
            log.debug("触发自动保存: {} 个变更, 距上次保存 {} 秒", changes, elapsedSeconds);
            return save();
        }
        return false;
    }

    /**
     * 立即保存
     *
     * @return 是否成功
     */
    public boolean save() {
        try {
            writer.writeToFile(redisCore.getDatabase(), file, redisCore.currentTimeMillis());
            resetDirtyMark();
            return true;
        } catch (IOException e) {
            log.error("RDB保存失败: {}", file, e);
            return false;
        }
    }

    /**
     * 关闭时有未保存的变更则保存
     */
    public void saveOnShutdown() {
        if (pendingChanges() > 0) {
            log.info("关闭前保存 {} 个未持久化的变更", pendingChanges());
            save();
        }
    }

    /**
     * 生成内存快照，用于全量同步
     */
    public byte[] generateSnapshot() throws IOException {
        return writer.toBytes(redisCore.getDatabase(), redisCore.currentTimeMillis());
    }

    /**
     * 清空当前数据并加载主节点发送的快照
     *
     * @return 加载的键数量
     */
    public int loadSnapshot(final byte[] content) throws IOException {
        redisCore.flushAll();
        final int loaded = loader.load(content);
        resetDirtyMark();
        return loaded;
    }

    public long pendingChanges() {
        return redisCore.getDirty() - lastSaveDirty;
    }

    private void resetDirtyMark() {
        lastSaveDirty = redisCore.getDirty();
        lastSaveTime = redisCore.currentTimeMillis();
    }
}
