package site.rstream.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * Redis服务器配置
 *
 * <p>由命令行参数构建，构造后作为显式依赖传给需要它的组件。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "0.0.0.0";

    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 持久化配置 ==========

    /** RDB文件所在目录 */
    @Builder.Default
    private String dir = "/tmp/rdb";

    @Builder.Default
    private String dbFileName = "dump.rdb";

    /** 距上次保存超过该秒数且有变更时保存 */
    @Builder.Default
    private long saveSeconds = 60;

    /** 变更数达到该值时保存 */
    @Builder.Default
    private long saveChanges = 100;

    /** 保存策略检查间隔 */
    @Builder.Default
    private long saveCheckMillis = 1000;

    // ========== 复制配置 ==========

    /** 主节点地址，为null时以主节点身份运行 */
    private String replicaOfHost;

    private int replicaOfPort;

    // ========== 阻塞读配置 ==========

    /** 阻塞读超时扫描间隔 */
    @Builder.Default
    private long blockedReaderSweepMillis = 10;

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 配置无效
     */
    public void validate() {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在1-65535范围内");
        }
        if (dir == null || dir.trim().isEmpty()) {
            throw new IllegalArgumentException("dir不能为空");
        }
        if (dbFileName == null || dbFileName.trim().isEmpty()) {
            throw new IllegalArgumentException("dbfilename不能为空");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
        if (saveSeconds <= 0 || saveChanges <= 0 || saveCheckMillis <= 0 || blockedReaderSweepMillis <= 0) {
            throw new IllegalArgumentException("时间间隔和阈值必须大于0");
        }
        if (isReplica() && (replicaOfHost.trim().isEmpty() || replicaOfPort <= 0 || replicaOfPort > 65535)) {
            throw new IllegalArgumentException("replicaof 需要有效的主机和端口");
        }
    }
}
