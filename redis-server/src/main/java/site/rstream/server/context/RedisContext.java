package site.rstream.server.context;

import site.rstream.core.RedisCore;
import site.rstream.replication.ReplicationCoordinator;
import site.rstream.replication.link.ReplicationLink;
import site.rstream.server.blocking.WaitingReaderRegistry;
import site.rstream.server.config.RedisServerConfig;

/**
 * 命令执行所需的服务器上下文
 *
 * <p>把数据引擎、配置、复制组件和阻塞读登记表聚合在一起，命令只依赖这个接口。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface RedisContext {

    RedisCore getRedisCore();

    RedisServerConfig getConfig();

    /**
     * @return 以主节点身份运行时为true
     */
    boolean isMaster();

    ReplicationCoordinator getReplicationCoordinator();

    /**
     * @return 从节点的复制连接，主节点返回null
     */
    ReplicationLink getReplicationLink();

    WaitingReaderRegistry getWaitingReaderRegistry();

    /**
     * 主节点返回已传播的字节数，从节点返回已处理的复制流字节数
     */
    default long getReplicationOffset() {
        final ReplicationLink link = getReplicationLink();
        if (link != null) {
            return link.getOffset();
        }
        return getReplicationCoordinator().getMasterOffset();
    }
}
