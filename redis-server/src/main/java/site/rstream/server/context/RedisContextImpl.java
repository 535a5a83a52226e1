package site.rstream.server.context;

import lombok.Getter;
import lombok.Setter;
import site.rstream.core.RedisCore;
import site.rstream.replication.ReplicationCoordinator;
import site.rstream.replication.link.ReplicationLink;
import site.rstream.server.blocking.WaitingReaderRegistry;
import site.rstream.server.config.RedisServerConfig;

/**
 * 服务器上下文的默认实现，各组件由服务器装配后注入
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RedisContextImpl implements RedisContext {

    private final RedisCore redisCore;

    private final RedisServerConfig config;

    private final ReplicationCoordinator replicationCoordinator;

    private final WaitingReaderRegistry waitingReaderRegistry;

    @Setter
    private ReplicationLink replicationLink;

    public RedisContextImpl(final RedisCore redisCore, final RedisServerConfig config,
                            final ReplicationCoordinator replicationCoordinator,
                            final WaitingReaderRegistry waitingReaderRegistry) {
        this.redisCore = redisCore;
        this.config = config;
        this.replicationCoordinator = replicationCoordinator;
        this.waitingReaderRegistry = waitingReaderRegistry;
    }

    @Override
    public boolean isMaster() {
        return !config.isReplica();
    }
}
