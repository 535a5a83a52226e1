package site.rstream.command.impl.cluster;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.command.ConnectionAware;
import site.rstream.protocol.Resp;
import site.rstream.replication.ReplicationException;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.context.RedisContext;

import java.io.IOException;

/**
 * PSYNC replid offset
 *
 * <p>只支持全量同步，任何 replid/offset 都回复 FULLRESYNC 并发送快照。
 * 回复由复制协调器直接写到通道，命令本身不返回结果。
 */
@Slf4j
public class Psync implements Command, ConnectionAware {

    private final RedisContext redisContext;

    private ClientConnection connection;

    private String requestedReplId;

    private String requestedOffset;

    public Psync(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.PSYNC;
    }

    @Override
    public void setConnection(final ClientConnection connection) {
        this.connection = connection;
    }

    @Override
    public void setContext(final Resp[] array) {
        requestedReplId = CommandArgs.string(array[1]);
        requestedOffset = CommandArgs.string(array[2]);
    }

    @Override
    public Resp handle() {
        if (!redisContext.isMaster()) {
            throw new IllegalStateException("ERR PSYNC is not supported on a replica");
        }
        if (connection == null || connection.getChannel() == null) {
            throw new IllegalStateException("ERR PSYNC requires a client connection");
        }
        log.info("{} 请求同步 replid={} offset={}，执行全量同步", connection, requestedReplId, requestedOffset);
        try {
            redisContext.getReplicationCoordinator().fullResync(connection.getId(), connection.getChannel());
        } catch (IOException e) {
            throw new ReplicationException("ERR failed to generate snapshot: " + e.getMessage(), e);
        }
        return null;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
