package site.rstream.command.impl.cluster;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.command.ConnectionAware;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespInteger;
import site.rstream.replication.ReplicationCoordinator;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.context.RedisContext;

/**
 * WAIT numreplicas timeout
 *
 * <p>回复确认了当前偏移量的从节点数。需要等待时命令返回null，结果由协调器在确认或超时后写回。
 * 从节点上以及 EXEC 中立即返回。
 */
public class Wait implements Command, ConnectionAware {

    private final RedisContext redisContext;

    private ClientConnection connection;

    private int numReplicas;

    private long timeoutMillis;

    public Wait(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.WAIT;
    }

    @Override
    public void setConnection(final ClientConnection connection) {
        this.connection = connection;
    }

    @Override
    public void setContext(final Resp[] array) {
        numReplicas = CommandArgs.parseInt(array[1]);
        timeoutMillis = CommandArgs.parseLong(array[2], "ERR timeout is not an integer or out of range");
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("ERR timeout is negative");
        }
    }

    @Override
    public Resp handle() {
        if (!redisContext.isMaster()) {
            return RespInteger.ZERO;
        }
        final ReplicationCoordinator coordinator = redisContext.getReplicationCoordinator();
        if (connection == null || connection.isExecutingTransaction() || connection.getChannel() == null) {
            return RespInteger.valueOf(coordinator.acknowledgedReplicas());
        }
        final ClientConnection waiter = connection;
        coordinator.waitForAcknowledgments(waiter.getId(), numReplicas, timeoutMillis,
                acknowledged -> waiter.reply(RespInteger.valueOf(acknowledged)));
        return null;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
