package site.rstream.command.impl.cluster;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.command.ConnectionAware;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.SimpleString;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.context.RedisContext;

/**
 * REPLCONF subcommand [args ...]
 *
 * <ul>
 *     <li>listening-port - 记录从节点监听端口</li>
 *     <li>capa - 接受并忽略</li>
 *     <li>ACK offset - 从节点确认偏移量，不回复</li>
 *     <li>GETACK - 回复本节点的复制偏移量</li>
 * </ul>
 */
@Slf4j
public class Replconf implements Command, ConnectionAware {

    private final RedisContext redisContext;

    private ClientConnection connection;

    private Resp[] args;

    private String subcommand;

    public Replconf(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.REPLCONF;
    }

    @Override
    public void setConnection(final ClientConnection connection) {
        this.connection = connection;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.args = array;
        this.subcommand = CommandArgs.string(array[1]).toLowerCase();
        if (("listening-port".equals(subcommand) || "ack".equals(subcommand)) && array.length < 3) {
            throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
        }
    }

    @Override
    public Resp handle() {
        switch (subcommand) {
            case "listening-port":
                final int port = CommandArgs.parseInt(args[2]);
                redisContext.getReplicationCoordinator().recordListeningPort(connection.getId(), port);
                log.debug("{} 声明监听端口 {}", connection, port);
                return SimpleString.OK;
            case "ack":
                redisContext.getReplicationCoordinator().onAck(connection.getId(), CommandArgs.parseLong(args[2]));
                return null;
            case "getack":
                return RespArray.ofCommand("REPLCONF", "ACK", Long.toString(redisContext.getReplicationOffset()));
            default:
                return SimpleString.OK;
        }
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
