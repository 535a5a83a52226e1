package site.rstream.command.impl.server;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.replication.link.ReplicationLink;
import site.rstream.server.config.RedisServerConfig;
import site.rstream.server.context.RedisContext;

/**
 * INFO [section]
 *
 * <p>只有 replication 段，默认、all 和 everything 也返回该段，其他段返回空字符串。
 */
public class Info implements Command {

    private static final String CRLF = "\r\n";

    private final RedisContext redisContext;

    private String section = "default";

    public Info(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.INFO;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 2) {
            throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
        }
        if (array.length == 2) {
            section = CommandArgs.string(array[1]).toLowerCase();
        }
    }

    @Override
    public Resp handle() {
        switch (section) {
            case "replication":
            case "default":
            case "all":
            case "everything":
                return BulkString.fromString(replicationSection());
            default:
                return BulkString.fromString("");
        }
    }

    private String replicationSection() {
        final StringBuilder sb = new StringBuilder("# Replication").append(CRLF);
        if (redisContext.isMaster()) {
            sb.append("role:master").append(CRLF);
            sb.append("connected_slaves:").append(redisContext.getReplicationCoordinator().replicaCount()).append(CRLF);
        } else {
            final RedisServerConfig config = redisContext.getConfig();
            sb.append("role:slave").append(CRLF);
            sb.append("master_host:").append(config.getReplicaOfHost()).append(CRLF);
            sb.append("master_port:").append(config.getReplicaOfPort()).append(CRLF);
            sb.append("connected_slaves:0").append(CRLF);
        }
        sb.append("master_replid:").append(replicationId()).append(CRLF);
        sb.append("master_repl_offset:").append(redisContext.getReplicationOffset()).append(CRLF);
        return sb.toString();
    }

    /** 从节点报告主节点的复制ID */
    private String replicationId() {
        final ReplicationLink link = redisContext.getReplicationLink();
        if (link != null && link.getMasterReplId() != null) {
            return link.getMasterReplId();
        }
        return redisContext.getReplicationCoordinator().getReplId();
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
