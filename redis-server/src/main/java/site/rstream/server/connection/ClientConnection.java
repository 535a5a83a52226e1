package site.rstream.server.connection;

import io.netty.channel.Channel;
import lombok.Getter;
import lombok.Setter;
import site.rstream.protocol.Resp;

/**
 * 一个连接的句柄
 *
 * <p>连接相关的状态（事务队列、阻塞读、从节点登记）都存放在以 {@link #id} 为键的表中，
 * 这里只保存通道和少量标志。
 */
@Getter
public class ClientConnection {

    /** 主节点复制流使用的伪连接句柄 */
    public static final int MASTER_LINK_ID = 0;

    private final int id;

    /** 为null表示不回复的连接（主节点复制流） */
    private final Channel channel;

    /** 命令是否来自主节点，来自主节点的写命令不再传播 */
    private final boolean fromMaster;

    /** 正在执行 EXEC 时为true，此时阻塞类命令立即返回 */
    @Setter
    private boolean executingTransaction;

    public ClientConnection(final int id, final Channel channel) {
        this(id, channel, false);
    }

    private ClientConnection(final int id, final Channel channel, final boolean fromMaster) {
        this.id = id;
        this.channel = channel;
        this.fromMaster = fromMaster;
    }

    public static ClientConnection masterLink() {
        return new ClientConnection(MASTER_LINK_ID, null, true);
    }

    /**
     * 向客户端写回复，通道不可用或静默连接时丢弃
     */
    public void reply(final Resp response) {
        if (channel == null || !channel.isActive()) {
            return;
        }
        channel.writeAndFlush(response);
    }

    @Override
    public String toString() {
        return "conn#" + id + (channel == null ? "(master-link)" : "(" + channel.remoteAddress() + ")");
    }
}
