package site.rstream.replication;

import io.netty.channel.Channel;
import lombok.Getter;
import lombok.Setter;

/**
 * 主节点视角下的一个从节点
 *
 * <p>从节点上报的偏移量从全量同步完成时的0开始计数，
 * 加上 {@code baseOffset} 才能与主节点偏移量比较。
 */
@Getter
public class ReplicaInfo {

    private final int connectionId;

    private final Channel channel;

    /** 从节点声明的监听端口，未声明时为-1 */
    private final int listeningPort;

    /** 全量同步时主节点的偏移量 */
    private final long baseOffset;

    @Setter
    private long ackOffset;

    public ReplicaInfo(final int connectionId, final Channel channel, final int listeningPort, final long baseOffset) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.listeningPort = listeningPort;
        this.baseOffset = baseOffset;
    }

    /**
     * @return 换算到主节点偏移量坐标的已确认偏移量
     */
    public long acknowledgedMasterOffset() {
        return baseOffset + ackOffset;
    }

    @Override
    public String toString() {
        return "replica#" + connectionId + "(" + channel.remoteAddress() + ", ack=" + ackOffset + ")";
    }
}
