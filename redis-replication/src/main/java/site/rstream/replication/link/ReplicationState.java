package site.rstream.replication.link;

/**
 * 从节点复制连接的状态
 */
public enum ReplicationState {
    CONNECTING("connecting"),
    WAIT_PONG("wait-pong"),
    WAIT_PORT_OK("wait-replconf-port"),
    WAIT_CAPA_OK("wait-replconf-capa"),
    WAIT_FULLRESYNC("wait-fullresync"),
    WAIT_RDB("wait-rdb"),
    STREAMING("streaming"),
    CLOSED("closed");

    private final String stateName;

    ReplicationState(final String stateName) {
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }

    public boolean isHandshaking() {
        return this != STREAMING && this != CLOSED;
    }

    @Override
    public String toString() {
        return stateName;
    }
}
