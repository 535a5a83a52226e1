package site.rstream.replication;

/**
 * 复制握手或复制流处理失败
 */
public class ReplicationException extends RuntimeException {

    public ReplicationException(final String message) {
        super(message);
    }

    public ReplicationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
