package site.rstream.exception;

/**
 * 流ID非法或不满足递增约束，消息即返回给客户端的错误文本。
 */
public class StreamIdException extends IllegalArgumentException {

    public static final String INVALID_ID = "ERR Invalid stream ID specified as stream command argument";
    public static final String ZERO_ID = "ERR The ID specified in XADD must be greater than 0-0";
    public static final String NOT_INCREASING =
            "ERR The ID specified in XADD is equal or smaller than the target stream top item";

    public StreamIdException(final String message) {
        super(message);
    }

    public static StreamIdException invalid() {
        return new StreamIdException(INVALID_ID);
    }
}
