package site.rstream.command;

import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;

/**
 * 命令参数的读取与转换
 */
public final class CommandArgs {

    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";

    public static final String SYNTAX_ERROR = "ERR syntax error";

    private CommandArgs() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    public static RedisBytes bytes(final Resp arg) {
        if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
            throw new IllegalArgumentException("ERR Protocol error: expected bulk string argument");
        }
        return ((BulkString) arg).getContent();
    }

    public static String string(final Resp arg) {
        return bytes(arg).getString();
    }

    public static long parseLong(final Resp arg) {
        return parseLong(arg, NOT_AN_INTEGER);
    }

    /**
     * @param errorMessage 不是合法整数时抛出的错误文本
     */
    public static long parseLong(final Resp arg, final String errorMessage) {
        try {
            return Long.parseLong(string(arg));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(errorMessage, e);
        }
    }

    public static int parseInt(final Resp arg) {
        final long value = parseLong(arg);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(NOT_AN_INTEGER);
        }
        return (int) value;
    }
}
