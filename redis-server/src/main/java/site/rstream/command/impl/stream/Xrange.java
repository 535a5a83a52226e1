package site.rstream.command.impl.stream;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.protocol.Resp;
import site.rstream.server.context.RedisContext;

/**
 * XRANGE key start end [COUNT count]
 *
 * <p>{@code -} 和 {@code +} 分别表示最小和最大ID，只有毫秒部分的边界按 ms-0 和 ms-最大序号处理。
 */
public class Xrange implements Command {

    private final RedisContext redisContext;

    private RedisBytes key;

    private StreamEntryId start;

    private StreamEntryId end;

    private int count = -1;

    public Xrange(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.XRANGE;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
        start = StreamEntryId.parseRangeStart(CommandArgs.string(array[2]));
        end = StreamEntryId.parseRangeEnd(CommandArgs.string(array[3]));
        if (array.length == 6 && "COUNT".equalsIgnoreCase(CommandArgs.string(array[4]))) {
            // 负数与0一样返回空结果
            count = Math.max(0, CommandArgs.parseInt(array[5]));
        } else if (array.length != 4) {
            throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
        }
    }

    @Override
    public Resp handle() {
        return StreamReplies.entries(redisContext.getRedisCore().xrange(key, start, end, count));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
