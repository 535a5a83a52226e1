package site.rstream.command.impl.key;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.server.context.RedisContext;
import site.rstream.utils.GlobPattern;

import java.util.List;

/**
 * KEYS pattern，结果按字典序排列
 */
public class Keys implements Command {

    private final RedisContext redisContext;

    private GlobPattern pattern;

    public Keys(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.KEYS;
    }

    @Override
    public void setContext(final Resp[] array) {
        pattern = GlobPattern.compile(CommandArgs.bytes(array[1]).getBytesUnsafe());
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> keys = redisContext.getRedisCore().keys(pattern);
        final Resp[] result = new Resp[keys.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = BulkString.create(keys.get(i));
        }
        return RespArray.valueOf(result);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
