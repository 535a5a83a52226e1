package site.rstream.command.impl.key;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespInteger;
import site.rstream.server.context.RedisContext;

/**
 * EXISTS key [key ...]，重复的键重复计数
 */
public class Exists implements Command {

    private final RedisContext redisContext;

    private RedisBytes[] keys;

    public Exists(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.EXISTS;
    }

    @Override
    public void setContext(final Resp[] array) {
        keys = new RedisBytes[array.length - 1];
        for (int i = 1; i < array.length; i++) {
            keys[i - 1] = CommandArgs.bytes(array[i]);
        }
    }

    @Override
    public Resp handle() {
        int count = 0;
        for (final RedisBytes key : keys) {
            if (redisContext.getRedisCore().exists(key)) {
                count++;
            }
        }
        return RespInteger.valueOf(count);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
