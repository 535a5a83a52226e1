package site.rstream.command.impl.key;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespInteger;
import site.rstream.server.context.RedisContext;

/**
 * DEL key [key ...]
 */
public class Del implements Command {

    private final RedisContext redisContext;

    private RedisBytes[] keys;

    public Del(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
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
        int removed = 0;
        for (final RedisBytes key : keys) {
            if (redisContext.getRedisCore().delete(key)) {
                removed++;
            }
        }
        return RespInteger.valueOf(removed);
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
