package site.rstream.command.impl.string;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespInteger;
import site.rstream.server.context.RedisContext;

public class Incr implements Command {

    private final RedisContext redisContext;

    private RedisBytes key;

    public Incr(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.INCR;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(redisContext.getRedisCore().incr(key));
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
