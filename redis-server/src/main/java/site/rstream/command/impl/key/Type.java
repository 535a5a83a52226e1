package site.rstream.command.impl.key;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.Resp;
import site.rstream.protocol.SimpleString;
import site.rstream.server.context.RedisContext;

public class Type implements Command {

    private final RedisContext redisContext;

    private RedisBytes key;

    public Type(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.TYPE;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        return SimpleString.valueOf(redisContext.getRedisCore().typeOf(key));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
