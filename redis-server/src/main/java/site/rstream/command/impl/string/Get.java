package site.rstream.command.impl.string;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisData;
import site.rstream.datastructure.RedisString;
import site.rstream.exception.WrongTypeException;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.server.context.RedisContext;

public class Get implements Command {

    private final RedisContext redisContext;

    private RedisBytes key;

    public Get(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisData data = redisContext.getRedisCore().get(key);
        if (data == null) {
            return BulkString.NULL;
        }
        if (!(data instanceof RedisString)) {
            throw new WrongTypeException();
        }
        return BulkString.create(((RedisString) data).getValue());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
