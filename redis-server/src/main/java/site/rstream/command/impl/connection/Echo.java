package site.rstream.command.impl.connection;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.server.context.RedisContext;

public class Echo implements Command {

    private RedisBytes message;

    public Echo(final RedisContext redisContext) {
    }

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(final Resp[] array) {
        message = CommandArgs.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        return BulkString.create(message);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
