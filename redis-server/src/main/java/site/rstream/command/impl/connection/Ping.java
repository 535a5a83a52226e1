package site.rstream.command.impl.connection;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.SimpleString;
import site.rstream.server.context.RedisContext;

/**
 * PING [message]
 */
public class Ping implements Command {

    private RedisBytes message;

    public Ping(final RedisContext redisContext) {
    }

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 2) {
            throw new IllegalArgumentException(Errors.wrongArity("ping").getContent());
        }
        message = array.length == 2 ? CommandArgs.bytes(array[1]) : null;
    }

    @Override
    public Resp handle() {
        return message == null ? SimpleString.PONG : BulkString.create(message);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
