package site.rstream.command.impl.stream;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;

/**
 * XADD key id field value [field value ...]
 *
 * <p>id 可以是 {@code *}、{@code ms-*} 或 {@code ms-seq}。成功后通知阻塞在该键上的读者。
 * 传播给从节点的命令带的是生成好的 id，从节点不用自己的时钟重新生成。
 */
@Slf4j
public class Xadd implements Command {

    private final RedisContext redisContext;

    private RedisBytes key;

    private String idSpec;

    private List<RedisBytes> fieldsAndValues;

    private StreamEntryId addedId;

    public Xadd(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.XADD;
    }

    @Override
    public void setContext(final Resp[] array) {
        if ((array.length - 3) % 2 != 0) {
            throw new IllegalArgumentException(Errors.wrongArity("xadd").getContent());
        }
        key = CommandArgs.bytes(array[1]);
        idSpec = CommandArgs.string(array[2]);
        fieldsAndValues = new ArrayList<>(array.length - 3);
        for (int i = 3; i < array.length; i++) {
            fieldsAndValues.add(CommandArgs.bytes(array[i]));
        }
    }

    @Override
    public Resp handle() {
        addedId = redisContext.getRedisCore().xadd(key, idSpec, fieldsAndValues);
        redisContext.getWaitingReaderRegistry().signalKeyAsReady(key);
        log.debug("XADD {} -> {}", key, addedId);
        return BulkString.fromString(addedId.toString());
    }

    @Override
    public RespArray replicationForm(final RespArray command) {
        final Resp[] args = command.getContent().clone();
        args[2] = BulkString.fromString(addedId.toString());
        return RespArray.valueOf(args);
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
