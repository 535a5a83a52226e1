package site.rstream.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.RedisString;
import site.rstream.protocol.Resp;
import site.rstream.protocol.SimpleString;
import site.rstream.server.context.RedisContext;

/**
 * SET key value [PX milliseconds | EX seconds]
 */
@Slf4j
public class Set implements Command {

    private static final String INVALID_EXPIRE = "ERR invalid expire time in 'set' command";

    private final RedisContext redisContext;

    private RedisBytes key;

    private RedisBytes value;

    /** 相对过期毫秒数，-1表示不过期 */
    private long ttlMillis = -1;

    public Set(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = CommandArgs.bytes(array[1]);
        value = CommandArgs.bytes(array[2]);
        int i = 3;
        while (i < array.length) {
            final String option = CommandArgs.string(array[i]).toUpperCase();
            if (("PX".equals(option) || "EX".equals(option)) && ttlMillis < 0 && i + 1 < array.length) {
                final long amount = CommandArgs.parseLong(array[i + 1]);
                if (amount <= 0) {
                    throw new IllegalArgumentException(INVALID_EXPIRE);
                }
                if ("EX".equals(option)) {
                    if (amount > Long.MAX_VALUE / 1000) {
                        throw new IllegalArgumentException(INVALID_EXPIRE);
                    }
                    ttlMillis = amount * 1000;
                } else {
                    ttlMillis = amount;
                }
                i += 2;
            } else {
                throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
            }
        }
    }

    @Override
    public Resp handle() {
        final long now = redisContext.getRedisCore().currentTimeMillis();
        if (ttlMillis > Long.MAX_VALUE - now) {
            throw new IllegalArgumentException(INVALID_EXPIRE);
        }
        redisContext.getRedisCore().set(key, new RedisString(value), ttlMillis);
        log.debug("SET {} ttl={}ms", key, ttlMillis);
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
