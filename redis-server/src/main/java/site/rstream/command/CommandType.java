package site.rstream.command;

import lombok.Getter;
import site.rstream.command.impl.cluster.Psync;
import site.rstream.command.impl.cluster.Replconf;
import site.rstream.command.impl.cluster.Wait;
import site.rstream.command.impl.connection.Echo;
import site.rstream.command.impl.connection.Ping;
import site.rstream.command.impl.key.Del;
import site.rstream.command.impl.key.Exists;
import site.rstream.command.impl.key.Keys;
import site.rstream.command.impl.key.Type;
import site.rstream.command.impl.server.ConfigGet;
import site.rstream.command.impl.server.Info;
import site.rstream.command.impl.stream.Xadd;
import site.rstream.command.impl.stream.Xrange;
import site.rstream.command.impl.stream.Xread;
import site.rstream.command.impl.string.Get;
import site.rstream.command.impl.string.Incr;
import site.rstream.command.impl.string.Set;
import site.rstream.datastructure.RedisBytes;
import site.rstream.server.context.RedisContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 支持的命令
 *
 * <p>arity 与 Redis 一致：正数表示参数个数（含命令名）必须相等，负数表示至少为其绝对值。
 * MULTI/EXEC/DISCARD 由分发器直接处理，没有命令实现。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接 ==========
    PING("PING", -1, Ping::new),
    ECHO("ECHO", 2, Echo::new),

    // ========== 字符串 ==========
    GET("GET", 2, Get::new),
    SET("SET", -3, Set::new),
    INCR("INCR", 2, Incr::new),

    // ========== 键 ==========
    DEL("DEL", -2, Del::new),
    EXISTS("EXISTS", -2, Exists::new),
    TYPE("TYPE", 2, Type::new),
    KEYS("KEYS", 2, Keys::new),

    // ========== 流 ==========
    XADD("XADD", -5, Xadd::new),
    XRANGE("XRANGE", -4, Xrange::new),
    XREAD("XREAD", -4, Xread::new),

    // ========== 事务 ==========
    MULTI("MULTI", 1, null),
    EXEC("EXEC", 1, null),
    DISCARD("DISCARD", 1, null),

    // ========== 复制 ==========
    REPLCONF("REPLCONF", -2, Replconf::new),
    PSYNC("PSYNC", 3, Psync::new),
    WAIT("WAIT", 3, Wait::new),

    // ========== 服务器 ==========
    INFO("INFO", -1, Info::new),
    CONFIG("CONFIG", -2, ConfigGet::new);

    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : values()) {
            COMMAND_CACHE.put(type.bytes, type);
        }
    }

    private final String name;

    private final RedisBytes bytes;

    private final int arity;

    private final Function<RedisContext, Command> factory;

    CommandType(final String name, final int arity, final Function<RedisContext, Command> factory) {
        this.name = name;
        this.bytes = RedisBytes.fromString(name);
        this.arity = arity;
        this.factory = factory;
    }

    /**
     * 按命令名查找，大小写不敏感
     *
     * @return 未知命令返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        return COMMAND_CACHE.get(RedisBytes.fromString(commandBytes.getString().toUpperCase(Locale.ROOT)));
    }

    public boolean checkArity(final int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }

    public Command createCommand(final RedisContext context) {
        if (factory == null) {
            throw new IllegalStateException(name + " 由分发器直接处理");
        }
        return factory.apply(context);
    }
}
