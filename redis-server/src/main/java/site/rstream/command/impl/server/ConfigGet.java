package site.rstream.command.impl.server;

import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.server.config.RedisServerConfig;
import site.rstream.server.context.RedisContext;
import site.rstream.utils.GlobPattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CONFIG GET pattern [pattern ...]
 *
 * <p>只暴露 dir、dbfilename、port，其他子命令返回错误。
 */
public class ConfigGet implements Command {

    private final Map<String, String> config = new LinkedHashMap<>();

    private final List<GlobPattern> patterns = new ArrayList<>();

    public ConfigGet(final RedisContext context) {
        final RedisServerConfig serverConfig = context.getConfig();
        config.put("dir", serverConfig.getDir());
        config.put("dbfilename", serverConfig.getDbFileName());
        config.put("port", String.valueOf(serverConfig.getPort()));
    }

    @Override
    public CommandType getType() {
        return CommandType.CONFIG;
    }

    @Override
    public void setContext(final Resp[] array) {
        final String subcommand = CommandArgs.string(array[1]);
        if (!"GET".equalsIgnoreCase(subcommand)) {
            throw new IllegalArgumentException("ERR unknown subcommand '" + subcommand + "'. Try CONFIG GET.");
        }
        if (array.length < 3) {
            throw new IllegalArgumentException("ERR wrong number of arguments for 'config|get' command");
        }
        for (int i = 2; i < array.length; i++) {
            patterns.add(GlobPattern.compileIgnoreCase(CommandArgs.bytes(array[i]).getBytesUnsafe()));
        }
    }

    @Override
    public Resp handle() {
        final List<Resp> result = new ArrayList<>();
        for (final Map.Entry<String, String> entry : config.entrySet()) {
            final byte[] name = entry.getKey().getBytes();
            for (final GlobPattern pattern : patterns) {
                if (pattern.matches(name)) {
                    result.add(BulkString.fromString(entry.getKey()));
                    result.add(BulkString.fromString(entry.getValue()));
                    break;
                }
            }
        }
        return RespArray.valueOf(result.toArray(new Resp[0]));
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
