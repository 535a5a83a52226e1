package site.rstream.server.config;

/**
 * 命令行参数解析
 *
 * <p>支持 {@code --port <n>}、{@code --dir <path>}、{@code --dbfilename <name>}、
 * {@code --replicaof "<host> <port>"}（也接受主机和端口作为两个参数）。
 */
public final class ServerArguments {

    private ServerArguments() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * @throws IllegalArgumentException 未知参数、缺少取值或取值无效
     */
    public static RedisServerConfig parse(final String[] args) {
        final RedisServerConfig.RedisServerConfigBuilder builder = RedisServerConfig.builder();
        int i = 0;
        while (i < args.length) {
            final String flag = args[i];
            switch (flag) {
                case "--port":
                    builder.port(parsePort(requireValue(args, i), flag));
                    i += 2;
                    break;
                case "--dir":
                    builder.dir(requireValue(args, i));
                    i += 2;
                    break;
                case "--dbfilename":
                    builder.dbFileName(requireValue(args, i));
                    i += 2;
                    break;
                case "--replicaof":
                    final String value = requireValue(args, i).trim();
                    final String[] parts = value.split("\\s+");
                    if (parts.length == 2) {
                        builder.replicaOfHost(parts[0]).replicaOfPort(parsePort(parts[1], flag));
                        i += 2;
                    } else if (parts.length == 1 && i + 2 < args.length && !args[i + 2].startsWith("--")) {
                        builder.replicaOfHost(parts[0]).replicaOfPort(parsePort(args[i + 2], flag));
                        i += 3;
                    } else {
                        throw new IllegalArgumentException("--replicaof 需要 \"<host> <port>\"");
                    }
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + flag);
            }
        }
        final RedisServerConfig config = builder.build();
        config.validate();
        return config;
    }

    private static String requireValue(final String[] args, final int flagIndex) {
        if (flagIndex + 1 >= args.length) {
            throw new IllegalArgumentException(args[flagIndex] + " 缺少取值");
        }
        return args[flagIndex + 1];
    }

    private static int parsePort(final String text, final String flag) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " 的端口无效: " + text, e);
        }
    }
}
