package site.rstream;

import lombok.extern.slf4j.Slf4j;
import site.rstream.server.RedisMiniServer;
import site.rstream.server.RedisServer;
import site.rstream.server.config.RedisServerConfig;
import site.rstream.server.config.ServerArguments;

/**
 * 启动入口
 *
 * <pre>
 * java -jar redis-server.jar [--port 6379] [--dir /tmp/rdb] [--dbfilename dump.rdb] [--replicaof "host port"]
 * </pre>
 */
@Slf4j
public class RedisServerLauncher {

    public static void main(final String[] args) {
        final RedisServerConfig config;
        try {
            config = ServerArguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            System.exit(1);
            return;
        }

        final RedisServer redisServer = new RedisMiniServer(config);
        try {
            redisServer.start();
        } catch (IllegalStateException e) {
            log.error("服务器启动失败: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "redis-shutdown"));
    }
}
