package site.rstream.server;

import site.rstream.core.RedisCore;
import site.rstream.rdb.RdbManager;
import site.rstream.server.context.RedisContext;

/**
 * Redis服务器生命周期接口
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 加载快照，从节点模式下先完成与主节点的握手，然后开始监听
     *
     * @throws IllegalStateException 端口绑定失败或复制握手失败
     */
    void start();

    /**
     * 停止监听，保存快照并释放事件循环
     */
    void stop();

    RedisCore getRedisCore();

    RdbManager getRdbManager();

    RedisContext getRedisContext();
}
