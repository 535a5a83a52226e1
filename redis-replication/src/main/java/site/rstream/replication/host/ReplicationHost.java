package site.rstream.replication.host;

import site.rstream.protocol.RespArray;

import java.io.IOException;

/**
 * 复制主机接口
 *
 * <p>复制模块只依赖它真正需要的服务，由server层实现，避免复制模块反向依赖server层。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface ReplicationHost {

    /**
     * 执行主节点传来的命令，不产生回复
     *
     * @param command 完整的命令数组
     */
    void executeReplicated(RespArray command);

    /**
     * 生成RDB快照，全量同步时发送给从节点
     */
    byte[] generateRdbSnapshot() throws IOException;

    /**
     * 加载主节点发送的RDB快照，替换当前数据
     */
    void loadRdbSnapshot(byte[] content) throws IOException;
}
