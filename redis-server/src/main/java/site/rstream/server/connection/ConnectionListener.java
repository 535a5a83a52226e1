package site.rstream.server.connection;

import site.rstream.protocol.RespArray;

/**
 * 网络层向服务器报告的连接事件
 */
public interface ConnectionListener {

    void onCommand(ClientConnection connection, RespArray command);

    /**
     * 清理该连接的事务、阻塞读、WAIT 和从节点登记
     */
    void onDisconnect(int connectionId);
}
