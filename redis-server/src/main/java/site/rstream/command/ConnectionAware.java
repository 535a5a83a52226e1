package site.rstream.command;

import site.rstream.server.connection.ClientConnection;

/**
 * 需要访问发起连接的命令，在 {@link Command#handle()} 之前注入
 */
public interface ConnectionAware {

    void setConnection(ClientConnection connection);
}
