package site.rstream.command;

import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;

/**
 * Redis命令接口
 *
 * <p>每次执行创建一个新实例：先 {@link #setContext(Resp[])} 解析参数，再 {@link #handle()} 执行。
 * 参数或执行错误以异常抛出，异常消息就是返回给客户端的错误文本。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface Command {

    CommandType getType();

    /**
     * 解析并校验参数，数组第一个元素是命令名
     *
     * @throws IllegalArgumentException 参数无效
     */
    void setContext(Resp[] array);

    /**
     * 执行命令
     *
     * @return 回复；为null表示回复已经写出或被推迟（阻塞读、WAIT、PSYNC）
     */
    Resp handle();

    /**
     * @return 写命令会被传播到从节点
     */
    boolean isWriteCommand();

    /**
     * 传播到从节点的命令形式，在 {@link #handle()} 成功后调用
     *
     * @param command 收到的原始命令
     */
    default RespArray replicationForm(final RespArray command) {
        return command;
    }
}
