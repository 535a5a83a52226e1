package site.rstream.server.command;

import site.rstream.protocol.RespArray;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * 单个连接的事务状态：是否处于 MULTI 之后，以及排队的命令
 */
public class TransactionContext {

    private boolean queuing;

    private final Queue<RespArray> queued = new ArrayDeque<>();

    public boolean isQueuing() {
        return queuing;
    }

    public void begin() {
        queuing = true;
        queued.clear();
    }

    public void enqueue(final RespArray command) {
        queued.add(command);
    }

    public int size() {
        return queued.size();
    }

    /**
     * 取出全部排队命令并回到普通模式
     */
    public Queue<RespArray> drain() {
        final Queue<RespArray> commands = new ArrayDeque<>(queued);
        reset();
        return commands;
    }

    public void reset() {
        queuing = false;
        queued.clear();
    }
}
