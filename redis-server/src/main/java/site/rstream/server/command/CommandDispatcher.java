package site.rstream.server.command;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandType;
import site.rstream.command.ConnectionAware;
import site.rstream.datastructure.RedisBytes;
import site.rstream.protocol.BulkString;
import site.rstream.protocol.Errors;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.SimpleString;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.context.RedisContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * 命令分发器
 *
 * <p>负责命令查找、参数个数校验、事务排队与执行、写命令传播，以及命令执行后唤醒阻塞读。
 * 客户端连接和主节点复制流都经过这里，只在事件循环线程上调用。
 * 写命令在回复写出之后才传播。
 *
 * @author rstream
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    private static final int UNKNOWN_COMMAND_ARGS_SHOWN = 2;

    private final RedisContext redisContext;

    /** 连接句柄到事务状态，只有执行过 MULTI 的连接才有记录 */
    private final Map<Integer, TransactionContext> transactions = new HashMap<>();

    private final ClientConnection masterLink = ClientConnection.masterLink();

    /** 本次分发中执行成功、等待回复之后传播的写命令 */
    private final List<RespArray> pendingPropagation = new ArrayList<>();

    public CommandDispatcher(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    /**
     * 处理一条客户端命令，回复直接写到连接上
     */
    public void dispatch(final ClientConnection connection, final RespArray command) {
        final Resp reply = process(connection, command);
        if (reply != null) {
            connection.reply(reply);
        }
        propagatePending();
        redisContext.getWaitingReaderRegistry().serveReadyKeys();
    }

    /**
     * 执行主节点复制流中的命令，回复被丢弃，写命令不再传播
     */
    public void executeReplicated(final RespArray command) {
        final Resp reply = process(masterLink, command);
        if (reply instanceof Errors) {
            log.warn("复制命令执行失败: {} -> {}", command, reply);
        }
        propagatePending();
        redisContext.getWaitingReaderRegistry().serveReadyKeys();
    }

    public void onDisconnect(final int connectionId) {
        transactions.remove(connectionId);
    }

    private Resp process(final ClientConnection connection, final RespArray command) {
        final Resp[] array = command.getContent();
        if (array == null || array.length == 0) {
            return new Errors("ERR empty command");
        }
        for (final Resp arg : array) {
            if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
                return new Errors("ERR Protocol error: expected bulk string argument");
            }
        }

        final RedisBytes name = ((BulkString) array[0]).getContent();
        final CommandType type = CommandType.findByBytes(name);
        if (type == null) {
            return unknownCommand(array);
        }
        if (!type.checkArity(array.length)) {
            return Errors.wrongArity(name.getString().toLowerCase());
        }

        final TransactionContext transaction = transactions.get(connection.getId());
        switch (type) {
            case MULTI:
                return multi(connection);
            case EXEC:
                return exec(connection, transaction);
            case DISCARD:
                return discard(connection, transaction);
            default:
                break;
        }
        if (transaction != null && transaction.isQueuing()) {
            transaction.enqueue(command);
            return SimpleString.QUEUED;
        }

        final Outcome outcome = execute(connection, type, command);
        if (outcome.propagates() && shouldPropagate(connection)) {
            pendingPropagation.add(outcome.replicated);
        }
        return outcome.reply;
    }

    private Resp multi(final ClientConnection connection) {
        final TransactionContext transaction = transactions.computeIfAbsent(connection.getId(), id -> new TransactionContext());
        if (transaction.isQueuing()) {
            return new Errors("ERR MULTI calls can not be nested");
        }
        transaction.begin();
        return SimpleString.OK;
    }

    private Resp discard(final ClientConnection connection, final TransactionContext transaction) {
        if (transaction == null || !transaction.isQueuing()) {
            return new Errors("ERR DISCARD without MULTI");
        }
        transaction.reset();
        transactions.remove(connection.getId());
        return SimpleString.OK;
    }

    /**
     * 依次执行排队的命令，单个命令失败不影响其他命令。
     * 成功的写命令在事务结束后按执行顺序传播。
     */
    private Resp exec(final ClientConnection connection, final TransactionContext transaction) {
        if (transaction == null || !transaction.isQueuing()) {
            return new Errors("ERR EXEC without MULTI");
        }
        final Queue<RespArray> queued = transaction.drain();
        transactions.remove(connection.getId());

        final Resp[] results = new Resp[queued.size()];
        final List<RespArray> executedWrites = new ArrayList<>();
        connection.setExecutingTransaction(true);
        try {
            int i = 0;
            for (final RespArray command : queued) {
                final CommandType type = CommandType.findByBytes(((BulkString) command.getContent()[0]).getContent());
                final Outcome outcome = execute(connection, type, command);
                results[i++] = outcome.reply == null ? BulkString.NULL : outcome.reply;
                if (outcome.propagates()) {
                    executedWrites.add(outcome.replicated);
                }
            }
        } finally {
            connection.setExecutingTransaction(false);
        }
        log.debug("{} EXEC 执行 {} 条命令", connection, results.length);

        if (shouldPropagate(connection)) {
            pendingPropagation.addAll(executedWrites);
        }
        return RespArray.valueOf(results);
    }

    private Outcome execute(final ClientConnection connection, final CommandType type, final RespArray command) {
        try {
            final Command cmd = type.createCommand(redisContext);
            cmd.setContext(command.getContent());
            if (cmd instanceof ConnectionAware) {
                ((ConnectionAware) cmd).setConnection(connection);
            }
            final Resp reply = cmd.handle();
            return new Outcome(reply, cmd.isWriteCommand() ? cmd.replicationForm(command) : null);
        } catch (RuntimeException e) {
            log.debug("{} 执行 {} 失败: {}", connection, type.getName(), e.getMessage());
            return new Outcome(toError(e), null);
        }
    }

    private void propagatePending() {
        for (final RespArray write : pendingPropagation) {
            redisContext.getReplicationCoordinator().propagate(write);
        }
        pendingPropagation.clear();
    }

    private boolean shouldPropagate(final ClientConnection connection) {
        return redisContext.isMaster() && !connection.isFromMaster();
    }

    static Errors toError(final RuntimeException e) {
        final String message = e.getMessage();
        if (message == null) {
            log.error("命令执行出现未预期的异常", e);
            return new Errors("ERR " + e.getClass().getSimpleName());
        }
        if (message.startsWith("ERR ") || message.startsWith("WRONGTYPE ")) {
            return new Errors(message);
        }
        return new Errors("ERR " + message);
    }

    private static Errors unknownCommand(final Resp[] array) {
        final StringBuilder sb = new StringBuilder("ERR unknown command '")
                .append(((BulkString) array[0]).getContent().getString())
                .append("', with args beginning with: ");
        for (int i = 1; i < array.length && i <= UNKNOWN_COMMAND_ARGS_SHOWN; i++) {
            sb.append('\'').append(((BulkString) array[i]).getContent().getString()).append("' ");
        }
        return new Errors(sb.toString());
    }

    /** 单条命令的执行结果 */
    private static final class Outcome {

        private final Resp reply;

        /** 写命令传播给从节点的形式，读命令为null */
        private final RespArray replicated;

        private Outcome(final Resp reply, final RespArray replicated) {
            this.reply = reply;
            this.replicated = replicated;
        }

        /** 执行成功的写命令才传播 */
        private boolean propagates() {
            return replicated != null && !(reply instanceof Errors);
        }
    }
}
