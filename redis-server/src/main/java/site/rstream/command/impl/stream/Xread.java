package site.rstream.command.impl.stream;

import lombok.extern.slf4j.Slf4j;
import site.rstream.command.Command;
import site.rstream.command.CommandArgs;
import site.rstream.command.CommandType;
import site.rstream.command.ConnectionAware;
import site.rstream.core.RedisCore;
import site.rstream.datastructure.RedisBytes;
import site.rstream.datastructure.StreamEntry;
import site.rstream.datastructure.StreamEntryId;
import site.rstream.protocol.Resp;
import site.rstream.protocol.RespArray;
import site.rstream.server.blocking.WaitingReader;
import site.rstream.server.connection.ClientConnection;
import site.rstream.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * XREAD [COUNT count] [BLOCK milliseconds] STREAMS key [key ...] id [id ...]
 *
 * <p>{@code $} 在调用时解析为流的最后一个ID。BLOCK 且没有可读数据时登记到阻塞读登记表，
 * 由后续的 XADD 或超时扫描回复。EXEC 中的 BLOCK 按非阻塞处理。
 */
@Slf4j
public class Xread implements Command, ConnectionAware {

    private static final String LAST_ID = "$";

    private static final String UNBALANCED =
            "ERR Unbalanced XREAD list of streams: for each stream key an ID or '$' must be specified.";

    private final RedisContext redisContext;

    private ClientConnection connection;

    private int count = -1;

    /** -1 表示非阻塞，0 表示一直等待 */
    private long blockMillis = -1;

    private final List<RedisBytes> keys = new ArrayList<>();

    private final List<String> idTexts = new ArrayList<>();

    public Xread(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.XREAD;
    }

    @Override
    public void setConnection(final ClientConnection connection) {
        this.connection = connection;
    }

    @Override
    public void setContext(final Resp[] array) {
        int streamsIndex = -1;
        for (int i = 1; i < array.length; i++) {
            if ("STREAMS".equalsIgnoreCase(CommandArgs.string(array[i]))) {
                streamsIndex = i;
                break;
            }
        }
        if (streamsIndex < 0) {
            throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
        }
        parseOptions(array, streamsIndex);

        final int remaining = array.length - streamsIndex - 1;
        if (remaining == 0 || remaining % 2 != 0) {
            throw new IllegalArgumentException(UNBALANCED);
        }
        final int streamCount = remaining / 2;
        for (int i = 0; i < streamCount; i++) {
            keys.add(CommandArgs.bytes(array[streamsIndex + 1 + i]));
            final String id = CommandArgs.string(array[streamsIndex + 1 + streamCount + i]);
            if (!LAST_ID.equals(id)) {
                StreamEntryId.parse(id, 0);
            }
            idTexts.add(id);
        }
    }

    private void parseOptions(final Resp[] array, final int streamsIndex) {
        boolean countSeen = false;
        boolean blockSeen = false;
        for (int i = 1; i < streamsIndex; i += 2) {
            final String option = CommandArgs.string(array[i]);
            if (i + 1 >= streamsIndex) {
                throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
            }
            if ("COUNT".equalsIgnoreCase(option) && !countSeen) {
                countSeen = true;
                count = CommandArgs.parseInt(array[i + 1]);
                if (count < 0) {
                    throw new IllegalArgumentException("ERR COUNT can't be negative");
                }
            } else if ("BLOCK".equalsIgnoreCase(option) && !blockSeen) {
                blockSeen = true;
                blockMillis = CommandArgs.parseLong(array[i + 1], "ERR timeout is not an integer or out of range");
                if (blockMillis < 0) {
                    throw new IllegalArgumentException("ERR timeout is negative");
                }
            } else {
                throw new IllegalArgumentException(CommandArgs.SYNTAX_ERROR);
            }
        }
    }

    @Override
    public Resp handle() {
        final RedisCore core = redisContext.getRedisCore();
        final List<StreamEntryId> afterIds = new ArrayList<>(keys.size());
        boolean usesLastId = false;
        for (int i = 0; i < keys.size(); i++) {
            final String id = idTexts.get(i);
            if (LAST_ID.equals(id)) {
                usesLastId = true;
                afterIds.add(core.lastStreamId(keys.get(i)));
            } else {
                afterIds.add(StreamEntryId.parse(id, 0));
            }
        }

        final boolean blocking = blockMillis >= 0 && connection != null && !connection.isExecutingTransaction()
                && connection.getChannel() != null;
        if (blocking && usesLastId) {
            // $ 只等待调用之后追加的条目
            park(afterIds);
            return null;
        }

        final Map<RedisBytes, List<StreamEntry>> result = core.xread(keys, afterIds, count);
        if (!result.isEmpty()) {
            return StreamReplies.xread(result);
        }
        if (blocking) {
            park(afterIds);
            return null;
        }
        return RespArray.NULL;
    }

    private void park(final List<StreamEntryId> afterIds) {
        final WaitingReader reader = new WaitingReader(connection, keys, afterIds, count, blockMillis,
                redisContext.getRedisCore().currentTimeMillis());
        redisContext.getWaitingReaderRegistry().register(reader);
        log.debug("{} 阻塞读 {} 超时 {}ms", connection, keys, blockMillis);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
