package site.rstream.replication;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.rstream.protocol.RdbPayload;
import site.rstream.protocol.RespArray;
import site.rstream.protocol.SimpleString;
import site.rstream.replication.host.ReplicationHost;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * 主节点复制协调器
 *
 * <p>负责全量同步、写命令传播以及基于 GETACK 的 WAIT。
 * 所有方法都在单个事件循环线程上调用，内部不加锁。
 *
 * @author rstream
 * @since 1.0.0
 */
@Slf4j
public class ReplicationCoordinator {

    private static final int REPL_ID_LENGTH = 40;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final ReplicationHost host;

    private final ScheduledExecutorService scheduler;

    @Getter
    private final String replId;

    /** 已传播到从节点的命令字节累计值 */
    @Getter
    private long masterOffset;

    private final Map<Integer, ReplicaInfo> replicas = new LinkedHashMap<>();

    /** REPLCONF listening-port 在 PSYNC 之前到达，先暂存 */
    private final Map<Integer, Integer> announcedPorts = new HashMap<>();

    private final List<PendingWait> pendingWaits = new ArrayList<>();

    public ReplicationCoordinator(final ReplicationHost host, final ScheduledExecutorService scheduler) {
        this(host, scheduler, generateReplId());
    }

    public ReplicationCoordinator(final ReplicationHost host, final ScheduledExecutorService scheduler,
                                  final String replId) {
        this.host = host;
        this.scheduler = scheduler;
        this.replId = replId;
    }

    static String generateReplId() {
        final SecureRandom random = new SecureRandom();
        final char[] id = new char[REPL_ID_LENGTH];
        for (int i = 0; i < id.length; i++) {
            id[i] = HEX[random.nextInt(HEX.length)];
        }
        return new String(id);
    }

    public void recordListeningPort(final int connectionId, final int port) {
        announcedPorts.put(connectionId, port);
    }

    /**
     * 执行全量同步：回复 FULLRESYNC，发送RDB快照，然后把连接登记为从节点
     *
     * @param connectionId 连接句柄
     * @param channel 从节点连接
     */
    public void fullResync(final int connectionId, final Channel channel) throws IOException {
        final byte[] snapshot = host.generateRdbSnapshot();
        final String header = "FULLRESYNC " + replId + " " + masterOffset;
        channel.write(new SimpleString(header));
        channel.writeAndFlush(new RdbPayload(snapshot));

        final int port = announcedPorts.getOrDefault(connectionId, -1);
        final ReplicaInfo replica = new ReplicaInfo(connectionId, channel, port, masterOffset);
        replicas.put(connectionId, replica);
        log.info("从节点 {} 完成全量同步，快照 {} 字节，当前从节点数: {}", replica, snapshot.length, replicas.size());
    }

    /**
     * 把写命令传播给所有从节点
     *
     * <p>命令只编码一次，主节点偏移量按编码长度增加。写失败的从节点会被移除。
     *
     * @return 传播后的主节点偏移量
     */
    public long propagate(final RespArray command) {
        final ByteBuf encoded = Unpooled.buffer(64);
        try {
            command.encode(command, encoded);
            final int length = encoded.readableBytes();
            masterOffset += length;
            log.debug("传播命令 {} 字节，主节点偏移量: {}", length, masterOffset);

            final Iterator<ReplicaInfo> it = replicas.values().iterator();
            while (it.hasNext()) {
                final ReplicaInfo replica = it.next();
                final Channel channel = replica.getChannel();
                if (!channel.isActive()) {
                    log.warn("从节点 {} 连接已关闭，移除", replica);
                    it.remove();
                    continue;
                }
                channel.writeAndFlush(encoded.retainedDuplicate()).addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.warn("向从节点 {} 写入失败，移除: {}", replica, future.cause() == null ? "" : future.cause().getMessage());
                        removeReplica(replica.getConnectionId());
                    }
                });
            }
        } finally {
            encoded.release();
        }
        return masterOffset;
    }

    /**
     * WAIT：等待至少 numReplicas 个从节点确认当前偏移量
     *
     * <p>不阻塞事件循环，结果通过 reply 回调交付，可能同步回调。
     *
     * @param waiterId 发起WAIT的连接句柄
     * @param numReplicas 期望确认的从节点数
     * @param timeoutMillis 超时时间，0表示一直等待
     * @param reply 结果回调，参数为已确认的从节点数
     */
    public void waitForAcknowledgments(final int waiterId, final int numReplicas, final long timeoutMillis,
                                       final IntConsumer reply) {
        if (replicas.isEmpty()) {
            reply.accept(0);
            return;
        }
        // 从未传播过写命令时所有从节点都视为已同步
        if (masterOffset == 0 || numReplicas <= 0) {
            reply.accept(replicas.size());
            return;
        }
        final long target = masterOffset;
        final int alreadyAcked = countAcknowledged(target);
        if (alreadyAcked >= numReplicas) {
            reply.accept(alreadyAcked);
            return;
        }

        final PendingWait wait = new PendingWait(waiterId, target, numReplicas, reply);
        pendingWaits.add(wait);
        propagate(RespArray.ofCommand("REPLCONF", "GETACK", "*"));
        if (timeoutMillis > 0) {
            wait.setTimeout(scheduler.schedule(() -> expire(wait), timeoutMillis, TimeUnit.MILLISECONDS));
        }
        log.debug("WAIT 等待 {} 个从节点确认偏移量 {}，超时 {}ms", numReplicas, target, timeoutMillis);
    }

    /**
     * 处理从节点的 REPLCONF ACK
     */
    public void onAck(final int connectionId, final long offset) {
        final ReplicaInfo replica = replicas.get(connectionId);
        if (replica == null) {
            log.warn("收到非从节点连接 #{} 的ACK，忽略", connectionId);
            return;
        }
        replica.setAckOffset(offset);
        log.debug("从节点 {} 确认偏移量 {}", replica, offset);

        final Iterator<PendingWait> it = pendingWaits.iterator();
        while (it.hasNext()) {
            final PendingWait wait = it.next();
            final int acknowledged = countAcknowledged(wait.getTargetOffset());
            if (acknowledged >= wait.getRequired()) {
                it.remove();
                log.info("WAIT 完成: {} 个从节点已确认偏移量 {}", acknowledged, wait.getTargetOffset());
                wait.complete(acknowledged);
            }
        }
    }

    private void expire(final PendingWait wait) {
        if (!pendingWaits.remove(wait)) {
            return;
        }
        final int acknowledged = countAcknowledged(wait.getTargetOffset());
        log.info("WAIT 超时: {}/{} 个从节点已确认偏移量 {}", acknowledged, wait.getRequired(), wait.getTargetOffset());
        wait.complete(acknowledged);
    }

    /**
     * 已确认当前主节点偏移量的从节点数，不发送 GETACK
     */
    public int acknowledgedReplicas() {
        if (masterOffset == 0) {
            return replicas.size();
        }
        return countAcknowledged(masterOffset);
    }

    private int countAcknowledged(final long target) {
        int count = 0;
        for (final ReplicaInfo replica : replicas.values()) {
            if (replica.acknowledgedMasterOffset() >= target) {
                count++;
            }
        }
        return count;
    }

    /**
     * 连接断开时清理：从节点登记、暂存的端口以及该连接发起的WAIT
     */
    public void onDisconnect(final int connectionId) {
        announcedPorts.remove(connectionId);
        removeReplica(connectionId);
        final Iterator<PendingWait> it = pendingWaits.iterator();
        while (it.hasNext()) {
            final PendingWait wait = it.next();
            if (wait.getWaiterId() == connectionId) {
                wait.cancel();
                it.remove();
            }
        }
    }

    public void removeReplica(final int connectionId) {
        final ReplicaInfo removed = replicas.remove(connectionId);
        if (removed != null) {
            log.info("从节点 {} 已移除，剩余从节点数: {}", removed, replicas.size());
        }
    }

    public boolean isReplica(final int connectionId) {
        return replicas.containsKey(connectionId);
    }

    public int replicaCount() {
        return replicas.size();
    }

    public Collection<ReplicaInfo> getReplicas() {
        return Collections.unmodifiableCollection(replicas.values());
    }

    int pendingWaitCount() {
        return pendingWaits.size();
    }
}
