package site.rstream.replication;

import lombok.Getter;

import java.util.concurrent.ScheduledFuture;
import java.util.function.IntConsumer;

/**
 * 一次尚未完成的 WAIT
 */
@Getter
class PendingWait {

    private final int waiterId;

    private final long targetOffset;

    private final int required;

    private final IntConsumer reply;

    private ScheduledFuture<?> timeout;

    private boolean done;

    PendingWait(final int waiterId, final long targetOffset, final int required, final IntConsumer reply) {
        this.waiterId = waiterId;
        this.targetOffset = targetOffset;
        this.required = required;
        this.reply = reply;
    }

    void setTimeout(final ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    /**
     * 以给定数量完成，只生效一次
     */
    void complete(final int acknowledged) {
        if (done) {
            return;
        }
        done = true;
        if (timeout != null) {
            timeout.cancel(false);
        }
        reply.accept(acknowledged);
    }

    void cancel() {
        done = true;
        if (timeout != null) {
            timeout.cancel(false);
        }
    }
}
