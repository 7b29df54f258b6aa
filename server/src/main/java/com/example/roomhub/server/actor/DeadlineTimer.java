package com.example.roomhub.server.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongFunction;

/**
 * Re-armable single-shot timer owned by one component.
 * <p>
 * Expiry does not call back into the owner. It enqueues {@code expiryMessage(generation)} and the
 * owner confirms it with {@link #expire(long)} on its own stream. Every arm or cancel bumps the
 * generation, so an expiry that was already in flight is rejected.
 */
public final class DeadlineTimer<M> {
    private static final Logger log = LoggerFactory.getLogger(DeadlineTimer.class);

    private final ScheduledExecutorService scheduler;
    private final ActorRef<M> owner;
    private final LongFunction<? extends M> expiryMessage;

    private long generation;
    private boolean armed;
    private ScheduledFuture<?> pending;

    DeadlineTimer(ScheduledExecutorService scheduler, ActorRef<M> owner, LongFunction<? extends M> expiryMessage) {
        this.scheduler = scheduler;
        this.owner = owner;
        this.expiryMessage = expiryMessage;
    }

    public void arm(Duration timeout) {
        cancel();
        final long gen = generation;
        try {
            pending = scheduler.schedule(() -> owner.tell(expiryMessage.apply(gen)), timeout.toMillis(), TimeUnit.MILLISECONDS);
            armed = true;
        } catch (RejectedExecutionException e) {
            log.debug("{} timer not armed, scheduler is shut down", owner.name());
        }
    }

    public void cancel() {
        generation++;
        armed = false;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    /**
     * @return {@code true} if {@code gen} is the live arming; the timer is then disarmed
     */
    public boolean expire(long gen) {
        if (!armed || gen != generation) return false;
        armed = false;
        pending = null;
        return true;
    }

    public boolean isArmed() { return armed; }

    public long generation() { return generation; }
}
