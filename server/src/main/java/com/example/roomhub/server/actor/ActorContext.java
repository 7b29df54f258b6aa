package com.example.roomhub.server.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * Per-component view of the runtime. Only used from the owning component's own stream.
 */
public final class ActorContext<M> {
    private static final Logger log = LoggerFactory.getLogger(ActorContext.class);

    private final ActorCell<M> cell;
    private final Map<ActorRef<?>, Runnable> watching = new ConcurrentHashMap<>();
    private final List<DeadlineTimer<M>> timers = new ArrayList<>();
    private boolean stopRequested;

    ActorContext(ActorCell<M> cell) {
        this.cell = cell;
    }

    public ActorRef<M> self() { return cell; }

    public ActorSystem system() { return cell.system(); }

    /** Terminates this component once the current message has been handled. */
    public void stop() { stopRequested = true; }

    boolean stopRequested() { return stopRequested; }

    /**
     * Subscribes to the termination of {@code target}. The event is delivered once, through this
     * component's mailbox; immediately if the target has already ended. Handles not created by an
     * {@link ActorSystem} never end.
     */
    public void watch(ActorRef<?> target, Supplier<? extends M> endedMessage) {
        if (!(target instanceof ActorCell)) {
            log.debug("{} cannot watch foreign handle {}", cell.name(), target.name());
            return;
        }
        ActorCell<?> other = (ActorCell<?>) target;
        Watch notify = new Watch(target, endedMessage);

        Runnable previous = watching.put(target, notify);
        if (previous != null) other.removeWatcher(previous);
        if (!other.addWatcher(notify)) notify.run();
    }

    /** One-shot subscription; firing it also forgets the target. */
    private final class Watch implements Runnable {
        private final ActorRef<?> target;
        private final Supplier<? extends M> endedMessage;

        Watch(ActorRef<?> target, Supplier<? extends M> endedMessage) {
            this.target = target;
            this.endedMessage = endedMessage;
        }

        @Override
        public void run() {
            // runs on the target's thread; losing the race to unwatch means no event
            if (watching.remove(target, this)) cell.tell(endedMessage.get());
        }
    }

    /** Number of targets still being watched. */
    int watchCount() { return watching.size(); }

    public void unwatch(ActorRef<?> target) {
        Runnable notify = watching.remove(target);
        if (notify != null && target instanceof ActorCell) ((ActorCell<?>) target).removeWatcher(notify);
    }

    /** Creates a timer whose expiry arrives in this component's mailbox as {@code expiryMessage(generation)}. */
    public DeadlineTimer<M> newDeadlineTimer(LongFunction<? extends M> expiryMessage) {
        DeadlineTimer<M> t = new DeadlineTimer<>(cell.system().scheduler(), cell, expiryMessage);
        timers.add(t);
        return t;
    }

    void release() {
        for (DeadlineTimer<M> t : timers) t.cancel();
        timers.clear();
        for (Map.Entry<ActorRef<?>, Runnable> e : watching.entrySet()) {
            if (e.getKey() instanceof ActorCell) ((ActorCell<?>) e.getKey()).removeWatcher(e.getValue());
        }
        watching.clear();
    }
}
