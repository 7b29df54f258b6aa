package com.example.roomhub.server.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Mailbox plus dispatch state of one component. The {@code scheduled} flag guarantees that at most
 * one dispatcher thread drains the mailbox at a time.
 */
final class ActorCell<M> implements ActorRef<M>, Runnable {
    private static final Logger log = LoggerFactory.getLogger(ActorCell.class);

    private enum Signal { START, STOP }

    private final ActorSystem system;
    private final String name;
    private final Supplier<? extends Actor<M>> factory;
    private final ConcurrentLinkedQueue<Object> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private final List<Runnable> watchers = new ArrayList<>();
    private boolean ended; // guarded by watchers

    private final ActorContext<M> context;
    private Actor<M> actor;
    private volatile boolean terminated;

    ActorCell(ActorSystem system, String name, Supplier<? extends Actor<M>> factory) {
        this.system = system;
        this.name = name;
        this.factory = factory;
        this.context = new ActorContext<>(this);
    }

    @Override public String name() { return name; }

    ActorSystem system() { return system; }

    CompletableFuture<Void> termination() { return termination; }

    boolean isTerminated() { return terminated; }

    void start() { enqueue(Signal.START); }

    void requestStop() { enqueue(Signal.STOP); }

    @Override
    public boolean tell(M message) {
        Objects.requireNonNull(message, "message");
        if (terminated) return false;
        enqueue(message);
        return true;
    }

    private void enqueue(Object o) {
        mailbox.offer(o);
        schedule();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) return;
        try {
            system.dispatch(this);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            log.debug("{} not scheduled, dispatcher is shut down ({} queued)", name, mailbox.size());
        }
    }

    @Override
    public void run() {
        try {
            int budget = system.throughput();
            Object next;
            while (budget-- > 0 && (next = mailbox.poll()) != null) {
                if (terminated) undelivered(next);
                else process(next);
            }
        } finally {
            scheduled.set(false);
            if (!mailbox.isEmpty()) schedule();
        }
    }

    @SuppressWarnings("unchecked")
    private void process(Object next) {
        if (next == Signal.START) {
            try {
                actor = factory.get();
                actor.bind(context);
                actor.preStart();
            } catch (Throwable t) {
                log.error("{} failed to start", name, t);
                terminate(t);
                return;
            }
        } else if (next == Signal.STOP) {
            terminate(null);
            return;
        } else {
            try {
                actor.receive((M) next);
            } catch (Throwable t) {
                log.error("{} failed while handling {}", name, next.getClass().getSimpleName(), t);
                terminate(t);
                return;
            }
        }
        if (context.stopRequested()) terminate(null);
    }

    private void terminate(Throwable cause) {
        terminated = true;
        context.release();
        if (actor != null) {
            try {
                actor.postStop();
            } catch (Throwable t) {
                log.warn("{} postStop failed", name, t);
            }
        }

        Object next;
        while ((next = mailbox.poll()) != null) undelivered(next);

        List<Runnable> toNotify;
        synchronized (watchers) {
            ended = true;
            toNotify = new ArrayList<>(watchers);
            watchers.clear();
        }
        for (Runnable r : toNotify) r.run();

        system.unregister(this);
        if (cause == null) termination.complete(null);
        else termination.completeExceptionally(cause);
        log.debug("{} terminated", name);
    }

    @SuppressWarnings("unchecked")
    private void undelivered(Object next) {
        if (next instanceof Signal || actor == null) return;
        try {
            actor.onUndelivered((M) next);
        } catch (Throwable t) {
            log.warn("{} onUndelivered failed for {}", name, next.getClass().getSimpleName(), t);
        }
    }

    /** @return {@code false} if this component has already ended; the caller then notifies itself */
    boolean addWatcher(Runnable r) {
        synchronized (watchers) {
            if (ended) return false;
            watchers.add(r);
            return true;
        }
    }

    void removeWatcher(Runnable r) {
        synchronized (watchers) {
            watchers.remove(r);
        }
    }

    @Override
    public String toString() { return "ActorRef[" + name + "]"; }
}
