package com.example.roomhub.server.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs components on a fixed dispatcher pool. Each component's messages are processed strictly one
 * at a time and in send order per sender; different components run in parallel.
 */
public final class ActorSystem {
    private static final Logger log = LoggerFactory.getLogger(ActorSystem.class);

    public static final int DEFAULT_THROUGHPUT = 32;

    private final String name;
    private final ExecutorService dispatcher;
    private final ScheduledExecutorService scheduler;
    private final int throughput;
    private final Set<ActorCell<?>> live = ConcurrentHashMap.newKeySet();
    private volatile boolean shuttingDown;

    public ActorSystem(String name, int threads) {
        this(name, threads, DEFAULT_THROUGHPUT);
    }

    public ActorSystem(String name, int threads, int throughput) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (throughput < 1) throw new IllegalArgumentException("throughput must be >= 1");
        this.name = name;
        this.throughput = throughput;
        this.dispatcher = Executors.newFixedThreadPool(threads, daemonThreads(name + "-dispatcher-"));
        this.scheduler = newScheduler(daemonThreads(name + "-scheduler-"));
    }

    /** Deadlines are re-armed on every client message, so cancelled tasks must leave the queue at once. */
    static ScheduledThreadPoolExecutor newScheduler(ThreadFactory threads) {
        ScheduledThreadPoolExecutor s = new ScheduledThreadPoolExecutor(1, threads);
        s.setRemoveOnCancelPolicy(true);
        return s;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public String name() { return name; }

    /**
     * Creates a component. The factory runs on the component's own stream before any message,
     * so messages told to the returned handle right away are never lost.
     */
    public <M> ActorRef<M> spawn(String actorName, Supplier<? extends Actor<M>> factory) {
        if (shuttingDown) throw new IllegalStateException("actor system " + name + " is shutting down");
        ActorCell<M> cell = new ActorCell<>(this, actorName, factory);
        live.add(cell);
        cell.start();
        return cell;
    }

    /** Stops the component after the messages already in its mailbox. */
    public void stop(ActorRef<?> ref) {
        cell(ref).requestStop();
    }

    /** Completes when the component terminates; exceptionally if it failed. */
    public CompletableFuture<Void> terminationFuture(ActorRef<?> ref) {
        return cell(ref).termination();
    }

    public boolean isTerminated(ActorRef<?> ref) {
        return cell(ref).isTerminated();
    }

    public int liveCount() { return live.size(); }

    ScheduledExecutorService scheduler() { return scheduler; }

    int throughput() { return throughput; }

    void dispatch(ActorCell<?> cell) { dispatcher.execute(cell); }

    void unregister(ActorCell<?> cell) { live.remove(cell); }

    /**
     * Stops every live component and waits for them to terminate.
     *
     * @return {@code true} if all components terminated within the timeout
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        shuttingDown = true;
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (ActorCell<?> cell : live) {
            pending.add(cell.termination().exceptionally(t -> null));
            cell.requestStop();
        }
        boolean clean = true;
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            clean = false;
            log.warn("actor system {}: {} components still running after {}", name, live.size(), timeout);
        } catch (ExecutionException e) {
            log.warn("actor system {}: unexpected termination failure", name, e.getCause());
        }
        scheduler.shutdownNow();
        dispatcher.shutdown();
        if (!dispatcher.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            dispatcher.shutdownNow();
            clean = false;
        }
        log.info("actor system {} stopped", name);
        return clean;
    }

    private static ActorCell<?> cell(ActorRef<?> ref) {
        if (!(ref instanceof ActorCell)) throw new IllegalArgumentException("not a component handle: " + ref);
        return (ActorCell<?>) ref;
    }
}
