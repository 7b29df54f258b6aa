package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.actor.ActorSystem;
import com.example.roomhub.server.ledger.SimulatedLedgerService;
import com.example.roomhub.server.store.InMemoryPlayerStore;
import com.example.roomhub.server.store.JdbcPlayerStore;
import com.example.roomhub.server.store.PlayerStore;
import com.example.roomhub.server.store.PlayerStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bootstrap: builds the configuration, the registries and the acceptor, and owns shutdown.
 * <p>
 * Usage: {@code ServerMain [config.json]}; the path may also come from {@code ROOMHUB_CONFIG}.
 */
public final class ServerMain {
    private static final Logger log = LoggerFactory.getLogger(ServerMain.class);

    private final ServerConfig config;
    private final PlayerStore playerStore;

    private ActorSystem system;
    private ExecutorService io;
    private ActorRef<RegistryMessage> roomRegistry;
    private ActorRef<WorldMessage> worldRegistry;
    private ConnectionAcceptor acceptor;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CompletableFuture<Boolean> stopped = new CompletableFuture<>();
    private volatile boolean failed;

    public static void main(String[] args) throws Exception {
        String path = args.length >= 1 ? args[0] : System.getenv("ROOMHUB_CONFIG");
        ServerConfig config = ServerConfig.load(path, System::getenv);
        if (config.auth.tokens.isEmpty()) log.warn("No auth tokens configured; every AUTH will be rejected");

        ServerMain s = new ServerMain(config, createStore(config));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> s.stop("Server shutdown"), "shutdown-hook"));
        s.start();

        boolean fatal = s.awaitStopped();
        if (fatal) System.exit(1);
    }

    ServerMain(ServerConfig config, PlayerStore playerStore) {
        this.config = config;
        this.playerStore = playerStore;
    }

    static PlayerStore createStore(ServerConfig config) throws PlayerStoreException {
        if (!config.hasDatabase()) {
            log.info("No database configured, player data is kept in memory");
            return new InMemoryPlayerStore();
        }
        JdbcPlayerStore store = new JdbcPlayerStore(config.db.url, config.db.user, config.db.pass);
        store.init();
        return store;
    }

    void start() throws IOException, InterruptedException {
        system = new ActorSystem("roomhub", config.dispatcherThreads);
        io = Executors.newCachedThreadPool(daemonThreads("io-"));

        worldRegistry = system.spawn("world-registry", WorldRegistry::new);
        roomRegistry = system.spawn("room-registry", () -> new RoomRegistry(config));
        failFast(worldRegistry);
        failFast(roomRegistry);

        createDefaultRoom();

        SessionServices services = new SessionServices(
                config,
                roomRegistry,
                worldRegistry,
                new TokenAuthenticator(config.auth.tokens),
                playerStore,
                new SimulatedLedgerService(io, config.ledger.module, config.ledger.function, config.ledger.gasBudget),
                io);

        acceptor = new ConnectionAcceptor(config, system, services);
        acceptor.start();
    }

    private void createDefaultRoom() throws InterruptedException {
        ServerConfig.DefaultRoom dr = config.defaultRoom;
        CompletableFuture<CreateRoomResult> reply = new CompletableFuture<>();
        roomRegistry.tell(new RegistryMessage.CreateRoom(new RoomSpec(dr.id, dr.name, dr.capacity, true), reply));
        try {
            CreateRoomResult r = reply.get(5, TimeUnit.SECONDS);
            if (!r.created()) throw new IllegalStateException("default room not created: " + r.error());
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("default room not created", e);
        }
    }

    /** A registry holds process-wide state; losing one takes the server down. */
    private void failFast(ActorRef<?> registry) {
        system.terminationFuture(registry).whenComplete((v, err) -> {
            if (stopping.get()) return;
            failed = true;
            log.error("{} terminated unexpectedly, shutting down", registry.name(), err);
            Thread t = new Thread(() -> stop("Internal server error"), "fatal-shutdown");
            t.setDaemon(true);
            t.start();
        });
    }

    int port() { return acceptor.localPort(); }

    ActorSystem system() { return system; }

    ActorRef<RegistryMessage> roomRegistry() { return roomRegistry; }

    ActorRef<WorldMessage> worldRegistry() { return worldRegistry; }

    /** Blocks until {@link #stop} has finished. @return {@code true} if a registry failure caused the stop */
    boolean awaitStopped() throws InterruptedException {
        try {
            stopped.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
        return failed;
    }

    void stop(String reason) {
        if (!stopping.compareAndSet(false, true)) return;
        log.info("Stopping server: {}", reason);
        try {
            if (acceptor != null) acceptor.shutdown(config.shutdownTimeout());
            if (system != null) system.shutdown(config.shutdownTimeout());
            if (io != null) {
                io.shutdown();
                if (!io.awaitTermination(config.shutdownTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("I/O tasks still running after {} ms", config.shutdownTimeoutMillis);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping");
        } finally {
            stopped.complete(failed);
            log.info("Server stopped");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
