package com.example.roomhub.server;

import com.example.roomhub.common.FrameTooLargeException;
import com.example.roomhub.common.Frames;
import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.actor.ActorSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * TCP listener. Spawns a {@link PlayerSession} per connection and runs a blocking read loop for it.
 * <p>
 * The read loop only turns frames into {@link SessionMessage}s; it never touches session state.
 */
final class ConnectionAcceptor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionAcceptor.class);

    static final String SHUTDOWN_REASON = "Server shutdown";
    static final String TOO_LARGE_REASON = "Message too large";

    private final ServerConfig config;
    private final ActorSystem system;
    private final SessionServices services;

    private final ExecutorService readers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "conn-reader");
        t.setDaemon(true);
        return t;
    });
    private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ServerSocket server;
    private Thread acceptThread;

    ConnectionAcceptor(ServerConfig config, ActorSystem system, SessionServices services) {
        this.config = config;
        this.system = system;
        this.services = services;
    }

    void start() throws IOException {
        server = new ServerSocket();
        server.setReuseAddress(true);
        server.bind(new InetSocketAddress(config.host, config.port));
        running = true;

        acceptThread = new Thread(this::acceptLoop, "tcp-acceptor");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Listening on {}:{}", config.host, localPort());
    }

    int localPort() { return server.getLocalPort(); }

    private void acceptLoop() {
        while (running) {
            Socket s;
            try {
                s = server.accept();
            } catch (IOException e) {
                if (running) log.error("accept failed", e);
                else break;
                continue;
            }
            try {
                handle(s);
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping connection from {}: {}", s.getRemoteSocketAddress(), e.toString());
                try {
                    s.close();
                } catch (IOException ce) {
                    log.debug("close after failed accept: {}", ce.getMessage());
                }
            }
        }
        log.info("Acceptor stopped");
    }

    /** Throws if the connection cannot be set up; the caller closes the socket. */
    void handle(Socket socket) throws IOException {
        socket.setTcpNoDelay(true);
        String id = Ids.sessionId();
        ActorRef<SessionMessage> session = system.spawn("session-" + id, () -> new PlayerSession(id, services));
        SocketClientChannel channel;
        try {
            channel = new SocketClientChannel(id, socket, services.ioExecutor(), session);
        } catch (IOException e) {
            // without Connected the session has no deadline and would never end on its own
            system.stop(session);
            throw e;
        }
        sockets.add(socket);
        session.tell(new SessionMessage.Connected(channel));
        readers.execute(() -> readLoop(id, socket, session));
    }

    private void readLoop(String id, Socket socket, ActorRef<SessionMessage> session) {
        Thread.currentThread().setName("conn-reader-" + id);
        String reason;
        try {
            // the socket itself is closed by the session's channel, not here
            InputStream in = new BufferedInputStream(socket.getInputStream());
            while (true) {
                byte[] frame = Frames.read(in, config.maxFrameBytes);
                if (frame == null) {
                    reason = running ? "Connection closed by client" : SHUTDOWN_REASON;
                    break;
                }
                if (frame.length == 0) continue;
                if (!session.tell(new SessionMessage.ClientMessage(frame))) {
                    reason = "Session ended";
                    break;
                }
            }
        } catch (FrameTooLargeException e) {
            log.warn("Session {}: {}", id, e.getMessage());
            reason = TOO_LARGE_REASON;
        } catch (IOException e) {
            reason = running ? "Read error: " + e.getMessage() : SHUTDOWN_REASON;
        } finally {
            sockets.remove(socket);
            Thread.currentThread().setName("conn-reader");
        }
        session.tell(new SessionMessage.Disconnected(reason));
        log.debug("Session {} reader exited: {}", id, reason);
    }

    /**
     * Stops accepting, wakes every read loop with EOF and waits for them to finish.
     *
     * @return {@code true} if all readers exited within the timeout
     */
    boolean shutdown(Duration timeout) throws InterruptedException {
        running = false;
        try {
            if (server != null) server.close();
        } catch (IOException e) {
            log.warn("closing listener failed: {}", e.getMessage());
        }
        for (Socket s : sockets) {
            try {
                s.shutdownInput();
            } catch (IOException e) {
                log.debug("shutdownInput failed for {}: {}", s.getRemoteSocketAddress(), e.getMessage());
            }
        }
        readers.shutdown();
        boolean done = readers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!done) log.warn("{} connection readers still running after {}", sockets.size(), timeout);
        if (acceptThread != null) acceptThread.join(timeout.toMillis());
        return done;
    }
}
