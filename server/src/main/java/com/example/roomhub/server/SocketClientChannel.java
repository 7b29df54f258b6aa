package com.example.roomhub.server;

import com.example.roomhub.common.Frames;
import com.example.roomhub.server.actor.ActorRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Socket writer for one session. Frames are queued and written by a single drain task on the I/O
 * executor. A failed write is reported to the session as {@link SessionMessage.Disconnected}.
 */
final class SocketClientChannel implements ClientChannel {
    private static final Logger log = LoggerFactory.getLogger(SocketClientChannel.class);

    private final String sessionId;
    private final Socket socket;
    private final OutputStream out;
    private final Executor io;
    private final ActorRef<SessionMessage> session;

    private final ConcurrentLinkedQueue<byte[]> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean closeRequested;

    SocketClientChannel(String sessionId, Socket socket, Executor io, ActorRef<SessionMessage> session) throws IOException {
        this.sessionId = sessionId;
        this.socket = socket;
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.io = io;
        this.session = session;
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void send(byte[] payload) {
        if (closeRequested || closed.get()) return;
        outbound.offer(payload);
        scheduleDrain();
    }

    @Override
    public void close() {
        closeRequested = true;
        scheduleDrain();
    }

    boolean isClosed() { return closed.get(); }

    private void scheduleDrain() {
        if (closed.get() || !draining.compareAndSet(false, true)) return;
        try {
            io.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.debug("session {}: I/O executor gone, closing without flush", sessionId);
            closeNow();
        }
    }

    private void drain() {
        try {
            byte[] next;
            while ((next = outbound.poll()) != null) Frames.write(out, next);
            out.flush();
            if (closeRequested) closeNow();
        } catch (IOException e) {
            outbound.clear();
            if (!closed.get()) {
                log.debug("session {}: write failed: {}", sessionId, e.getMessage());
                session.tell(new SessionMessage.Disconnected("write failed"));
            }
            closeNow();
        } finally {
            draining.set(false);
            if (!closed.get() && (!outbound.isEmpty() || closeRequested)) scheduleDrain();
        }
    }

    private void closeNow() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("session {}: close failed: {}", sessionId, e.getMessage());
        }
    }
}
