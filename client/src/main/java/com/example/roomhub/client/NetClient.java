package com.example.roomhub.client;

import com.example.roomhub.common.Frames;
import com.example.roomhub.common.Net;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Framed connection to a room server with a background reader thread. */
final class NetClient {
    private static final Logger log = LoggerFactory.getLogger(NetClient.class);

    private final String host;
    private final int port;
    private Socket socket;
    private InputStream in;
    private OutputStream out;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread readerThread;

    private BiConsumer<String, JsonNode> onMessage = (t, n) -> {};
    private Consumer<String> onClose = reason -> {};

    NetClient(String host, int port) {
        this.host = host;
        this.port = port;
    }

    void setOnMessage(BiConsumer<String, JsonNode> onMessage) { this.onMessage = onMessage; }
    void setOnClose(Consumer<String> onClose) { this.onClose = onClose; }

    boolean isConnected() { return running.get(); }

    void connect() throws IOException {
        if (running.get()) return;
        socket = new Socket(host, port);
        socket.setKeepAlive(true);
        socket.setTcpNoDelay(true);
        in = new BufferedInputStream(socket.getInputStream());
        out = new BufferedOutputStream(socket.getOutputStream());
        running.set(true);
        log.debug("connected to {}:{}", host, port);

        readerThread = new Thread(this::readLoop, "net-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    void close() {
        close("closed");
    }

    private void close(String reason) {
        if (!running.compareAndSet(true, false)) return;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("close failed: {}", e.getMessage());
        }
        onClose.accept(reason);
    }

    void send(String type, Object payload) {
        if (!running.get()) return;
        try {
            byte[] body = Net.envelope(type, payload);
            synchronized (out) {
                Frames.write(out, body);
                out.flush();
            }
        } catch (IOException e) {
            log.debug("send {} failed: {}", type, e.getMessage());
            close("write failed: " + e.getMessage());
        }
    }

    private void readLoop() {
        String reason = "server closed the connection";
        try {
            byte[] frame;
            while (running.get() && (frame = Frames.read(in)) != null) {
                if (frame.length == 0) continue;
                JsonNode n = Net.MAPPER.readTree(frame);
                onMessage.accept(n.path("type").asText(""), n.path("payload"));
            }
        } catch (IOException e) {
            if (running.get()) reason = "read failed: " + e.getMessage();
        } finally {
            close(reason);
        }
    }
}
