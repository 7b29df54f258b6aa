package com.example.roomhub.server;

import com.example.roomhub.common.Net;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/** In-memory {@link ClientChannel} that decodes and keeps every envelope a session sends. */
final class RecordingChannel implements ClientChannel {
    private final BlockingQueue<JsonNode> sent = new LinkedBlockingQueue<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    @Override public String remoteAddress() { return "recording"; }

    @Override
    public void send(byte[] payload) {
        if (isClosed()) return;
        try {
            sent.add(Net.MAPPER.readTree(payload));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() { closed.countDown(); }

    boolean isClosed() { return closed.getCount() == 0; }

    boolean awaitClosed(Duration wait) throws InterruptedException {
        return closed.await(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    JsonNode next() throws InterruptedException {
        JsonNode n = sent.poll(TestProbe.DEFAULT_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        assertNotNull(n, "no envelope within " + TestProbe.DEFAULT_WAIT);
        return n;
    }

    /** @return the payload of the next envelope, which must carry {@code type} */
    JsonNode expect(String type) throws InterruptedException {
        JsonNode n = next();
        assertEquals(type, n.path("type").asText(), "unexpected envelope " + n);
        return n.path("payload");
    }

    /** @return the payload of the next {@code ERROR}, which must carry {@code code} */
    JsonNode expectError(String code) throws InterruptedException {
        JsonNode p = expect("ERROR");
        assertEquals(code, p.path("code").asText(), "unexpected error " + p);
        return p;
    }

    /** Skips other envelopes until one of {@code type} arrives. */
    JsonNode fishFor(String type) throws InterruptedException {
        long deadline = System.nanoTime() + TestProbe.DEFAULT_WAIT.toNanos();
        while (true) {
            JsonNode n = sent.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            assertNotNull(n, "no " + type + " within " + TestProbe.DEFAULT_WAIT);
            if (type.equals(n.path("type").asText())) return n.path("payload");
        }
    }

    void expectNothing(Duration wait) throws InterruptedException {
        JsonNode n = sent.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
        assertNull(n, "expected no envelope but got " + n);
    }
}
