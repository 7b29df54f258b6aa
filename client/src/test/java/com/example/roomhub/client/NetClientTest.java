package com.example.roomhub.client;

import com.example.roomhub.common.Frames;
import com.example.roomhub.common.Messages;
import com.example.roomhub.common.Net;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/** Client connection against a bare framed server socket. */
public class NetClientTest {

    private ServerSocket listener;
    private NetClient client;
    private final BlockingQueue<JsonNode> received = new LinkedBlockingQueue<>();
    private final CompletableFuture<String> closed = new CompletableFuture<>();

    @BeforeEach
    public void setup() throws Exception {
        listener = new ServerSocket(0);
        listener.setSoTimeout(5_000);
        client = new NetClient("127.0.0.1", listener.getLocalPort());
        client.setOnMessage((type, payload) -> received.add(Net.MAPPER.createObjectNode().put("type", type).set("payload", payload)));
        client.setOnClose(closed::complete);
    }

    @AfterEach
    public void teardown() throws Exception {
        client.close();
        listener.close();
    }

    @Test
    public void testExchange() throws Exception {
        client.connect();
        try (Socket server = listener.accept()) {
            InputStream in = new BufferedInputStream(server.getInputStream());
            OutputStream out = server.getOutputStream();

            client.send(Messages.AUTH, new Messages.Auth("tok"));
            JsonNode auth = Net.MAPPER.readTree(Frames.read(in));
            assertEquals("AUTH", auth.path("type").asText());
            assertEquals("tok", auth.path("payload").path("token").asText());

            Frames.write(out, Net.envelope(Messages.SIMPLE_MESSAGE, new Messages.SimpleMessage("hi")));
            out.flush();
            JsonNode got = received.poll(3, TimeUnit.SECONDS);
            assertNotNull(got);
            assertEquals(Messages.SIMPLE_MESSAGE, got.path("type").asText());
            assertEquals("hi", got.path("payload").path("message").asText());
        }
        assertEquals("server closed the connection", closed.get(3, TimeUnit.SECONDS));
        assertFalse(client.isConnected());
    }

    @Test
    public void testSendAfterCloseIsIgnored() throws Exception {
        client.connect();
        listener.accept().close();
        closed.get(3, TimeUnit.SECONDS);
        client.send(Messages.PING, new Messages.Ping(1L, null));
        assertFalse(client.isConnected());
    }
}
