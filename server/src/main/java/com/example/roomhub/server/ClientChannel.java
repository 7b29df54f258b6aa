package com.example.roomhub.server;

/**
 * Outbound half of a client connection, owned by exactly one session.
 * Neither method blocks on the network.
 */
interface ClientChannel {

    String remoteAddress();

    /** Queues one frame body. Silently dropped once the channel is closed. */
    void send(byte[] payload);

    /** Flushes what is already queued, then closes the connection. Idempotent. */
    void close();
}
