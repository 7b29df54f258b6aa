package com.example.roomhub.server.actor;

/**
 * Opaque address of a component. Handles compare by identity.
 *
 * @param <M> the closed message type the component accepts
 */
public interface ActorRef<M> {

    String name();

    /**
     * Enqueues a message without blocking.
     *
     * @return {@code false} once the target has terminated
     */
    boolean tell(M message);
}
