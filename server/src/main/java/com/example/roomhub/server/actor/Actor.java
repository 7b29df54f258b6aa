package com.example.roomhub.server.actor;

/**
 * Base class for a component that owns private state and processes one message at a time.
 * <p>
 * All callbacks run on the component's own sequential stream, so subclasses need no locking.
 */
public abstract class Actor<M> {
    private ActorContext<M> context;

    final void bind(ActorContext<M> context) { this.context = context; }

    protected final ActorContext<M> context() { return context; }

    protected final ActorRef<M> self() { return context.self(); }

    protected void preStart() throws Exception {}

    protected abstract void receive(M message) throws Exception;

    /** Runs once on every termination path, including failures in {@link #receive}. */
    protected void postStop() {}

    /** Called for each message still queued, or arriving, after termination. */
    protected void onUndelivered(M message) {}
}
