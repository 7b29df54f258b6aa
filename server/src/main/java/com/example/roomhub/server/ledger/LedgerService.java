package com.example.roomhub.server.ledger;

import java.util.concurrent.CompletableFuture;

/**
 * Economy/ledger collaborator. Results are always asynchronous; a failed future carries a
 * {@link LedgerException}.
 */
public interface LedgerService {

    CompletableFuture<PreparedTransaction> prepare(ActionDescriptor action);
}
