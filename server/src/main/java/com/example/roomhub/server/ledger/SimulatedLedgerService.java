package com.example.roomhub.server.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Builds deterministic placeholder transactions. Used until a real ledger client is wired in.
 */
public final class SimulatedLedgerService implements LedgerService {
    private static final Logger log = LoggerFactory.getLogger(SimulatedLedgerService.class);

    private final Executor executor;
    private final String module;
    private final String function;
    private final long gasBudget;

    public SimulatedLedgerService(Executor executor, String module, String function, long gasBudget) {
        this.executor = executor;
        this.module = module;
        this.function = function;
        this.gasBudget = gasBudget;
    }

    @Override
    public CompletableFuture<PreparedTransaction> prepare(ActionDescriptor action) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return build(action);
            } catch (LedgerException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    PreparedTransaction build(ActionDescriptor action) throws LedgerException {
        if (action.playerId() == null || action.playerId().isBlank()) throw new LedgerException("player id is required");
        if (action.actionName() == null || action.actionName().isBlank()) throw new LedgerException("action name is required");

        String tx = "SIMULATED_TX_BYTES_FOR_" + action.playerId() + "_ACTION_" + action.actionName();
        log.debug("prepared {}::{} for {} ({} params)", module, function, action.playerId(), action.params().size());
        return new PreparedTransaction(tx, module, function, gasBudget);
    }
}
