package com.example.roomhub.server.ledger;

/** Unsigned transaction returned to the client for signing. */
public record PreparedTransaction(String txBytes, String module, String function, long gasBudget) {}
