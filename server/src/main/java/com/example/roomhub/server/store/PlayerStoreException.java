package com.example.roomhub.server.store;

public class PlayerStoreException extends Exception {
    public PlayerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
