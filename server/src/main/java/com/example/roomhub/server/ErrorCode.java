package com.example.roomhub.server;

/** Codes sent in {@code ERROR{code, message}} and in failed responses. */
enum ErrorCode {
    INVALID_JSON(Category.PROTOCOL),
    UNKNOWN_COMMAND(Category.PROTOCOL),
    UNKNOWN_ACTION_TYPE(Category.PROTOCOL),
    INVALID_ACTION(Category.PROTOCOL),
    EMPTY_CHAT_MESSAGE(Category.PROTOCOL),
    CHAT_TOO_LONG(Category.PROTOCOL),
    CHAT_RATE_LIMIT(Category.PROTOCOL),
    JOIN_IN_PROGRESS(Category.PROTOCOL),

    NOT_AUTHENTICATED(Category.AUTH),
    ALREADY_AUTHENTICATED(Category.AUTH),
    AUTH_ATTEMPTS_EXCEEDED(Category.AUTH),

    ROOM_FULL(Category.CAPACITY),
    ALREADY_IN_ROOM(Category.CAPACITY),
    ROOM_ALREADY_EXISTS(Category.CAPACITY),

    ROOM_NOT_FOUND(Category.NOT_FOUND),
    NOT_IN_A_ROOM(Category.NOT_FOUND),
    ROOM_CLOSED(Category.NOT_FOUND),

    TIMEOUT(Category.TIMEOUT),

    INTERNAL_SERVER_ERROR(Category.INTERNAL);

    /** Error classes; only INTERNAL points at a server-side fault. */
    enum Category { PROTOCOL, AUTH, CAPACITY, NOT_FOUND, TIMEOUT, INTERNAL }

    final Category category;

    ErrorCode(Category category) { this.category = category; }
}
