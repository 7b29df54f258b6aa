package com.example.roomhub.server;

enum JoinOutcome {
    JOINED,
    ROOM_FULL,
    ALREADY_MEMBER,
    ROOM_CLOSED
}
