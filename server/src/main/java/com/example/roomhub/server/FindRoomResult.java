package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;

record FindRoomResult(Outcome outcome, String roomId, ActorRef<RoomMessage> room) {

    enum Outcome { FOUND, FULL, NOT_FOUND }

    static FindRoomResult found(String roomId, ActorRef<RoomMessage> room) { return new FindRoomResult(Outcome.FOUND, roomId, room); }
    static FindRoomResult full(String roomId) { return new FindRoomResult(Outcome.FULL, roomId, null); }
    static FindRoomResult notFound(String roomId) { return new FindRoomResult(Outcome.NOT_FOUND, roomId, null); }
}
