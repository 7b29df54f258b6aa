package com.example.roomhub.server;

import com.example.roomhub.server.actor.ActorRef;

record CreateRoomResult(boolean created, RoomSummary room, ActorRef<RoomMessage> ref, String error) {

    static CreateRoomResult created(RoomSummary room, ActorRef<RoomMessage> ref) { return new CreateRoomResult(true, room, ref, null); }
    static CreateRoomResult alreadyExists(String roomId) {
        return new CreateRoomResult(false, null, null, "Room with ID '" + roomId + "' already exists");
    }
}
