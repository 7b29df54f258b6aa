package com.example.roomhub.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared DTOs for the length-prefixed JSON protocol. */
public final class Messages {
    private Messages() {}

    // ---- client -> server tags ----
    public static final String AUTH = "AUTH";
    public static final String JOIN_ROOM = "JOIN_ROOM";
    public static final String SEND_CHAT = "SEND_CHAT";
    public static final String PING = "PING";
    public static final String PLAYER_ACTION = "PLAYER_ACTION";
    public static final String CREATE_ROOM = "CREATE_ROOM";
    public static final String LIST_ROOMS = "LIST_ROOMS";
    public static final String LEAVE_ROOM = "LEAVE_ROOM";

    // ---- server -> client tags ----
    public static final String AUTH_RESPONSE = "AUTH_RESPONSE";
    public static final String JOIN_ROOM_RESPONSE = "JOIN_ROOM_RESPONSE";
    public static final String NEW_CHAT_MESSAGE = "NEW_CHAT_MESSAGE";
    public static final String PONG = "PONG";
    public static final String PLAYER_ACTION_RESPONSE = "PLAYER_ACTION_RESPONSE";
    public static final String ERROR = "ERROR";
    public static final String SIMPLE_MESSAGE = "SIMPLE_MESSAGE";
    public static final String CREATE_ROOM_RESPONSE = "CREATE_ROOM_RESPONSE";
    public static final String ROOM_LIST = "ROOM_LIST";
    public static final String LEAVE_ROOM_RESPONSE = "LEAVE_ROOM_RESPONSE";
    public static final String PLAYER_JOINED = "PLAYER_JOINED";
    public static final String PLAYER_LEFT = "PLAYER_LEFT";

    // ---- PLAYER_ACTION action types ----
    public static final String ACTION_GET_PLAYER_PROFILE = "GET_PLAYER_PROFILE";
    public static final String ACTION_PERFORM_INGAME = "PERFORM_INGAME_ACTION";

    /** Criteria value that matches any room with spare capacity. */
    public static final String ANY_ROOM = "*";

    public static final class Envelope {
        public String type;
        public JsonNode payload;
        public Envelope(String type, JsonNode payload) { this.type = type; this.payload = payload; }
        public Envelope() {}
    }

    // ---- client -> server ----
    public static final class Auth {
        public String token;
        public Auth(String token) { this.token = token; }
        public Auth() {}
    }

    public static final class JoinRoom {
        public String criteria;
        public JoinRoom(String criteria) { this.criteria = criteria; }
        public JoinRoom() {}
    }

    public static final class SendChat {
        public String text;
        public SendChat(String text) { this.text = text; }
        public SendChat() {}
    }

    /** PING request and PONG reply share a shape; the server echoes the client timestamp. */
    public static final class Ping {
        public Long timestamp;
        public Long serverTime;
        public Ping(Long timestamp, Long serverTime) { this.timestamp = timestamp; this.serverTime = serverTime; }
        public Ping() {}
    }

    public static final class PlayerAction {
        public String actionType;
        public Map<String, Object> data = new LinkedHashMap<>();
        public PlayerAction(String actionType, Map<String, Object> data) { this.actionType = actionType; this.data = data; }
        public PlayerAction() {}
    }

    public static final class CreateRoom {
        public String roomId;
        public String name;
        public Integer capacity;
        public CreateRoom(String roomId, String name, Integer capacity) { this.roomId = roomId; this.name = name; this.capacity = capacity; }
        public CreateRoom() {}
    }

    // ---- server -> client ----
    public static final class AuthResponse {
        public boolean success;
        public String playerId;
        public String message;
        public AuthResponse(boolean success, String playerId, String message) { this.success = success; this.playerId = playerId; this.message = message; }
        public AuthResponse() {}
    }

    public static final class ErrorPayload {
        public String code;
        public String message;
        public ErrorPayload(String code, String message) { this.code = code; this.message = message; }
        public ErrorPayload() {}
    }

    public static final class SimpleMessage {
        public String message;
        public SimpleMessage(String message) { this.message = message; }
        public SimpleMessage() {}
    }

    public static final class JoinRoomResponse {
        public boolean success;
        public String roomId;
        public String message;
        public String code;
        public JoinRoomResponse(boolean success, String roomId, String message, String code) {
            this.success = success; this.roomId = roomId; this.message = message; this.code = code;
        }
        public JoinRoomResponse() {}
    }

    public static final class NewChatMessage {
        public String roomId;
        public String senderName;
        public String text;
        public long timestamp;
        public NewChatMessage(String roomId, String senderName, String text, long timestamp) {
            this.roomId = roomId; this.senderName = senderName; this.text = text; this.timestamp = timestamp;
        }
        public NewChatMessage() {}
    }

    public static final class PlayerActionResponse {
        public String actionType;
        public String status;
        public String message;
        public Object data;
        public PlayerActionResponse(String actionType, String status, String message, Object data) {
            this.actionType = actionType; this.status = status; this.message = message; this.data = data;
        }
        public PlayerActionResponse() {}
    }

    public static final class CreateRoomResponse {
        public boolean success;
        public String roomId;
        public String name;
        public int capacity;
        public String message;
        public String code;
        public CreateRoomResponse(boolean success, String roomId, String name, int capacity, String message, String code) {
            this.success = success; this.roomId = roomId; this.name = name; this.capacity = capacity; this.message = message; this.code = code;
        }
        public CreateRoomResponse() {}
    }

    public static final class RoomInfo {
        public String roomId;
        public String name;
        public int players;
        public int capacity;
        public boolean persistent;
        public RoomInfo(String roomId, String name, int players, int capacity, boolean persistent) {
            this.roomId = roomId; this.name = name; this.players = players; this.capacity = capacity; this.persistent = persistent;
        }
        public RoomInfo() {}
    }

    public static final class RoomList {
        public List<RoomInfo> rooms = new ArrayList<>();
        public RoomList(List<RoomInfo> rooms) { this.rooms = rooms; }
        public RoomList() {}
    }

    public static final class LeaveRoomResponse {
        public boolean success;
        public String roomId;
        public String message;
        public LeaveRoomResponse(boolean success, String roomId, String message) { this.success = success; this.roomId = roomId; this.message = message; }
        public LeaveRoomResponse() {}
    }

    /** Body of PLAYER_JOINED and PLAYER_LEFT. */
    public static final class MemberNotice {
        public String roomId;
        public String playerId;
        public int players;
        public MemberNotice(String roomId, String playerId, int players) { this.roomId = roomId; this.playerId = playerId; this.players = players; }
        public MemberNotice() {}
    }
}
