package com.example.roomhub.server;

import com.example.roomhub.common.Messages;
import com.example.roomhub.common.Net;
import com.example.roomhub.server.actor.Actor;
import com.example.roomhub.server.actor.ActorRef;
import com.example.roomhub.server.actor.DeadlineTimer;
import com.example.roomhub.server.ledger.ActionDescriptor;
import com.example.roomhub.server.ledger.PreparedTransaction;
import com.example.roomhub.server.store.PlayerData;
import com.example.roomhub.server.store.PlayerStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * One client connection: authentication, liveness, room membership and the client command set.
 * <p>
 * States run {@code AWAITING_AUTH -> ACTIVE -> TERMINATING}. A single deadline timer serves the
 * authentication deadline first and the sliding activity deadline afterwards. Every way out
 * (timeout, disconnect, admin stop, failure) ends in {@link #postStop()}, which does all cleanup.
 */
final class PlayerSession extends Actor<SessionMessage> {
    private static final Logger log = LoggerFactory.getLogger(PlayerSession.class);
    private static final TypeReference<Map<String, Object>> ACTION_PARAMS = new TypeReference<>() {};

    enum State { AWAITING_AUTH, ACTIVE, TERMINATING }

    static final String WELCOME = "Welcome! Please authenticate. Send JSON: {\"type\":\"AUTH\",\"payload\":{\"token\":\"your_token\"}}";

    private final String sessionId;
    private final SessionServices services;
    private final ServerConfig config;

    private ClientChannel channel;
    private State state = State.AWAITING_AUTH;
    private DeadlineTimer<SessionMessage> deadline;
    private int failedAuthAttempts;

    private String playerId;
    private boolean inWorld;
    private PlayerData playerData;

    private ActorRef<RoomMessage> currentRoom;
    private String currentRoomId;
    private boolean joinInFlight;
    private ActorRef<RoomMessage> pendingRoom;

    private long lastChatMillis;

    PlayerSession(String sessionId, SessionServices services) {
        this.sessionId = sessionId;
        this.services = services;
        this.config = services.config();
    }

    State state() { return state; }

    @Override
    protected void preStart() {
        deadline = context().newDeadlineTimer(SessionMessage.DeadlineExpired::new);
    }

    @Override
    protected void receive(SessionMessage message) {
        if (message instanceof SessionMessage.Connected m) onConnected(m.channel());
        else if (message instanceof SessionMessage.ClientMessage m) onClientMessage(m.bytes());
        else if (message instanceof SessionMessage.Disconnected m) terminate("disconnected: " + m.reason());
        else if (message instanceof SessionMessage.DeadlineExpired m) onDeadline(m.generation());
        else if (message instanceof SessionMessage.Stop m) onStop(m.reason());
        else if (message instanceof SessionMessage.RoomFound m) onRoomFound(m.result());
        else if (message instanceof SessionMessage.JoinReply m) onJoinReply(m);
        else if (message instanceof SessionMessage.FromRoom m) onRoomEvent(m.room(), m.event());
        else if (message instanceof SessionMessage.RoomCreated m) onRoomCreated(m.result());
        else if (message instanceof SessionMessage.RoomsListed m) onRoomsListed(m.rooms());
        else if (message instanceof SessionMessage.PlayerDataLoaded m) onPlayerDataLoaded(m);
        else if (message instanceof SessionMessage.LedgerCompleted m) onLedgerCompleted(m);
        else throw new IllegalStateException("unhandled message " + message.getClass().getName());
    }

    // ---- connection lifecycle ----

    private void onConnected(ClientChannel ch) {
        this.channel = ch;
        log.info("Session {} connected from {}", sessionId, ch.remoteAddress());
        deadline.arm(config.authTimeout());
        send(Messages.SIMPLE_MESSAGE, new Messages.SimpleMessage(WELCOME));
    }

    private void onDeadline(long generation) {
        if (!deadline.expire(generation)) return;
        String reason = state == State.AWAITING_AUTH ? "Authentication timeout" : "Inactivity timeout";
        sendError(ErrorCode.TIMEOUT, reason + ", closing connection");
        terminate(reason);
    }

    private void onStop(String reason) {
        send(Messages.SIMPLE_MESSAGE, new Messages.SimpleMessage(reason));
        terminate("stopped: " + reason);
    }

    private void terminate(String reason) {
        if (state == State.TERMINATING) return;
        log.info("Session {} ({}) terminating: {}", sessionId, playerId == null ? "unauthenticated" : playerId, reason);
        state = State.TERMINATING;
        context().stop();
    }

    // ---- client commands ----

    private void onClientMessage(byte[] bytes) {
        if (channel == null) {
            log.warn("Session {}: client message before Connected, dropped", sessionId);
            return;
        }
        if (state == State.ACTIVE) deadline.arm(config.activityTimeout());

        Messages.Envelope env;
        try {
            env = Net.readEnvelope(bytes);
        } catch (IOException e) {
            log.debug("Session {}: malformed message: {}", sessionId, e.getMessage());
            sendError(ErrorCode.INVALID_JSON, "Invalid message format");
            return;
        }
        String type = env.type == null ? "" : env.type;

        try {
            if (Messages.PING.equals(type)) {
                onPing(env);
            } else if (state == State.AWAITING_AUTH) {
                if (Messages.AUTH.equals(type)) onAuth(env);
                else sendError(ErrorCode.NOT_AUTHENTICATED, "Not authenticated. Send AUTH first.");
            } else {
                switch (type) {
                    case Messages.AUTH -> sendError(ErrorCode.ALREADY_AUTHENTICATED, "Already authenticated as " + playerId);
                    case Messages.JOIN_ROOM -> onJoinRoom(env);
                    case Messages.SEND_CHAT -> onSendChat(env);
                    case Messages.PLAYER_ACTION -> onPlayerAction(env);
                    case Messages.CREATE_ROOM -> onCreateRoom(env);
                    case Messages.LIST_ROOMS -> onListRooms();
                    case Messages.LEAVE_ROOM -> onLeaveRoom();
                    default -> sendError(ErrorCode.UNKNOWN_COMMAND, "Unknown message type: " + type);
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Session {}: bad {} payload: {}", sessionId, type, e.getOriginalMessage());
            sendError(ErrorCode.INVALID_JSON, "Invalid payload for " + type);
        }
    }

    private void onPing(Messages.Envelope env) throws JsonProcessingException {
        Messages.Ping ping = Net.payload(env, Messages.Ping.class);
        send(Messages.PONG, new Messages.Ping(ping.timestamp, System.currentTimeMillis()));
    }

    private void onAuth(Messages.Envelope env) throws JsonProcessingException {
        Messages.Auth req = Net.payload(env, Messages.Auth.class);
        Optional<String> pid = services.authenticator().authenticate(req.token);
        if (pid.isEmpty()) {
            failedAuthAttempts++;
            log.info("Session {}: authentication failed (attempt {})", sessionId, failedAuthAttempts);
            if (config.maxAuthAttempts > 0 && failedAuthAttempts >= config.maxAuthAttempts) {
                send(Messages.AUTH_RESPONSE, new Messages.AuthResponse(false, null, "Authentication failed."));
                sendError(ErrorCode.AUTH_ATTEMPTS_EXCEEDED, "Too many failed authentication attempts");
                terminate("authentication attempts exceeded");
                return;
            }
            send(Messages.AUTH_RESPONSE, new Messages.AuthResponse(false, null, "Authentication failed. Invalid token."));
            deadline.arm(config.authTimeout());
            return;
        }

        playerId = pid.get();
        state = State.ACTIVE;
        deadline.arm(config.activityTimeout());
        inWorld = services.worldRegistry().tell(new WorldMessage.PlayerEntered(playerId, self()));
        log.info("Session {} authenticated as {}", sessionId, playerId);
        send(Messages.AUTH_RESPONSE, new Messages.AuthResponse(true, playerId, "Authentication successful."));
        loadPlayerData();
    }

    private void onJoinRoom(Messages.Envelope env) throws JsonProcessingException {
        if (joinInFlight) {
            sendError(ErrorCode.JOIN_IN_PROGRESS, "A join request is already in progress");
            return;
        }
        RoomCriteria criteria = RoomCriteria.parse(Net.payload(env, Messages.JoinRoom.class).criteria);
        if (!criteria.isAny() && criteria.roomId().equals(currentRoomId)) {
            send(Messages.JOIN_ROOM_RESPONSE, new Messages.JoinRoomResponse(false, currentRoomId,
                    "Already in room " + currentRoomId, ErrorCode.ALREADY_IN_ROOM.name()));
            return;
        }

        ActorRef<SessionMessage> self = self();
        CompletableFuture<FindRoomResult> reply = new CompletableFuture<>();
        if (!services.roomRegistry().tell(new RegistryMessage.FindRoom(criteria, reply))) {
            sendError(ErrorCode.INTERNAL_SERVER_ERROR, "Room registry unavailable");
            return;
        }
        joinInFlight = true;
        reply.thenAccept(r -> self.tell(new SessionMessage.RoomFound(r)));
    }

    private void onRoomFound(FindRoomResult result) {
        switch (result.outcome()) {
            case FOUND -> {
                pendingRoom = result.room();
                if (!pendingRoom.tell(new RoomMessage.Join(playerId, self()))) {
                    joinFailed(result.roomId(), ErrorCode.ROOM_CLOSED, "Room " + result.roomId() + " is closed");
                }
            }
            case FULL -> joinFailed(result.roomId(), ErrorCode.ROOM_FULL,
                    result.roomId() == null ? "All rooms are full" : "Room " + result.roomId() + " is full");
            case NOT_FOUND -> joinFailed(result.roomId(), ErrorCode.ROOM_NOT_FOUND,
                    result.roomId() == null ? "No rooms available" : "Room " + result.roomId() + " not found");
        }
    }

    private void onJoinReply(SessionMessage.JoinReply reply) {
        if (!reply.room().equals(pendingRoom)) {
            // answer to a join we no longer track; give the slot back
            if (reply.outcome() == JoinOutcome.JOINED) reply.room().tell(new RoomMessage.Leave(playerId, self()));
            return;
        }
        switch (reply.outcome()) {
            case JOINED -> {
                joinInFlight = false;
                pendingRoom = null;
                if (currentRoom != null && !currentRoom.equals(reply.room())) {
                    currentRoom.tell(new RoomMessage.Leave(playerId, self()));
                }
                currentRoom = reply.room();
                currentRoomId = reply.roomId();
                log.info("Session {}: {} joined room {}", sessionId, playerId, currentRoomId);
                send(Messages.JOIN_ROOM_RESPONSE, new Messages.JoinRoomResponse(true, currentRoomId,
                        "Successfully joined room " + currentRoomId, null));
            }
            case ROOM_FULL -> joinFailed(reply.roomId(), ErrorCode.ROOM_FULL, "Room " + reply.roomId() + " is full");
            case ALREADY_MEMBER -> joinFailed(reply.roomId(), ErrorCode.ALREADY_IN_ROOM, "Already a member of room " + reply.roomId());
            case ROOM_CLOSED -> joinFailed(reply.roomId(), ErrorCode.ROOM_CLOSED, "Room " + reply.roomId() + " is closed");
        }
    }

    private void joinFailed(String roomId, ErrorCode code, String message) {
        joinInFlight = false;
        pendingRoom = null;
        send(Messages.JOIN_ROOM_RESPONSE, new Messages.JoinRoomResponse(false, roomId, message, code.name()));
    }

    private void onSendChat(Messages.Envelope env) throws JsonProcessingException {
        if (currentRoom == null) {
            sendError(ErrorCode.NOT_IN_A_ROOM, "You must join a room before chatting");
            return;
        }
        String text = Net.payload(env, Messages.SendChat.class).text;
        if (text == null || text.isBlank()) {
            sendError(ErrorCode.EMPTY_CHAT_MESSAGE, "Chat message cannot be empty");
            return;
        }
        if (text.length() > config.chatMaxLength) {
            sendError(ErrorCode.CHAT_TOO_LONG, "Chat message exceeds " + config.chatMaxLength + " characters");
            return;
        }
        long now = System.currentTimeMillis();
        if (lastChatMillis != 0 && now - lastChatMillis < config.chatCooldownMillis) {
            sendError(ErrorCode.CHAT_RATE_LIMIT, "You are sending messages too fast");
            return;
        }
        lastChatMillis = now;

        RoomEvent.Chat chat = new RoomEvent.Chat(currentRoomId, playerId, text, now);
        if (!currentRoom.tell(new RoomMessage.Broadcast(chat, self(), true))) roomLost();
    }

    private void onLeaveRoom() {
        if (currentRoom == null) {
            sendError(ErrorCode.NOT_IN_A_ROOM, "You are not in a room");
            return;
        }
        String left = currentRoomId;
        currentRoom.tell(new RoomMessage.Leave(playerId, self()));
        currentRoom = null;
        currentRoomId = null;
        send(Messages.LEAVE_ROOM_RESPONSE, new Messages.LeaveRoomResponse(true, left, "Left room " + left));
    }

    private void onCreateRoom(Messages.Envelope env) throws JsonProcessingException {
        Messages.CreateRoom req = Net.payload(env, Messages.CreateRoom.class);
        RoomSpec spec = RoomSpec.adHoc(req.roomId, req.name, req.capacity == null ? 0 : req.capacity);

        ActorRef<SessionMessage> self = self();
        CompletableFuture<CreateRoomResult> reply = new CompletableFuture<>();
        if (!services.roomRegistry().tell(new RegistryMessage.CreateRoom(spec, reply))) {
            sendError(ErrorCode.INTERNAL_SERVER_ERROR, "Room registry unavailable");
            return;
        }
        reply.thenAccept(r -> self.tell(new SessionMessage.RoomCreated(r)));
    }

    private void onRoomCreated(CreateRoomResult result) {
        if (!result.created()) {
            send(Messages.CREATE_ROOM_RESPONSE, new Messages.CreateRoomResponse(false, null, null, 0,
                    result.error(), ErrorCode.ROOM_ALREADY_EXISTS.name()));
            return;
        }
        RoomSummary r = result.room();
        send(Messages.CREATE_ROOM_RESPONSE, new Messages.CreateRoomResponse(true, r.roomId(), r.name(), r.capacity(),
                "Room " + r.roomId() + " created", null));
    }

    private void onListRooms() {
        ActorRef<SessionMessage> self = self();
        CompletableFuture<List<RoomSummary>> reply = new CompletableFuture<>();
        if (!services.roomRegistry().tell(new RegistryMessage.ListRooms(reply))) {
            sendError(ErrorCode.INTERNAL_SERVER_ERROR, "Room registry unavailable");
            return;
        }
        reply.thenAccept(r -> self.tell(new SessionMessage.RoomsListed(r)));
    }

    private void onRoomsListed(List<RoomSummary> rooms) {
        List<Messages.RoomInfo> infos = new ArrayList<>(rooms.size());
        for (RoomSummary r : rooms) infos.add(r.toInfo());
        send(Messages.ROOM_LIST, new Messages.RoomList(infos));
    }

    private void onPlayerAction(Messages.Envelope env) throws JsonProcessingException {
        Messages.PlayerAction req = Net.payload(env, Messages.PlayerAction.class);
        String actionType = req.actionType == null ? "" : req.actionType;
        switch (actionType) {
            case Messages.ACTION_GET_PLAYER_PROFILE -> {
                if (playerData == null) {
                    send(Messages.PLAYER_ACTION_RESPONSE, new Messages.PlayerActionResponse(actionType, "FAILED",
                            "Profile is still loading", null));
                } else {
                    send(Messages.PLAYER_ACTION_RESPONSE, new Messages.PlayerActionResponse(actionType, "OK", null, playerData));
                }
            }
            case Messages.ACTION_PERFORM_INGAME -> performIngameAction(req.data);
            default -> sendError(ErrorCode.UNKNOWN_ACTION_TYPE, "Unknown action type: " + actionType);
        }
    }

    private void performIngameAction(Map<String, Object> data) {
        Object name = data == null ? null : data.get("action_name");
        Object params = data == null ? null : data.get("action_params");
        if (!(name instanceof String actionName) || actionName.isBlank()) {
            sendError(ErrorCode.INVALID_ACTION, "Missing or invalid 'action_name'");
            return;
        }
        if (!(params instanceof Map)) {
            sendError(ErrorCode.INVALID_ACTION, "Missing or invalid 'action_params'");
            return;
        }
        ActionDescriptor action = new ActionDescriptor(playerId, actionName, Net.MAPPER.convertValue(params, ACTION_PARAMS));

        ActorRef<SessionMessage> self = self();
        services.ledger().prepare(action).whenComplete((tx, err) ->
                self.tell(new SessionMessage.LedgerCompleted(actionName, tx, unwrap(err))));
    }

    private void onLedgerCompleted(SessionMessage.LedgerCompleted m) {
        if (m.failure() != null) {
            log.warn("Session {}: ledger rejected {} for {}: {}", sessionId, m.actionName(), playerId, m.failure().getMessage());
            send(Messages.PLAYER_ACTION_RESPONSE, new Messages.PlayerActionResponse(Messages.ACTION_PERFORM_INGAME, "FAILED",
                    "Failed to prepare action " + m.actionName() + ": " + m.failure().getMessage(), null));
            return;
        }
        PreparedTransaction tx = m.transaction();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("actionName", m.actionName());
        body.put("txBytes", tx.txBytes());
        body.put("module", tx.module());
        body.put("function", tx.function());
        body.put("gasBudget", tx.gasBudget());
        send(Messages.PLAYER_ACTION_RESPONSE, new Messages.PlayerActionResponse(Messages.ACTION_PERFORM_INGAME, "PREPARED",
                "Transaction prepared, sign and submit it", body));
    }

    // ---- room events ----

    private void onRoomEvent(ActorRef<RoomMessage> room, RoomEvent event) {
        if (!room.equals(currentRoom)) {
            log.debug("Session {}: event from room {} which is not current, dropped", sessionId, room.name());
            return;
        }
        if (event instanceof RoomEvent.MemberJoined e) {
            send(Messages.PLAYER_JOINED, new Messages.MemberNotice(e.roomId(), e.playerId(), e.members()));
        } else if (event instanceof RoomEvent.MemberLeft e) {
            send(Messages.PLAYER_LEFT, new Messages.MemberNotice(e.roomId(), e.playerId(), e.members()));
        } else if (event instanceof RoomEvent.Chat e) {
            send(Messages.NEW_CHAT_MESSAGE, new Messages.NewChatMessage(e.roomId(), e.senderId(), e.text(), e.timestamp()));
        } else if (event instanceof RoomEvent.Closing e) {
            currentRoom = null;
            currentRoomId = null;
            send(Messages.SIMPLE_MESSAGE, new Messages.SimpleMessage(Room.closingNotice(e.name())));
        }
    }

    private void roomLost() {
        log.info("Session {}: room {} is gone", sessionId, currentRoomId);
        String lost = currentRoomId;
        currentRoom = null;
        currentRoomId = null;
        sendError(ErrorCode.ROOM_CLOSED, "Room " + lost + " is no longer available");
    }

    // ---- persistence ----

    private void loadPlayerData() {
        String id = playerId;
        ActorRef<SessionMessage> self = self();
        try {
            CompletableFuture.supplyAsync(() -> {
                try {
                    return services.playerStore().load(id);
                } catch (PlayerStoreException e) {
                    throw new CompletionException(e);
                }
            }, services.ioExecutor()).whenComplete((data, err) ->
                    self.tell(new SessionMessage.PlayerDataLoaded(id, data == null ? null : data.orElse(null), unwrap(err))));
        } catch (RejectedExecutionException e) {
            log.warn("Session {}: cannot load data for {}, I/O executor is shut down", sessionId, id);
        }
    }

    private void onPlayerDataLoaded(SessionMessage.PlayerDataLoaded m) {
        Instant now = Instant.now();
        if (m.failure() != null) {
            log.warn("Session {}: loading data for {} failed, starting fresh: {}", sessionId, m.playerId(), m.failure().getMessage());
            playerData = PlayerData.fresh(m.playerId(), now);
        } else if (m.data() == null) {
            log.info("Session {}: no stored data for {}, creating profile", sessionId, m.playerId());
            playerData = PlayerData.fresh(m.playerId(), now);
        } else {
            playerData = m.data().withSessionStarted(now);
        }
    }

    private void savePlayerData() {
        if (playerData == null) return;
        PlayerData toSave = playerData.withLastSeen(Instant.now());
        try {
            services.ioExecutor().execute(() -> {
                try {
                    services.playerStore().save(toSave);
                } catch (PlayerStoreException e) {
                    log.error("Saving data for {} failed", toSave.playerId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Session {}: data for {} not saved, I/O executor is shut down", sessionId, toSave.playerId());
        }
    }

    // ---- termination ----

    @Override
    protected void postStop() {
        state = State.TERMINATING;
        if (deadline != null) deadline.cancel();
        if (playerId != null) {
            if (currentRoom != null) currentRoom.tell(new RoomMessage.Leave(playerId, self()));
            if (pendingRoom != null) pendingRoom.tell(new RoomMessage.Leave(playerId, self()));
            if (inWorld) services.worldRegistry().tell(new WorldMessage.PlayerLeft(playerId, self()));
        }
        currentRoom = null;
        pendingRoom = null;
        savePlayerData();
        if (channel != null) channel.close();
        log.info("Session {} closed", sessionId);
    }

    @Override
    protected void onUndelivered(SessionMessage message) {
        if (message instanceof SessionMessage.JoinReply m && m.outcome() == JoinOutcome.JOINED && playerId != null) {
            m.room().tell(new RoomMessage.Leave(playerId, self()));
        }
    }

    // ---- output ----

    private void sendError(ErrorCode code, String message) {
        if (code.category == ErrorCode.Category.INTERNAL) log.warn("Session {}: {}: {}", sessionId, code, message);
        else log.debug("Session {}: {} error {}: {}", sessionId, code.category, code, message);
        send(Messages.ERROR, new Messages.ErrorPayload(code.name(), message));
    }

    private void send(String type, Object payload) {
        if (channel == null) return;
        try {
            channel.send(Net.envelope(type, payload));
        } catch (JsonProcessingException e) {
            log.error("Session {}: cannot encode {}", sessionId, type, e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) return t.getCause();
        return t;
    }
}
