package com.example.roomhub.client;

import com.example.roomhub.common.Messages;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns console lines into protocol envelopes. A line without a leading slash is chat.
 */
final class ClientCommands {
    private ClientCommands() {}

    static final String HELP = String.join("\n",
            "/auth <token>              authenticate",
            "/join [room|*]             join a room, or any room with space",
            "/say <text>                chat in the current room (plain lines work too)",
            "/ping                      liveness check",
            "/create [id] [capacity]    create a room",
            "/rooms                     list rooms",
            "/leave                     leave the current room",
            "/profile                   show the stored player profile",
            "/action <name> [k=v ...]   prepare an in-game action",
            "/quit                      disconnect");

    sealed interface Command permits Send, Quit, Help, Invalid {}

    /** One envelope to put on the wire. */
    record Send(String type, Object payload) implements Command {}

    record Quit() implements Command {}

    record Help() implements Command {}

    record Invalid(String message) implements Command {}

    /**
     * @param now wall-clock millis stamped into pings
     * @return {@code null} for a blank line
     */
    static Command parse(String line, long now) {
        if (line == null || line.isBlank()) return null;
        String trimmed = line.strip();
        if (!trimmed.startsWith("/")) return new Send(Messages.SEND_CHAT, new Messages.SendChat(trimmed));

        String[] head = trimmed.split("\\s+", 2);
        String cmd = head[0].toLowerCase();
        String rest = head.length > 1 ? head[1].strip() : "";
        String[] args = rest.isEmpty() ? new String[0] : rest.split("\\s+");

        switch (cmd) {
            case "/auth":
                if (args.length != 1) return new Invalid("usage: /auth <token>");
                return new Send(Messages.AUTH, new Messages.Auth(args[0]));
            case "/join":
                if (args.length > 1) return new Invalid("usage: /join [room|*]");
                return new Send(Messages.JOIN_ROOM, new Messages.JoinRoom(args.length == 0 ? null : args[0]));
            case "/say":
                if (rest.isEmpty()) return new Invalid("usage: /say <text>");
                return new Send(Messages.SEND_CHAT, new Messages.SendChat(rest));
            case "/ping":
                return new Send(Messages.PING, new Messages.Ping(now, null));
            case "/create":
                return create(args);
            case "/rooms":
                return new Send(Messages.LIST_ROOMS, null);
            case "/leave":
                return new Send(Messages.LEAVE_ROOM, null);
            case "/profile":
                return new Send(Messages.PLAYER_ACTION, new Messages.PlayerAction(Messages.ACTION_GET_PLAYER_PROFILE, Map.of()));
            case "/action":
                return action(args);
            case "/quit":
            case "/exit":
                return new Quit();
            case "/help":
                return new Help();
            default:
                return new Invalid("unknown command " + cmd + ", try /help");
        }
    }

    private static Command create(String[] args) {
        if (args.length > 2) return new Invalid("usage: /create [id] [capacity]");
        String id = args.length > 0 ? args[0] : null;
        Integer capacity = null;
        if (args.length == 2) {
            try {
                capacity = Integer.parseInt(args[1]);
            } catch (NumberFormatException e) {
                return new Invalid("capacity must be a number: " + args[1]);
            }
            if (capacity <= 0) return new Invalid("capacity must be positive");
        }
        return new Send(Messages.CREATE_ROOM, new Messages.CreateRoom(id, null, capacity));
    }

    private static Command action(String[] args) {
        if (args.length == 0) return new Invalid("usage: /action <name> [k=v ...]");
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 1; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) return new Invalid("expected key=value, got " + args[i]);
            params.put(args[i].substring(0, eq), args[i].substring(eq + 1));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action_name", args[0]);
        data.put("action_params", params);
        return new Send(Messages.PLAYER_ACTION, new Messages.PlayerAction(Messages.ACTION_PERFORM_INGAME, data));
    }
}
