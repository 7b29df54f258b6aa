package com.example.roomhub.client;

import com.example.roomhub.common.Messages;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Console client entry point.
 * <p>
 * Usage: {@code ClientMain [host] [port]}; defaults come from {@code HOST} and {@code PORT}.
 */
public final class ClientMain {
    private static final Logger log = LoggerFactory.getLogger(ClientMain.class);

    public static void main(String[] args) throws IOException {
        String host = args.length >= 1 ? args[0] : envOr("HOST", "127.0.0.1");
        int port = Integer.parseInt(args.length >= 2 ? args[1] : envOr("PORT", "7777"));

        NetClient net = new NetClient(host, port);
        net.setOnMessage(ClientMain::print);
        net.setOnClose(reason -> System.out.println("* disconnected: " + reason));
        try {
            net.connect();
        } catch (IOException e) {
            log.error("Cannot connect to {}:{}: {}", host, port, e.getMessage());
            System.exit(1);
        }
        System.out.println("* connected to " + host + ":" + port + ", /help for commands");

        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while (net.isConnected() && (line = console.readLine()) != null) {
            ClientCommands.Command cmd = ClientCommands.parse(line, System.currentTimeMillis());
            if (cmd == null) continue;
            if (cmd instanceof ClientCommands.Quit) break;
            if (cmd instanceof ClientCommands.Help) System.out.println(ClientCommands.HELP);
            else if (cmd instanceof ClientCommands.Invalid inv) System.out.println("! " + inv.message());
            else if (cmd instanceof ClientCommands.Send s) net.send(s.type(), s.payload());
        }
        net.close();
    }

    static String format(String type, JsonNode payload) {
        switch (type) {
            case Messages.NEW_CHAT_MESSAGE:
                return "[" + payload.path("roomId").asText() + "] " + payload.path("senderName").asText() + ": "
                        + payload.path("text").asText();
            case Messages.SIMPLE_MESSAGE:
                return "* " + payload.path("message").asText();
            case Messages.ERROR:
                return "! " + payload.path("code").asText() + ": " + payload.path("message").asText();
            case Messages.PONG:
                long rtt = System.currentTimeMillis() - payload.path("timestamp").asLong();
                return "* pong (" + rtt + " ms)";
            case Messages.PLAYER_JOINED:
                return "* " + payload.path("playerId").asText() + " joined (" + payload.path("players").asInt() + " here)";
            case Messages.PLAYER_LEFT:
                return "* " + payload.path("playerId").asText() + " left (" + payload.path("players").asInt() + " here)";
            default:
                return type + " " + payload;
        }
    }

    private static void print(String type, JsonNode payload) {
        System.out.println(format(type, payload));
    }

    private static String envOr(String k, String def) {
        String v = System.getenv(k);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
