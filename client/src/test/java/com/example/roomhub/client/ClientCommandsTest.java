package com.example.roomhub.client;

import com.example.roomhub.common.Messages;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClientCommandsTest {

    private static ClientCommands.Send send(String line) {
        ClientCommands.Command c = ClientCommands.parse(line, 1234L);
        assertInstanceOf(ClientCommands.Send.class, c, "line " + line + " gave " + c);
        return (ClientCommands.Send) c;
    }

    private static String invalid(String line) {
        ClientCommands.Command c = ClientCommands.parse(line, 0L);
        assertInstanceOf(ClientCommands.Invalid.class, c, "line " + line + " gave " + c);
        return ((ClientCommands.Invalid) c).message();
    }

    @Test
    public void testAuthAndJoin() {
        var auth = send("/auth dev-token-alice");
        assertEquals(Messages.AUTH, auth.type());
        assertEquals("dev-token-alice", ((Messages.Auth) auth.payload()).token);

        assertNull(((Messages.JoinRoom) send("/join").payload()).criteria);
        assertEquals("arena", ((Messages.JoinRoom) send("/join arena").payload()).criteria);
        assertEquals("*", ((Messages.JoinRoom) send("/JOIN *").payload()).criteria);

        assertTrue(invalid("/auth").startsWith("usage"));
        assertTrue(invalid("/join a b").startsWith("usage"));
    }

    @Test
    public void testChat() {
        var say = send("/say  hello   there ");
        assertEquals(Messages.SEND_CHAT, say.type());
        assertEquals("hello   there", ((Messages.SendChat) say.payload()).text);

        assertEquals("plain line", ((Messages.SendChat) send("  plain line").payload()).text);
        assertTrue(invalid("/say").startsWith("usage"));
        assertNull(ClientCommands.parse("   ", 0L));
    }

    @Test
    public void testPingCarriesClock() {
        var ping = send("/ping");
        assertEquals(Messages.PING, ping.type());
        assertEquals(1234L, ((Messages.Ping) ping.payload()).timestamp);
    }

    @Test
    public void testCreateRoom() {
        var bare = (Messages.CreateRoom) send("/create").payload();
        assertNull(bare.roomId);
        assertNull(bare.capacity);

        var full = (Messages.CreateRoom) send("/create arena 8").payload();
        assertEquals("arena", full.roomId);
        assertEquals(8, full.capacity);

        assertTrue(invalid("/create arena lots").contains("number"));
        assertTrue(invalid("/create arena 0").contains("positive"));
    }

    @Test
    public void testRoomsLeaveProfile() {
        assertEquals(Messages.LIST_ROOMS, send("/rooms").type());
        assertNull(send("/rooms").payload());
        assertEquals(Messages.LEAVE_ROOM, send("/leave").type());

        var profile = (Messages.PlayerAction) send("/profile").payload();
        assertEquals(Messages.ACTION_GET_PLAYER_PROFILE, profile.actionType);
    }

    @Test
    public void testAction() {
        var action = (Messages.PlayerAction) send("/action attack target=orc power=3").payload();
        assertEquals(Messages.ACTION_PERFORM_INGAME, action.actionType);
        assertEquals("attack", action.data.get("action_name"));
        assertEquals(Map.of("target", "orc", "power", "3"), action.data.get("action_params"));

        var bare = (Messages.PlayerAction) send("/action wave").payload();
        assertEquals(Map.of(), bare.data.get("action_params"));

        assertTrue(invalid("/action").startsWith("usage"));
        assertTrue(invalid("/action attack =orc").contains("key=value"));
    }

    @Test
    public void testQuitHelpUnknown() {
        assertInstanceOf(ClientCommands.Quit.class, ClientCommands.parse("/quit", 0L));
        assertInstanceOf(ClientCommands.Quit.class, ClientCommands.parse("/exit", 0L));
        assertInstanceOf(ClientCommands.Help.class, ClientCommands.parse("/help", 0L));
        assertTrue(invalid("/dance").contains("/help"));
    }
}
