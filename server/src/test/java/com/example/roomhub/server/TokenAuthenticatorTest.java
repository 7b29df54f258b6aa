package com.example.roomhub.server;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TokenAuthenticatorTest {

    @Test
    public void testKnownAndUnknownTokens() {
        var auth = new TokenAuthenticator(Map.of("dev-token-alice", "alice", "dev-token-bob", "bob"));
        assertEquals(Optional.of("alice"), auth.authenticate("dev-token-alice"));
        assertEquals(Optional.of("bob"), auth.authenticate("dev-token-bob"));
        assertTrue(auth.authenticate("dev-token-alic").isEmpty(), "prefix must not match");
        assertTrue(auth.authenticate("dev-token-alice ").isEmpty());
        assertTrue(auth.authenticate("").isEmpty());
        assertTrue(auth.authenticate(null).isEmpty());
    }

    /** Later edits to the configuration map do not leak into a running authenticator. */
    @Test
    public void testTableIsCopied() {
        Map<String, String> tokens = new HashMap<>();
        tokens.put("t", "p");
        var auth = new TokenAuthenticator(tokens);
        tokens.put("u", "q");
        assertEquals(1, auth.size());
        assertTrue(auth.authenticate("u").isEmpty());
    }

    @Test
    public void testSlowEquals() {
        assertTrue(TokenAuthenticator.slowEquals("abc", "abc"));
        assertFalse(TokenAuthenticator.slowEquals("abc", "abd"));
        assertFalse(TokenAuthenticator.slowEquals("abc", "abcd"));
        assertFalse(TokenAuthenticator.slowEquals(null, "abc"));
        assertTrue(TokenAuthenticator.slowEquals("żółw", "żółw"));
    }
}
