package com.example.roomhub.server;

import java.security.SecureRandom;

final class Ids {
    private Ids() {}
    private static final SecureRandom RNG = new SecureRandom();
    private static final char[] ALPH = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();

    /** Short id used in log lines and thread names; not a secret. */
    static String sessionId() {
        char[] c = new char[8];
        for (int i = 0; i < c.length; i++) c[i] = ALPH[RNG.nextInt(ALPH.length)];
        return new String(c);
    }
}
