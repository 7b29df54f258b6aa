package com.example.roomhub.server;

import java.util.Optional;

interface Authenticator {

    /** @return the player id the token belongs to, or empty if the token is not valid */
    Optional<String> authenticate(String token);
}
