package com.example.diversifier.session;

import com.example.diversifier.model.Session;
import com.example.diversifier.model.Turn;

import java.util.Optional;

public interface SessionStore {
    Optional<Session> getSession(String sessionId);

    // assigns the turn number and timestamp; creates the session when absent
    Session appendTurn(String sessionId, Turn turn);
}
