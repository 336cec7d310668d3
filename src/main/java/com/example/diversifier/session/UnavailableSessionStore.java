package com.example.diversifier.session;

import com.example.diversifier.model.Session;
import com.example.diversifier.model.Turn;
import com.example.diversifier.service.RecoverableCollaboratorFailure;

import java.util.Optional;

/**
 * Stand-in handed out while the session store's circuit is open: every call fails fast.
 */
public class UnavailableSessionStore implements SessionStore {

    private final String reason;

    public UnavailableSessionStore(String reason) {
        this.reason = reason;
    }

    @Override
    public Optional<Session> getSession(String sessionId) {
        throw new RecoverableCollaboratorFailure(KvSessionStore.COLLABORATOR, reason);
    }

    @Override
    public Session appendTurn(String sessionId, Turn turn) {
        throw new RecoverableCollaboratorFailure(KvSessionStore.COLLABORATOR, reason);
    }
}
