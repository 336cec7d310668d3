package com.example.diversifier.service;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * A collaborator (session store, candidate supplier) timed out or failed.
 * Callers degrade instead of failing the conversation.
 */
public class RecoverableCollaboratorFailure extends RuntimeException {

    private final String collaborator;

    public RecoverableCollaboratorFailure(String collaborator, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
    }

    public RecoverableCollaboratorFailure(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }

    /**
     * True when the collaborator did not answer in time or had no capacity left,
     * as opposed to answering with an error.
     */
    public boolean isUnresponsive() {
        return getCause() instanceof TimeoutException || getCause() instanceof RejectedExecutionException;
    }
}
