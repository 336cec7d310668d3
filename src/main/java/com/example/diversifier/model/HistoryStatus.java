package com.example.diversifier.model;

public enum HistoryStatus {
    LOADED,       // session found with at least one turn
    EMPTY,        // no session or a session without turns
    UNAVAILABLE   // session store failed, history ignored for this turn
}
