package com.example.diversifier.model;

public enum Tier {
    QUERY_DRIVEN,
    PERSONALIZED,
    DIVERSE
}
