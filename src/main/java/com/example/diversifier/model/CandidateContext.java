package com.example.diversifier.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CandidateContext {
    String sessionId;
    String userQuery;
    String language;
}
