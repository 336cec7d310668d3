package com.example.diversifier.model;

import lombok.*;

import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecommendationRequest {
    private String sessionId;
    private String userQuery;
    private int n;
    private Set<String> explicitExclusions;
    private String language;
}
