package com.example.diversifier.model;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Turn {
    private int turnNumber;
    private String userQuery;
    private List<String> detectedCategories;
    private List<String> recommendedIds;
    private Instant timestamp;
}
