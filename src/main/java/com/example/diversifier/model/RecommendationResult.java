package com.example.diversifier.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class RecommendationResult {
    List<String> items;
    Tier tierUsed;
    List<String> categoriesUsed;
    int excludedCount;
    ResolutionDiagnostics diagnostics;

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("items", items);
        result.put("tierUsed", tierUsed);
        result.put("categoriesUsed", categoriesUsed);
        result.put("excludedCount", excludedCount);
        if (diagnostics != null) {
            result.put("diagnostics", diagnostics.toMap());
        }
        return result;
    }
}
