package com.example.diversifier.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class ResolutionDiagnostics {
    HistoryStatus historyStatus;
    int pseudoEventCount;
    /** Slots actually filled per category, in selection order. */
    Map<String, Integer> allocations;
    String taxonomyVersion;

    public String describeHistory() {
        switch (historyStatus) {
            case LOADED:
                return "history loaded";
            case UNAVAILABLE:
                return "no history available";
            default:
                return "no prior turns";
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("historyStatus", historyStatus);
        result.put("history", describeHistory());
        result.put("pseudoEventCount", pseudoEventCount);
        result.put("allocations", allocations);
        result.put("taxonomyVersion", taxonomyVersion);
        return result;
    }
}
