package com.example.diversifier.model;

import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered append log of the turns of one conversation.
 * Instances are replaced on every append, never edited in place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Session {
    private String id;
    @Builder.Default
    private List<Turn> turns = new ArrayList<>();
    private Instant createdAt;
    private Instant lastUpdated;
    private Duration ttl;

    public static Session empty(String id) {
        return Session.builder().id(id).turns(List.of()).build();
    }

    /**
     * Every item id recommended in any turn of this session, in first-shown order.
     */
    public Set<String> recommendedIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (turns != null) {
            for (Turn turn : turns) {
                if (turn.getRecommendedIds() != null) {
                    ids.addAll(turn.getRecommendedIds());
                }
            }
        }
        return ids;
    }

    public int lastTurnNumber() {
        if (turns == null || turns.isEmpty()) return 0;
        return turns.get(turns.size() - 1).getTurnNumber();
    }

    public boolean isExpired(Instant now) {
        if (ttl == null || lastUpdated == null) return false;
        return !lastUpdated.plus(ttl).isAfter(now);
    }
}
