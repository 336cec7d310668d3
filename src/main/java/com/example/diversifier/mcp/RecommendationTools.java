package com.example.diversifier.mcp;

import com.example.diversifier.model.RecommendationRequest;
import com.example.diversifier.model.Session;
import com.example.diversifier.model.Turn;
import com.example.diversifier.service.ConversationalRecommendationService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class RecommendationTools {

    private final ConversationalRecommendationService recommendationService;

    @Value("${app.resolver.default-n:5}")
    private int defaultN;

    @Value("${app.resolver.max-n:50}")
    private int maxN;

    public RecommendationTools(ConversationalRecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @Tool(description = "Recommend up to n catalog item ids for a conversational turn, never repeating items already shown in the session")
    public Map<String,Object> recommend(@ToolParam(description = "Conversation id") String sessionId,
                                        @ToolParam(description = "What the user just asked for") String userQuery,
                                        @ToolParam(description = "How many items, default 5", required = false) Integer n,
                                        @ToolParam(description = "Item ids never to return", required = false) List<String> excludeIds,
                                        @ToolParam(description = "Keyword language such as es or en", required = false) String language) {
        requireSessionId(sessionId);
        int count = n == null ? defaultN : n;
        if (count < 0 || count > maxN) {
            throw new IllegalArgumentException("n must be between 0 and " + maxN + ": " + count);
        }
        RecommendationRequest request = RecommendationRequest.builder()
                .sessionId(sessionId)
                .userQuery(userQuery == null ? "" : userQuery)
                .n(count)
                .explicitExclusions(excludeIds == null ? Set.of() : new LinkedHashSet<>(excludeIds))
                .language(language == null || language.isBlank() ? null : language)
                .build();
        return recommendationService.recommend(request).toMap();
    }

    @Tool(description = "Get the recorded turns of a conversation session (empty when absent or expired)")
    public Map<String,Object> session_history(String sessionId) {
        requireSessionId(sessionId);
        Session session = recommendationService.getSessionHistory(sessionId);

        List<Map<String,Object>> turns = new ArrayList<>();
        for (Turn turn : session.getTurns()) {
            Map<String,Object> t = new LinkedHashMap<>();
            t.put("turnNumber", turn.getTurnNumber());
            t.put("userQuery", turn.getUserQuery());
            t.put("detectedCategories", turn.getDetectedCategories());
            t.put("recommendedIds", turn.getRecommendedIds());
            t.put("timestamp", Objects.toString(turn.getTimestamp(), null));
            turns.add(t);
        }
        Map<String,Object> result = new LinkedHashMap<>();
        result.put("sessionId", sessionId);
        result.put("turns", turns);
        result.put("shownItemCount", session.recommendedIds().size());
        result.put("lastUpdated", Objects.toString(session.getLastUpdated(), null));
        return result;
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
    }
}
