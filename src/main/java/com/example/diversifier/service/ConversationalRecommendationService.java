package com.example.diversifier.service;

import com.example.diversifier.model.RecommendationRequest;
import com.example.diversifier.model.RecommendationResult;
import com.example.diversifier.model.Session;
import com.example.diversifier.model.Turn;
import com.example.diversifier.provisioning.ComponentRegistry;
import com.example.diversifier.session.SessionStore;
import com.example.diversifier.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for a conversational turn: resolve, then record what was shown so the
 * next turn excludes it.
 */
@Service
public class ConversationalRecommendationService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationalRecommendationService.class);

    private final DiversificationResolver resolver;
    private final ComponentRegistry componentRegistry;
    private final CollaboratorGuard collaboratorGuard;
    private final StoreClient storeClient;

    @Value("${app.audit.enabled:true}")
    private boolean auditEnabled;

    public ConversationalRecommendationService(DiversificationResolver resolver, ComponentRegistry componentRegistry,
                                               CollaboratorGuard collaboratorGuard, StoreClient storeClient) {
        this.resolver = resolver;
        this.componentRegistry = componentRegistry;
        this.collaboratorGuard = collaboratorGuard;
        this.storeClient = storeClient;
    }

    public RecommendationResult recommend(RecommendationRequest request) {
        RecommendationResult result = resolver.resolve(request.getSessionId(), request.getUserQuery(), request.getN(),
                request.getExplicitExclusions(), request.getLanguage());

        if (Thread.currentThread().isInterrupted()) {
            logger.info("Request for session {} was cancelled, turn not recorded", request.getSessionId());
            return result;
        }
        recordTurn(request, result);
        return result;
    }

    /**
     * @return the live session, or an empty one when it is absent, expired or unreachable
     */
    public Session getSessionHistory(String sessionId) {
        try {
            return collaboratorGuard.call("session-store",
                    () -> componentRegistry.get(SessionStore.class).getSession(sessionId))
                    .orElseGet(() -> Session.empty(sessionId));
        } catch (RecoverableCollaboratorFailure e) {
            logger.warn("History of session {} unavailable: {}", sessionId, e.getMessage());
            return Session.empty(sessionId);
        }
    }

    private void recordTurn(RecommendationRequest request, RecommendationResult result) {
        Turn turn = Turn.builder()
                .userQuery(request.getUserQuery())
                .detectedCategories(result.getCategoriesUsed())
                .recommendedIds(result.getItems())
                .build();
        Session updated;
        try {
            updated = collaboratorGuard.call("session-store",
                    () -> componentRegistry.get(SessionStore.class).appendTurn(request.getSessionId(), turn));
        } catch (RecoverableCollaboratorFailure e) {
            logger.warn("Turn for session {} not recorded, its items may be shown again: {}",
                    request.getSessionId(), e.getMessage());
            return;
        }
        audit(updated.getId(), updated.lastTurnNumber(), result);
    }

    private void audit(String sessionId, int turnNumber, RecommendationResult result) {
        if (!auditEnabled) {
            return;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "turn_recorded");
        event.put("turnNumber", turnNumber);
        event.put("tierUsed", result.getTierUsed().name());
        event.put("categoriesUsed", result.getCategoriesUsed());
        event.put("items", result.getItems());
        event.put("excludedCount", result.getExcludedCount());
        try {
            collaboratorGuard.call("audit-store", () -> {
                storeClient.appendEvent(sessionId, event);
                return null;
            });
        } catch (RecoverableCollaboratorFailure e) {
            logger.warn("Audit event for session {} turn {} dropped: {}", sessionId, turnNumber, e.getMessage());
        }
    }
}
