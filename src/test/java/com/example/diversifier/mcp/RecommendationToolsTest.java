package com.example.diversifier.mcp;

import com.example.diversifier.model.*;
import com.example.diversifier.service.ConversationalRecommendationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecommendationToolsTest {

    @Mock
    private ConversationalRecommendationService recommendationService;

    private RecommendationTools tools;

    @BeforeEach
    void setUp() {
        tools = new RecommendationTools(recommendationService);
        ReflectionTestUtils.setField(tools, "defaultN", 5);
        ReflectionTestUtils.setField(tools, "maxN", 50);
    }

    @Test
    void testRecommend_BuildsRequestWithDefaults() {
        // Given
        when(recommendationService.recommend(any(RecommendationRequest.class))).thenReturn(result());

        // When
        Map<String, Object> response = tools.recommend("s1", "aros dorados", null, List.of("x1", "x1"), " ");

        // Then
        ArgumentCaptor<RecommendationRequest> captor = ArgumentCaptor.forClass(RecommendationRequest.class);
        verify(recommendationService).recommend(captor.capture());
        RecommendationRequest request = captor.getValue();
        assertEquals("s1", request.getSessionId());
        assertEquals(5, request.getN());
        assertEquals(Set.of("x1"), request.getExplicitExclusions());
        assertNull(request.getLanguage());

        assertEquals(List.of("a1"), response.get("items"));
        assertEquals(Tier.QUERY_DRIVEN, response.get("tierUsed"));
        @SuppressWarnings("unchecked")
        Map<String, Object> diagnostics = (Map<String, Object>) response.get("diagnostics");
        assertEquals("history loaded", diagnostics.get("history"));
    }

    @Test
    void testRecommend_RejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> tools.recommend(" ", "q", 3, null, null));
        assertThrows(IllegalArgumentException.class, () -> tools.recommend(null, "q", 3, null, null));
        assertThrows(IllegalArgumentException.class, () -> tools.recommend("s1", "q", -1, null, null));
        assertThrows(IllegalArgumentException.class, () -> tools.recommend("s1", "q", 51, null, null));
        verifyNoInteractions(recommendationService);
    }

    @Test
    void testRecommend_ZeroIsAccepted() {
        when(recommendationService.recommend(any(RecommendationRequest.class))).thenReturn(result());

        tools.recommend("s1", "q", 0, null, "es");

        verify(recommendationService).recommend(argThat(r -> r.getN() == 0 && "es".equals(r.getLanguage())));
    }

    @Test
    void testSessionHistory_FlattensTurns() {
        Turn turn = Turn.builder()
                .turnNumber(1)
                .userQuery("aros")
                .detectedCategories(List.of("AROS"))
                .recommendedIds(List.of("a1", "a2"))
                .timestamp(Instant.parse("2025-10-01T10:00:00Z"))
                .build();
        when(recommendationService.getSessionHistory("s1")).thenReturn(Session.builder()
                .id("s1")
                .turns(List.of(turn))
                .lastUpdated(Instant.parse("2025-10-01T10:00:00Z"))
                .build());

        Map<String, Object> response = tools.session_history("s1");

        assertEquals(2, response.get("shownItemCount"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> turns = (List<Map<String, Object>>) response.get("turns");
        assertEquals(1, turns.size());
        assertEquals("2025-10-01T10:00:00Z", turns.get(0).get("timestamp"));
        assertEquals(List.of("a1", "a2"), turns.get(0).get("recommendedIds"));
    }

    private static RecommendationResult result() {
        return RecommendationResult.builder()
                .items(List.of("a1"))
                .tierUsed(Tier.QUERY_DRIVEN)
                .categoriesUsed(List.of("AROS"))
                .excludedCount(1)
                .diagnostics(ResolutionDiagnostics.builder()
                        .historyStatus(HistoryStatus.LOADED)
                        .pseudoEventCount(0)
                        .allocations(Map.of("AROS", 1))
                        .taxonomyVersion("v1")
                        .build())
                .build();
    }
}
