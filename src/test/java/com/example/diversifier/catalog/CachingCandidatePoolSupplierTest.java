package com.example.diversifier.catalog;

import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CandidateContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingCandidatePoolSupplierTest {

    @Mock
    private CandidatePoolSupplier delegate;

    private CachingCandidatePoolSupplier supplier;
    private final CandidateContext context = CandidateContext.builder().sessionId("s1").build();

    @BeforeEach
    void setUp() {
        supplier = new CachingCandidatePoolSupplier(delegate, Duration.ofMinutes(1), 100);
    }

    @Test
    void testFetchCandidates_CachesPerCategory() {
        when(delegate.fetchCandidates(eq("ZAPATOS"), any())).thenReturn(List.of(Candidate.of("z1", true)));

        supplier.fetchCandidates("ZAPATOS", context);
        List<Candidate> cached = supplier.fetchCandidates("ZAPATOS", CandidateContext.builder().sessionId("s2").build());

        assertEquals(List.of(Candidate.of("z1", true)), cached);
        verify(delegate, times(1)).fetchCandidates(eq("ZAPATOS"), any());
    }

    @Test
    void testFetchCandidates_FailureIsNotCached() {
        when(delegate.fetchCandidates(eq("AROS"), any()))
                .thenThrow(new RuntimeException("mongo timeout"))
                .thenReturn(List.of(Candidate.of("a1", true)));

        assertThrows(RuntimeException.class, () -> supplier.fetchCandidates("AROS", context));
        assertEquals(1, supplier.fetchCandidates("AROS", context).size());
    }
}
