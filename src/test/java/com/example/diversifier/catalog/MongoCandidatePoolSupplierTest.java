package com.example.diversifier.catalog;

import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CatalogItem;
import com.example.diversifier.repo.CatalogItemRepo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoCandidatePoolSupplierTest {

    @Mock
    private CatalogItemRepo catalogItemRepo;

    @InjectMocks
    private MongoCandidatePoolSupplier supplier;

    @Test
    void testFetchCandidates_KeepsRankOrderAndAvailability() {
        CatalogItem first = new CatalogItem();
        first.setId("c-1");
        first.setCategory("CLUTCH");
        first.setRank(1);
        first.setAvailable(true);
        CatalogItem second = new CatalogItem();
        second.setId("c-2");
        second.setCategory("CLUTCH");
        second.setRank(2);
        second.setAvailable(false);
        when(catalogItemRepo.findByCategoryOrderByRankAsc("CLUTCH")).thenReturn(List.of(first, second));

        List<Candidate> candidates = supplier.fetchCandidates("CLUTCH", null);

        assertEquals(List.of(Candidate.of("c-1", true), Candidate.of("c-2", false)), candidates);
    }
}
