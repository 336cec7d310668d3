package com.example.diversifier.catalog;

import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CandidateContext;
import com.example.diversifier.model.CatalogItem;
import com.example.diversifier.repo.CatalogItemRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

public class MongoCandidatePoolSupplier implements CandidatePoolSupplier {

    private static final Logger logger = LoggerFactory.getLogger(MongoCandidatePoolSupplier.class);

    private final CatalogItemRepo catalogItemRepo;

    public MongoCandidatePoolSupplier(CatalogItemRepo catalogItemRepo) {
        this.catalogItemRepo = catalogItemRepo;
    }

    @Override
    public List<Candidate> fetchCandidates(String categoryLabel, CandidateContext context) {
        List<CatalogItem> items = catalogItemRepo.findByCategoryOrderByRankAsc(categoryLabel);
        logger.debug("Fetched {} catalog items for category {}", items.size(), categoryLabel);
        return items.stream()
                .map(item -> Candidate.of(item.getId(), item.isAvailable()))
                .collect(Collectors.toList());
    }
}
