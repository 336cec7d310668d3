package com.example.diversifier.catalog;

import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CandidateContext;

import java.util.List;

public class EmptyCandidatePoolSupplier implements CandidatePoolSupplier {

    @Override
    public List<Candidate> fetchCandidates(String categoryLabel, CandidateContext context) {
        return List.of();
    }
}
