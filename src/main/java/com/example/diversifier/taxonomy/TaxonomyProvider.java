package com.example.diversifier.taxonomy;

public interface TaxonomyProvider {
    CategoryTaxonomy currentTaxonomy();
}
