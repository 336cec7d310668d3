package com.example.diversifier.repo;

import com.example.diversifier.model.CatalogItem;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CatalogItemRepo extends MongoRepository<CatalogItem, String> {
    List<CatalogItem> findByCategoryOrderByRankAsc(String category);
}
