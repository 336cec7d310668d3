package com.example.diversifier.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("catalog_items")
@CompoundIndex(name = "category_rank", def = "{'category': 1, 'rank': 1}")
public class CatalogItem {
    @Id
    private String id;
    private String category;
    private int rank;
    private boolean available;
    private Instant rankedAt;
}
