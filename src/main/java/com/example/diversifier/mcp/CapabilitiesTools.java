package com.example.diversifier.mcp;

import com.example.diversifier.provisioning.ComponentRegistry;
import com.example.diversifier.taxonomy.CategoryTaxonomy;
import com.example.diversifier.taxonomy.TaxonomyProvider;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    private final TaxonomyProvider taxonomyProvider;
    private final ComponentRegistry componentRegistry;

    public CapabilitiesTools(TaxonomyProvider taxonomyProvider, ComponentRegistry componentRegistry) {
        this.taxonomyProvider = taxonomyProvider;
        this.componentRegistry = componentRegistry;
    }

    @Tool(description = "List the server's tools, the category taxonomy in use and the state of its collaborators")
    public Map<String,Object> capabilities_list() {
        CategoryTaxonomy taxonomy = taxonomyProvider.currentTaxonomy();
        return Map.of(
                "server", Map.of("name", "conversational-diversifier", "version", "0.1.0"),
                "tools", List.of("recommend", "session_history", "capabilities_list"),
                "taxonomy", Map.of(
                    "version", taxonomy.getVersion(),
                    "categories", List.copyOf(taxonomy.getConcreteCategories()),
                    "languages", List.copyOf(taxonomy.languages())
                ),
                "components", componentRegistry.status()
        );
    }
}
