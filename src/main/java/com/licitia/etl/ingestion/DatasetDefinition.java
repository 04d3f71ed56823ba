package com.licitia.etl.ingestion;

import com.licitia.etl.domain.enums.Frequency;

import java.util.List;
import java.util.Map;

/**
 * A source portal and the subsets it publishes.
 *
 * @param requiresYears     extraction needs a year range; scheduled runs use the current year
 * @param naturalIdColumn   extract column holding the source identifier
 * @param frequencyOverrides per-subset frequencies that differ from {@code defaultFrequency}
 */
public record DatasetDefinition(
        String name,
        List<String> subsets,
        Frequency defaultFrequency,
        boolean requiresYears,
        String naturalIdColumn,
        Map<String, Frequency> frequencyOverrides
) {

    public DatasetDefinition {
        subsets = List.copyOf(subsets);
        frequencyOverrides = Map.copyOf(frequencyOverrides);
    }

    public boolean hasSubset(String subset) {
        return subsets.contains(subset);
    }

    public Frequency frequencyFor(String subset) {
        return frequencyOverrides.getOrDefault(subset, defaultFrequency);
    }
}
