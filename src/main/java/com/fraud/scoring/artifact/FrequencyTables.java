package com.fraud.scoring.artifact;

import java.util.Map;

/**
 * Merchant and category occurrence counts from the training data. Lookups are exact string
 * matches; anything unseen gets the caller's default.
 */
public final class FrequencyTables {

    private final Map<String, Double> merchantCounts;
    private final Map<String, Double> categoryCounts;

    public FrequencyTables(Map<String, Double> merchantCounts, Map<String, Double> categoryCounts) {
        this.merchantCounts = Map.copyOf(merchantCounts);
        this.categoryCounts = Map.copyOf(categoryCounts);
    }

    public static FrequencyTables empty() {
        return new FrequencyTables(Map.of(), Map.of());
    }

    public double merchantFrequency(String merchant, double defaultFrequency) {
        return lookup(merchantCounts, merchant, defaultFrequency);
    }

    public double categoryFrequency(String category, double defaultFrequency) {
        return lookup(categoryCounts, category, defaultFrequency);
    }

    public int merchantCount() {
        return merchantCounts.size();
    }

    public int categoryCount() {
        return categoryCounts.size();
    }

    private static double lookup(Map<String, Double> table, String key, double defaultFrequency) {
        if (key == null) return defaultFrequency;
        Double value = table.get(key);
        return value != null ? value : defaultFrequency;
    }
}
