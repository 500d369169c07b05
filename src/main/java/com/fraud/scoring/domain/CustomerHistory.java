package com.fraud.scoring.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Customer baseline supplied by the upstream feature store. May be degenerate (single
 * transaction, zero standard deviation); scoring never divides by a literal zero.
 */
@Value
@Builder
public class CustomerHistory {

    double averageAmount;
    double stdAmount;
    int transactionCount;
    /** Hours of day (0-23) the customer usually transacts in. Empty or null means unknown. */
    Set<Integer> usualHours;
    /** Days since the previous transaction, when known. */
    Double daysSinceLastTransaction;

    // Velocity counters
    Integer transactionsLastHour;
    Integer transactionsLast24Hours;

    public boolean hasUsualHours() {
        return usualHours != null && !usualHours.isEmpty();
    }
}
