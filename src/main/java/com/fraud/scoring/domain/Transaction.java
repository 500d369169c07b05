package com.fraud.scoring.domain;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw transaction as received from the caller. Only the amount is mandatory; every other
 * field has a documented default applied during feature engineering.
 * Timestamps and dates of birth stay raw strings because parsing them is part of scoring
 * (an unparseable value rejects the transaction).
 */
@Value
@Builder
public class Transaction {

    /** Caller's reference, echoed in audit lines and alerts. */
    String transactionId;

    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    BigDecimal amount;

    /** e.g. "2025-12-21T22:41" or "2020-12-22 23:13:39". Null means "now". */
    String timestamp;

    String merchant;
    String category;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    Double latitude;
    @DecimalMin("-180.0") @DecimalMax("180.0")
    Double longitude;
    @DecimalMin("-90.0") @DecimalMax("90.0")
    Double merchantLatitude;
    @DecimalMin("-180.0") @DecimalMax("180.0")
    Double merchantLongitude;

    /** When reported, used verbatim instead of the haversine distance. */
    @PositiveOrZero
    Double distanceFromHomeKm;

    /** ISO date, e.g. "1968-03-19". */
    String dateOfBirth;
    String gender;
    String state;
    String city;
    String zip;
    @PositiveOrZero
    Long cityPopulation;
    String job;
}
