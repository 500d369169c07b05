package com.fraud.scoring.core;

import com.fraud.scoring.api.InvalidInputException;
import com.fraud.scoring.domain.CustomerHistory;
import com.fraud.scoring.domain.Transaction;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejects transactions and customer baselines that cannot be scored. Field constraints live on
 * {@link Transaction}; the baseline is checked by hand since it arrives from a trusted store.
 */
@Component
@RequiredArgsConstructor
public class TransactionValidator {

    private final Validator validator;

    public void validate(Transaction transaction, CustomerHistory history) {
        if (transaction == null) {
            throw new InvalidInputException("Transaction is required");
        }
        Set<ConstraintViolation<Transaction>> violations = validator.validate(transaction);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidInputException("Invalid transaction " + transaction.getTransactionId() + ": " + message);
        }
        validateFinite(transaction);
        if (history != null) {
            validateHistory(history);
        }
    }

    // Range constraints let +/-Infinity through and say nothing about BigDecimal overflow.
    private void validateFinite(Transaction transaction) {
        if (!Double.isFinite(transaction.getAmount().doubleValue())) {
            throw new InvalidInputException("Invalid transaction " + transaction.getTransactionId()
                    + ": amount " + transaction.getAmount().toPlainString() + " is out of range");
        }
        requireFinite(transaction, "latitude", transaction.getLatitude());
        requireFinite(transaction, "longitude", transaction.getLongitude());
        requireFinite(transaction, "merchantLatitude", transaction.getMerchantLatitude());
        requireFinite(transaction, "merchantLongitude", transaction.getMerchantLongitude());
        requireFinite(transaction, "distanceFromHomeKm", transaction.getDistanceFromHomeKm());
    }

    private static void requireFinite(Transaction transaction, String field, Double value) {
        if (value != null && !Double.isFinite(value)) {
            throw new InvalidInputException("Invalid transaction " + transaction.getTransactionId()
                    + ": " + field + " must be finite, got " + value);
        }
    }

    private void validateHistory(CustomerHistory history) {
        if (!Double.isFinite(history.getAverageAmount()) || !Double.isFinite(history.getStdAmount())) {
            throw new InvalidInputException("Customer baseline must be finite");
        }
        if (history.getStdAmount() < 0) {
            throw new InvalidInputException("Customer std amount must be >= 0, got " + history.getStdAmount());
        }
        if (history.getTransactionCount() < 0) {
            throw new InvalidInputException("Customer transaction count must be >= 0, got " + history.getTransactionCount());
        }
        if (history.hasUsualHours()) {
            for (Integer hour : history.getUsualHours()) {
                if (hour == null || hour < 0 || hour > 23) {
                    throw new InvalidInputException("Usual hours must be 0-23, got " + hour);
                }
            }
        }
        if (history.getDaysSinceLastTransaction() != null && history.getDaysSinceLastTransaction() < 0) {
            throw new InvalidInputException("Days since last transaction must be >= 0");
        }
    }
}
