package com.fraud.scoring.risk.features;

import com.fraud.scoring.artifact.ArtifactBundle;
import com.fraud.scoring.artifact.FrequencyTables;
import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.core.TransactionValidator;
import com.fraud.scoring.domain.CustomerHistory;
import com.fraud.scoring.domain.Transaction;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Turns a raw transaction plus the customer's baseline into the full feature set the models
 * were trained on. Pure apart from the clock read when the timestamp is absent: the same input
 * always yields the same features.
 */
@Slf4j
@Component
public class FeatureEngineer {

    private final FraudScoringProperties.Features config;
    private final FrequencyTables frequencyTables;
    private final TransactionValidator validator;
    private final Clock clock;

    public FeatureEngineer(FraudScoringProperties properties,
                           ArtifactBundle artifacts,
                           TransactionValidator validator,
                           Clock clock) {
        this.config = properties.getFeatures();
        this.frequencyTables = artifacts.getFrequencyTables();
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * @param history customer baseline; null (or a zero count) means a first-time customer
     * @throws com.fraud.scoring.api.InvalidInputException when the amount is missing or not
     *         positive, or a timestamp cannot be parsed
     */
    public EngineeredFeatures engineer(Transaction transaction, CustomerHistory history) {
        validator.validate(transaction, history);

        LocalDateTime time = isBlank(transaction.getTimestamp())
                ? LocalDateTime.now(clock)
                : TimestampParser.parseDateTime(transaction.getTimestamp(), "timestamp");
        BigDecimal amount = transaction.getAmount();
        double amt = amount.doubleValue();

        EngineeredFeatures.EngineeredFeaturesBuilder builder = EngineeredFeatures.builder()
                .amt(amt)
                .lat(orZero(transaction.getLatitude()))
                .lon(orZero(transaction.getLongitude()))
                .cityPop(transaction.getCityPopulation() != null ? transaction.getCityPopulation() : 0.0)
                .merchLat(orZero(transaction.getMerchantLatitude()))
                .merchLong(orZero(transaction.getMerchantLongitude()));

        int hour = time.getHour();
        boolean night = applyTemporal(builder, time);
        double age = age(transaction.getDateOfBirth(), time);
        builder.age(age).ageGroup(ageGroup(age));

        double distance = distanceKm(transaction);
        builder.distanceKm(distance)
                .longDistance(distance > config.getLongDistanceKm())
                .distantTx(distance > config.getDistantTransactionKm())
                .distanceCat(distanceCategory(distance));

        double logAmt = Math.log1p(amt);
        builder.logAmt(logAmt)
                .sqrtAmt(Math.sqrt(amt))
                .amtRounded(Math.rint(amt / 10.0) * 10.0)
                .roundAmt(amount.remainder(BigDecimal.TEN).signum() == 0)
                .exactDollar(amount.stripTrailingZeros().scale() <= 0)
                .highRiskAmt(logAmt >= 6.0 && logAmt <= 8.0)
                .amtTier(amountTier(amt));

        String category = orDefault(transaction.getCategory(), "unknown");
        builder.merchFreq(frequencyTables.merchantFrequency(transaction.getMerchant(), config.getDefaultMerchantFrequency()))
                .catFreq(frequencyTables.categoryFrequency(category, config.getDefaultCategoryFrequency()))
                .highRiskCat(config.getHighRiskCategories().contains(category));

        int firstDigit = BenfordLaw.firstSignificantDigit(amount);
        double expected = BenfordLaw.expectedProbability(firstDigit);
        builder.firstDigit(firstDigit)
                .benfordExpected(expected)
                .benfordLogProb(Math.log(expected))
                .fraudPeakHour(config.getFraudPeakHours().contains(hour))
                .hourRiskScore(hourRiskScore(hour));

        double zScore = applyBehaviour(builder, amt, history);

        builder.amtXDist(amt * distance)
                .amtXNight(night ? amt : 0.0)
                .distXWeekend(time.getDayOfWeek().getValue() >= 6 ? distance : 0.0)
                .ageXAmt(age * amt);

        builder.category(category)
                .gender(orDefault(transaction.getGender(), "F"))
                .state(orDefault(transaction.getState(), "unknown"))
                .job(orDefault(transaction.getJob(), "unknown"));

        EngineeredFeatures features = builder.build();
        log.debug("Features for {}: hour={}, distanceKm={}, zScore={}, category={}",
                transaction.getTransactionId(), hour, distance, zScore, category);
        return features;
    }

    /** Returns whether the hour falls in the night window. */
    private boolean applyTemporal(EngineeredFeatures.EngineeredFeaturesBuilder builder, LocalDateTime time) {
        int hour = time.getHour();
        int dayOfWeek = time.getDayOfWeek().getValue() - 1;
        int dayOfMonth = time.getDayOfMonth();
        int month = time.getMonthValue();
        boolean night = hour >= config.getNightStartHour() || hour <= config.getNightEndHour();

        builder.hour(hour)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .month(month)
                .year(time.getYear())
                .weekend(dayOfWeek >= 5)
                .night(night)
                .businessHours(hour >= 9 && hour <= 17)
                .timeOfDay(timeOfDay(hour))
                .hourSin(Math.sin(2 * Math.PI * hour / 24))
                .hourCos(Math.cos(2 * Math.PI * hour / 24))
                .dayOfWeekSin(Math.sin(2 * Math.PI * dayOfWeek / 7))
                .dayOfWeekCos(Math.cos(2 * Math.PI * dayOfWeek / 7))
                .monthSin(Math.sin(2 * Math.PI * month / 12))
                .monthCos(Math.cos(2 * Math.PI * month / 12))
                .dayOfMonthSin(Math.sin(2 * Math.PI * dayOfMonth / 31))
                .dayOfMonthCos(Math.cos(2 * Math.PI * dayOfMonth / 31));
        return night;
    }

    /** Applies the customer baseline and returns the amount z-score. */
    private double applyBehaviour(EngineeredFeatures.EngineeredFeaturesBuilder builder, double amt, CustomerHistory history) {
        if (history == null || history.getTransactionCount() <= 0) {
            // First transaction: the customer is their own baseline.
            builder.custTxCount(1)
                    .custAvgAmt(amt)
                    .custStdAmt(0.0)
                    .amtZScore(0.0)
                    .daysSinceLastTx(config.getDefaultDaysSinceLastTransaction());
            return 0.0;
        }
        double zScore = (amt - history.getAverageAmount()) / (history.getStdAmount() + config.getZScoreEpsilon());
        builder.custTxCount(history.getTransactionCount())
                .custAvgAmt(history.getAverageAmount())
                .custStdAmt(history.getStdAmount())
                .amtZScore(zScore)
                .daysSinceLastTx(history.getDaysSinceLastTransaction() != null
                        ? history.getDaysSinceLastTransaction()
                        : config.getDefaultDaysSinceLastTransaction());
        return zScore;
    }

    private double age(String dateOfBirth, LocalDateTime time) {
        if (isBlank(dateOfBirth)) {
            return config.getDefaultAgeYears();
        }
        LocalDate dob = TimestampParser.parseDate(dateOfBirth, "date of birth");
        return ChronoUnit.DAYS.between(dob.atStartOfDay(), time) / 365.25;
    }

    private double distanceKm(Transaction transaction) {
        if (transaction.getDistanceFromHomeKm() != null) {
            return transaction.getDistanceFromHomeKm();
        }
        if (transaction.getLatitude() != null && transaction.getLongitude() != null
                && transaction.getMerchantLatitude() != null && transaction.getMerchantLongitude() != null) {
            return GeoDistance.haversineKm(transaction.getLatitude(), transaction.getLongitude(),
                    transaction.getMerchantLatitude(), transaction.getMerchantLongitude());
        }
        return 0.0;
    }

    static String timeOfDay(int hour) {
        if (hour >= 6 && hour < 12) return "morning";
        if (hour >= 12 && hour < 18) return "afternoon";
        if (hour >= 18) return "evening";
        return "night";
    }

    static double hourRiskScore(int hour) {
        if (hour <= 3) return 0.25;
        if (hour >= 22) return 0.26;
        return 0.01;
    }

    // Bins are right-inclusive: (lower, upper].
    static String ageGroup(double age) {
        if (age <= 0 || age > 100) return "unknown";
        if (age <= 25) return "<25";
        if (age <= 35) return "25-35";
        if (age <= 50) return "35-50";
        if (age <= 65) return "50-65";
        return "65+";
    }

    static String distanceCategory(double distanceKm) {
        if (distanceKm <= 5) return "very_close";
        if (distanceKm <= 25) return "close";
        if (distanceKm <= 100) return "medium";
        if (distanceKm <= 500) return "far";
        return "very_far";
    }

    static String amountTier(double amt) {
        if (amt <= 10) return "micro";
        if (amt <= 50) return "small";
        if (amt <= 100) return "medium";
        if (amt <= 500) return "large";
        return "very_large";
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
