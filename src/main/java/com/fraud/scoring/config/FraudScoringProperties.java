package com.fraud.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Policy constants for the scoring pipeline. Defaults are the production values; override them
 * under {@code fraud.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "fraud")
public class FraudScoringProperties {

    private Features features = new Features();
    private Anomaly anomaly = new Anomaly();
    private Ensemble ensemble = new Ensemble();
    private Scoring scoring = new Scoring();
    private Decision decision = new Decision();
    private Alerts alerts = new Alerts();

    @Data
    public static class Features {
        // Added to the customer's std before dividing, so std=0 never divides by zero.
        private double zScoreEpsilon = 1e-6;
        private double defaultAgeYears = 33.0;
        // Unseen merchant counts as rare, unseen category as common.
        private double defaultMerchantFrequency = 1.0;
        private double defaultCategoryFrequency = 1.0;
        private double defaultDaysSinceLastTransaction = 999.0;
        private List<String> highRiskCategories = new ArrayList<>(List.of("grocery_pos", "shopping_net", "gas_transport"));
        private double longDistanceKm = 100.0;
        private double distantTransactionKm = 80.0;
        // Night window wraps midnight: hour >= start or hour <= end.
        private int nightStartHour = 23;
        private int nightEndHour = 6;
        private List<Integer> fraudPeakHours = new ArrayList<>(List.of(22, 23, 0, 1, 2, 3));
    }

    @Data
    public static class Anomaly {
        private double zScoreThreshold = 3.0;
        private double zScoreHighThreshold = 5.0;
        private double distanceThresholdKm = 80.0;
        private double distanceHighThresholdKm = 500.0;
        // log10(1 + 1/9) ~ 0.046, so only a leading 9 fires.
        private double benfordMinExpected = 0.05;
    }

    @Data
    public static class Ensemble {
        /**
         * Weight per model name, proportional to validation recall. Weight 0 keeps a model in the
         * report but out of the vote. Every loaded model must be listed.
         */
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
                "xgboost", 0.5,
                "lightgbm", 0.3,
                "randomforest", 0.2,
                "best", 0.0));
        private double decisionThreshold = 0.5;
        private double strongAgreementSpread = 0.10;
        private double moderateAgreementSpread = 0.30;
    }

    @Data
    public static class Scoring {
        private double modelMaxPoints = 50.0;
        private double highSeverityPoints = 20.0;
        private double mediumSeverityPoints = 10.0;
        private double lowSeverityPoints = 5.0;
        private double anomalyCap = 40.0;
        private double businessRuleBonus = 10.0;
        private BigDecimal largeAmount = new BigDecimal("10000");
        private int velocityHourLimit = 3;
        private int velocityDayLimit = 15;
        private double modelDiscountZScore = 100.0;
        private double modelDiscountFactor = 0.5;
        private double extremeDeviationZScore = 1000.0;
        private int extremeDeviationScore = 99;
        // Category upper bounds, inclusive. Anything above highMax is CRITICAL.
        private int lowMax = 30;
        private int mediumMax = 60;
        private int highMax = 85;
    }

    @Data
    public static class Decision {
        private int approveBelow = 30;
        private int blockAbove = 90;
        private int reviewConfidence = 50;
    }

    @Data
    public static class Alerts {
        /** When false, blocked and reviewed transactions are decided but raise no alert. */
        private boolean enabled = true;
        private int maxKeyFactors = 5;
    }
}
