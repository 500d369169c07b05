package com.fraud.scoring.risk.domain;

import com.fraud.scoring.api.FeatureContractException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Catalogue of every feature the trained models were fitted on, in the fixed order the
 * encoder expects. Column names match the training pipeline exactly.
 */
public enum FeatureColumn {

    // Raw numerics
    AMT("amt", FeatureType.NUMERIC, EngineeredFeatures::getAmt),
    LAT("lat", FeatureType.NUMERIC, EngineeredFeatures::getLat),
    LONG("long", FeatureType.NUMERIC, EngineeredFeatures::getLon),
    CITY_POP("city_pop", FeatureType.NUMERIC, EngineeredFeatures::getCityPop),
    MERCH_LAT("merch_lat", FeatureType.NUMERIC, EngineeredFeatures::getMerchLat),
    MERCH_LONG("merch_long", FeatureType.NUMERIC, EngineeredFeatures::getMerchLong),

    // Temporal
    HOUR("hour", FeatureType.NUMERIC, EngineeredFeatures::getHour),
    DAY_OF_WEEK("day_of_week", FeatureType.NUMERIC, EngineeredFeatures::getDayOfWeek),
    DAY_OF_MONTH("day_of_month", FeatureType.NUMERIC, EngineeredFeatures::getDayOfMonth),
    MONTH("month", FeatureType.NUMERIC, EngineeredFeatures::getMonth),
    YEAR("year", FeatureType.NUMERIC, EngineeredFeatures::getYear),
    IS_WEEKEND("is_weekend", FeatureType.FLAG, EngineeredFeatures::isWeekend),
    IS_NIGHT("is_night", FeatureType.FLAG, EngineeredFeatures::isNight),
    IS_BUSINESS_HOURS("is_business_hours", FeatureType.FLAG, EngineeredFeatures::isBusinessHours),
    HOUR_SIN("hour_sin", FeatureType.NUMERIC, EngineeredFeatures::getHourSin),
    HOUR_COS("hour_cos", FeatureType.NUMERIC, EngineeredFeatures::getHourCos),
    DAY_OF_WEEK_SIN("day_of_week_sin", FeatureType.NUMERIC, EngineeredFeatures::getDayOfWeekSin),
    DAY_OF_WEEK_COS("day_of_week_cos", FeatureType.NUMERIC, EngineeredFeatures::getDayOfWeekCos),
    MONTH_SIN("month_sin", FeatureType.NUMERIC, EngineeredFeatures::getMonthSin),
    MONTH_COS("month_cos", FeatureType.NUMERIC, EngineeredFeatures::getMonthCos),
    DAY_OF_MONTH_SIN("day_of_month_sin", FeatureType.NUMERIC, EngineeredFeatures::getDayOfMonthSin),
    DAY_OF_MONTH_COS("day_of_month_cos", FeatureType.NUMERIC, EngineeredFeatures::getDayOfMonthCos),
    AGE("age", FeatureType.NUMERIC, EngineeredFeatures::getAge),

    // Geospatial
    DISTANCE_KM("distance_km", FeatureType.NUMERIC, EngineeredFeatures::getDistanceKm),
    IS_LONG_DISTANCE("is_long_distance", FeatureType.FLAG, EngineeredFeatures::isLongDistance),

    // Amount profile
    LOG_AMT("log_amt", FeatureType.NUMERIC, EngineeredFeatures::getLogAmt),
    SQRT_AMT("sqrt_amt", FeatureType.NUMERIC, EngineeredFeatures::getSqrtAmt),
    AMT_ROUNDED("amt_rounded", FeatureType.NUMERIC, EngineeredFeatures::getAmtRounded),
    IS_ROUND_AMT("is_round_amt", FeatureType.FLAG, EngineeredFeatures::isRoundAmt),
    IS_EXACT_DOLLAR("is_exact_dollar", FeatureType.FLAG, EngineeredFeatures::isExactDollar),

    // Merchant / category
    MERCH_FREQ("merch_freq", FeatureType.NUMERIC, EngineeredFeatures::getMerchFreq),
    CAT_FREQ("cat_freq", FeatureType.NUMERIC, EngineeredFeatures::getCatFreq),
    IS_HIGH_RISK_CAT("is_high_risk_cat", FeatureType.FLAG, EngineeredFeatures::isHighRiskCat),

    // EDA indicators
    FIRST_DIGIT("first_digit", FeatureType.NUMERIC, EngineeredFeatures::getFirstDigit),
    BENFORD_EXPECTED("benford_expected", FeatureType.NUMERIC, EngineeredFeatures::getBenfordExpected),
    BENFORD_LOG_PROB("benford_log_prob", FeatureType.NUMERIC, EngineeredFeatures::getBenfordLogProb),
    IS_FRAUD_PEAK_HOUR("is_fraud_peak_hour", FeatureType.FLAG, EngineeredFeatures::isFraudPeakHour),
    HOUR_RISK_SCORE("hour_risk_score", FeatureType.NUMERIC, EngineeredFeatures::getHourRiskScore),
    IS_HIGH_RISK_AMT("is_high_risk_amt", FeatureType.FLAG, EngineeredFeatures::isHighRiskAmt),
    IS_DISTANT_TX("is_distant_tx", FeatureType.FLAG, EngineeredFeatures::isDistantTx),

    // Customer behaviour
    CUST_TX_COUNT("cust_tx_count", FeatureType.NUMERIC, EngineeredFeatures::getCustTxCount),
    DAYS_SINCE_LAST_TX("days_since_last_tx", FeatureType.NUMERIC, EngineeredFeatures::getDaysSinceLastTx),
    CUST_AVG_AMT("cust_avg_amt", FeatureType.NUMERIC, EngineeredFeatures::getCustAvgAmt),
    CUST_STD_AMT("cust_std_amt", FeatureType.NUMERIC, EngineeredFeatures::getCustStdAmt),
    AMT_Z_SCORE("amt_z_score", FeatureType.NUMERIC, EngineeredFeatures::getAmtZScore),

    // Interactions
    AMT_X_DIST("amt_x_dist", FeatureType.NUMERIC, EngineeredFeatures::getAmtXDist),
    AMT_X_NIGHT("amt_x_night", FeatureType.NUMERIC, EngineeredFeatures::getAmtXNight),
    DIST_X_WEEKEND("dist_x_weekend", FeatureType.NUMERIC, EngineeredFeatures::getDistXWeekend),
    AGE_X_AMT("age_x_amt", FeatureType.NUMERIC, EngineeredFeatures::getAgeXAmt),

    // Categoricals
    CATEGORY("category", FeatureType.CATEGORICAL, EngineeredFeatures::getCategory),
    GENDER("gender", FeatureType.CATEGORICAL, EngineeredFeatures::getGender),
    STATE("state", FeatureType.CATEGORICAL, EngineeredFeatures::getState),
    JOB("job", FeatureType.CATEGORICAL, EngineeredFeatures::getJob),
    TIME_OF_DAY("time_of_day", FeatureType.CATEGORICAL, EngineeredFeatures::getTimeOfDay),
    AGE_GROUP("age_group", FeatureType.CATEGORICAL, EngineeredFeatures::getAgeGroup),
    DISTANCE_CAT("distance_cat", FeatureType.CATEGORICAL, EngineeredFeatures::getDistanceCat),
    AMT_TIER("amt_tier", FeatureType.CATEGORICAL, EngineeredFeatures::getAmtTier);

    private static final Map<String, FeatureColumn> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(
                    FeatureColumn::columnName, c -> c, (a, b) -> a, LinkedHashMap::new)));

    private final String columnName;
    private final FeatureType type;
    private final Function<EngineeredFeatures, Object> accessor;

    FeatureColumn(String columnName, FeatureType type, Function<EngineeredFeatures, Object> accessor) {
        this.columnName = columnName;
        this.type = type;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

    public FeatureType type() {
        return type;
    }

    public static Optional<FeatureColumn> byName(String columnName) {
        return Optional.ofNullable(BY_NAME.get(columnName));
    }

    public Object rawValue(EngineeredFeatures features) {
        return accessor.apply(features);
    }

    /**
     * Value of a NUMERIC or FLAG column as the encoder consumes it.
     */
    public double numericValue(EngineeredFeatures features) {
        Object value = rawValue(features);
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new FeatureContractException("Column '" + columnName + "' is " + type + ", not numeric");
    }

    public String categoricalValue(EngineeredFeatures features) {
        if (type != FeatureType.CATEGORICAL) {
            throw new FeatureContractException("Column '" + columnName + "' is " + type + ", not categorical");
        }
        return (String) rawValue(features);
    }

    /**
     * Rejects feature sets that would feed NaN, infinity or a missing category into the encoder.
     */
    static void validate(EngineeredFeatures features) {
        for (FeatureColumn column : values()) {
            if (column.type == FeatureType.CATEGORICAL) {
                String value = column.categoricalValue(features);
                if (value == null || value.isBlank()) {
                    throw new FeatureContractException("Categorical column '" + column.columnName + "' has no value");
                }
            } else {
                double value = column.numericValue(features);
                if (!Double.isFinite(value)) {
                    throw new FeatureContractException("Numeric column '" + column.columnName + "' is not finite: " + value);
                }
            }
        }
    }
}
