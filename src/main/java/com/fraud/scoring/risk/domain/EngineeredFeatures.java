package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Features derived once per transaction. Every column listed in {@link FeatureColumn} is a typed
 * field here, so a feature cannot go missing; {@code build()} rejects non-finite numerics and
 * empty categoricals.
 */
@Value
@Builder(buildMethodName = "buildUnvalidated")
public class EngineeredFeatures {

    double amt;
    double lat;
    double lon;
    double cityPop;
    double merchLat;
    double merchLong;

    int hour;
    /** Monday = 0. */
    int dayOfWeek;
    int dayOfMonth;
    int month;
    int year;
    boolean weekend;
    boolean night;
    boolean businessHours;
    double hourSin;
    double hourCos;
    double dayOfWeekSin;
    double dayOfWeekCos;
    double monthSin;
    double monthCos;
    double dayOfMonthSin;
    double dayOfMonthCos;
    double age;

    double distanceKm;
    boolean longDistance;

    double logAmt;
    double sqrtAmt;
    double amtRounded;
    boolean roundAmt;
    boolean exactDollar;

    double merchFreq;
    double catFreq;
    boolean highRiskCat;

    int firstDigit;
    double benfordExpected;
    double benfordLogProb;
    boolean fraudPeakHour;
    double hourRiskScore;
    boolean highRiskAmt;
    boolean distantTx;

    int custTxCount;
    double daysSinceLastTx;
    double custAvgAmt;
    double custStdAmt;
    double amtZScore;

    double amtXDist;
    double amtXNight;
    double distXWeekend;
    double ageXAmt;

    String category;
    String gender;
    String state;
    String job;
    String timeOfDay;
    String ageGroup;
    String distanceCat;
    String amtTier;

    /**
     * Column name to value, in encoder order. Used for audit output.
     */
    public Map<String, Object> toColumnMap() {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (FeatureColumn column : FeatureColumn.values()) {
            columns.put(column.columnName(), column.rawValue(this));
        }
        return columns;
    }

    public static class EngineeredFeaturesBuilder {

        public EngineeredFeatures build() {
            EngineeredFeatures features = buildUnvalidated();
            FeatureColumn.validate(features);
            return features;
        }
    }
}
