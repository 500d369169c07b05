package com.fraud.scoring.risk.engine;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.domain.CustomerHistory;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Business conditions that earn the fixed bonus in the risk score.
 */
@Component
public class BusinessRuleEvaluator {

    private final FraudScoringProperties.Scoring config;

    public BusinessRuleEvaluator(FraudScoringProperties properties) {
        this.config = properties.getScoring();
    }

    public Set<BusinessRuleFlag> evaluate(EngineeredFeatures features, CustomerHistory history, AnomalyReport report) {
        Set<BusinessRuleFlag> flags = EnumSet.noneOf(BusinessRuleFlag.class);
        if (BigDecimal.valueOf(features.getAmt()).compareTo(config.getLargeAmount()) >= 0) {
            flags.add(BusinessRuleFlag.LARGE_AMOUNT);
        }
        if (features.isHighRiskCat()) {
            flags.add(BusinessRuleFlag.HIGH_RISK_CATEGORY);
        }
        if (features.getCustTxCount() <= 1) {
            flags.add(BusinessRuleFlag.NEW_CUSTOMER);
        }
        if (isHighVelocity(history)) {
            flags.add(BusinessRuleFlag.HIGH_VELOCITY);
        }
        if (report.elevatedCount() >= 2) {
            flags.add(BusinessRuleFlag.MULTIPLE_ELEVATED_ANOMALIES);
        }
        return Collections.unmodifiableSet(flags);
    }

    private boolean isHighVelocity(CustomerHistory history) {
        if (history == null) return false;
        Integer lastHour = history.getTransactionsLastHour();
        Integer lastDay = history.getTransactionsLast24Hours();
        return (lastHour != null && lastHour > config.getVelocityHourLimit())
                || (lastDay != null && lastDay > config.getVelocityDayLimit());
    }
}
