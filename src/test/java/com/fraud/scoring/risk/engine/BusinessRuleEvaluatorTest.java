package com.fraud.scoring.risk.engine;

import com.fraud.scoring.TestData;
import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.domain.CustomerHistory;
import com.fraud.scoring.risk.domain.AnomalyDimension;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import com.fraud.scoring.risk.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.fraud.scoring.risk.engine.RiskScorerTest.fired;
import static com.fraud.scoring.risk.engine.RiskScorerTest.report;
import static org.assertj.core.api.Assertions.assertThat;

class BusinessRuleEvaluatorTest {

    private BusinessRuleEvaluator evaluator;
    private CustomerHistory regular;

    @BeforeEach
    void setUp() {
        evaluator = new BusinessRuleEvaluator(new FraudScoringProperties());
        regular = TestData.regularCustomer().build();
    }

    @Test
    void ordinaryTransactionRaisesNoFlag() {
        EngineeredFeatures features = TestData.features(TestData.normalTransaction().build(), regular);

        assertThat(evaluator.evaluate(features, regular, report(0.0))).isEmpty();
    }

    @Test
    void largeAmountThresholdIsInclusive() {
        CustomerHistory rich = TestData.regularCustomer().averageAmount(10000.0).stdAmount(5000.0).build();
        EngineeredFeatures features = TestData.features(
                TestData.normalTransaction().amount(new BigDecimal("10000.00")).build(), rich);

        assertThat(evaluator.evaluate(features, rich, report(0.0))).containsExactly(BusinessRuleFlag.LARGE_AMOUNT);
    }

    @Test
    void flagsHighRiskCategoryAndNewCustomer() {
        EngineeredFeatures features = TestData.features(
                TestData.normalTransaction().category("grocery_pos").build(), null);

        assertThat(evaluator.evaluate(features, null, report(0.0)))
                .containsExactlyInAnyOrder(BusinessRuleFlag.HIGH_RISK_CATEGORY, BusinessRuleFlag.NEW_CUSTOMER);
    }

    @Test
    void velocityUsesHourAndDayCounters() {
        EngineeredFeatures features = TestData.features(TestData.normalTransaction().build(), regular);
        CustomerHistory burstHour = TestData.regularCustomer().transactionsLastHour(4).build();
        CustomerHistory busyDay = TestData.regularCustomer().transactionsLastHour(1).transactionsLast24Hours(16).build();
        CustomerHistory atLimit = TestData.regularCustomer().transactionsLastHour(3).transactionsLast24Hours(15).build();

        assertThat(evaluator.evaluate(features, burstHour, report(0.0))).contains(BusinessRuleFlag.HIGH_VELOCITY);
        assertThat(evaluator.evaluate(features, busyDay, report(0.0))).contains(BusinessRuleFlag.HIGH_VELOCITY);
        assertThat(evaluator.evaluate(features, atLimit, report(0.0))).doesNotContain(BusinessRuleFlag.HIGH_VELOCITY);
    }

    @Test
    void twoElevatedAnomaliesRaiseFlag() {
        EngineeredFeatures features = TestData.features(TestData.normalTransaction().build(), regular);
        AnomalyReport twoElevated = report(4.0,
                fired(AnomalyDimension.AMOUNT, Severity.MEDIUM),
                fired(AnomalyDimension.LOCATION, Severity.HIGH));
        AnomalyReport oneElevated = report(4.0,
                fired(AnomalyDimension.AMOUNT, Severity.MEDIUM),
                fired(AnomalyDimension.DIGIT_PATTERN, Severity.LOW));

        assertThat(evaluator.evaluate(features, regular, twoElevated)).contains(BusinessRuleFlag.MULTIPLE_ELEVATED_ANOMALIES);
        assertThat(evaluator.evaluate(features, regular, oneElevated)).isEmpty();
    }
}
