package com.fraud.scoring.artifact;

import com.fraud.scoring.TestData;
import com.fraud.scoring.api.FeatureContractException;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StandardScalingFeatureEncoderTest {

    private EngineeredFeatures features;

    @BeforeEach
    void setUp() {
        features = TestData.features(TestData.normalTransaction().build(), TestData.regularCustomer().build());
    }

    private static EncoderDefinition.NumericColumn numeric(String name, double mean, double scale) {
        EncoderDefinition.NumericColumn column = new EncoderDefinition.NumericColumn();
        column.setName(name);
        column.setMean(mean);
        column.setScale(scale);
        return column;
    }

    private static EncoderDefinition.CategoricalColumn categorical(String name, double defaultValue, Map<String, Double> encodings) {
        EncoderDefinition.CategoricalColumn column = new EncoderDefinition.CategoricalColumn();
        column.setName(name);
        column.setDefaultValue(defaultValue);
        column.setEncodings(encodings);
        return column;
    }

    private static EncoderDefinition definition(List<EncoderDefinition.NumericColumn> numeric,
                                                List<EncoderDefinition.CategoricalColumn> categorical) {
        EncoderDefinition definition = new EncoderDefinition();
        definition.setNumeric(numeric);
        definition.setCategorical(categorical);
        return definition;
    }

    @Test
    void scalesNumericsThenTargetEncodesCategoricals() {
        StandardScalingFeatureEncoder encoder = new StandardScalingFeatureEncoder(definition(
                List.of(numeric("amt", 50.0, 10.0), numeric("is_business_hours", 0.0, 1.0)),
                List.of(categorical("category", 0.005, Map.of("entertainment", 0.0025)))));

        double[] row = encoder.encode(features);

        assertThat(encoder.columns()).containsExactly("amt", "is_business_hours", "category");
        assertThat(row).hasSize(3);
        assertThat(row[0]).isCloseTo(0.23, within(1e-9));
        assertThat(row[1]).isEqualTo(1.0);
        assertThat(row[2]).isEqualTo(0.0025);
    }

    @Test
    void zeroScaleLeavesColumnUnscaled() {
        StandardScalingFeatureEncoder encoder = new StandardScalingFeatureEncoder(definition(
                List.of(numeric("hour", 12.0, 0.0)), List.of()));

        assertThat(encoder.encode(features)[0]).isEqualTo(2.0);
    }

    @Test
    void unseenCategoryGetsDefaultEncoding() {
        StandardScalingFeatureEncoder encoder = new StandardScalingFeatureEncoder(definition(
                List.of(), List.of(categorical("state", 0.0052, Map.of("TX", 0.0054)))));

        assertThat(encoder.encode(features)[0]).isEqualTo(0.0052);
    }

    @Test
    void rejectsColumnThePipelineDoesNotProduce() {
        assertThatThrownBy(() -> new StandardScalingFeatureEncoder(definition(
                List.of(numeric("merchant_risk_index", 0.0, 1.0)), List.of())))
                .isInstanceOf(FeatureContractException.class)
                .hasMessageContaining("merchant_risk_index");
    }

    @Test
    void rejectsColumnsOfTheWrongKind() {
        assertThatThrownBy(() -> new StandardScalingFeatureEncoder(definition(
                List.of(numeric("category", 0.0, 1.0)), List.of())))
                .isInstanceOf(FeatureContractException.class);
        assertThatThrownBy(() -> new StandardScalingFeatureEncoder(definition(
                List.of(), List.of(categorical("amt", 0.0, Map.of())))))
                .isInstanceOf(FeatureContractException.class);
    }

    @Test
    void rejectsDuplicateAndEmptyDefinitions() {
        assertThatThrownBy(() -> new StandardScalingFeatureEncoder(definition(
                List.of(numeric("amt", 0.0, 1.0), numeric("amt", 0.0, 1.0)), List.of())))
                .isInstanceOf(FeatureContractException.class)
                .hasMessageContaining("twice");
        assertThatThrownBy(() -> new StandardScalingFeatureEncoder(definition(List.of(), List.of())))
                .isInstanceOf(FeatureContractException.class);
    }
}
