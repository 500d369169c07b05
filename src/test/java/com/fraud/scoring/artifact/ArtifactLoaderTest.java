package com.fraud.scoring.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.scoring.TestData;
import com.fraud.scoring.api.ArtifactUnavailableException;
import com.fraud.scoring.risk.domain.FeatureColumn;
import com.fraud.scoring.risk.engine.FraudClassifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ArtifactLoader against the bundled artifacts and broken copies under
 * {@code bad-artifacts/}.
 */
class ArtifactLoaderTest {

    private static final String MERCHANTS = "classpath:artifacts/merchant_freq.json";
    private static final String CATEGORIES = "classpath:artifacts/category_freq.json";
    private static final String ENCODER = "classpath:artifacts/encoder.json";
    private static final String MODELS = "classpath:artifacts/models/*.json";

    private static ArtifactLoader loader(String encoder, String models) {
        return new ArtifactLoader(new ObjectMapper(), MERCHANTS, CATEGORIES, encoder, models);
    }

    @Test
    void loadsBundledArtifacts() {
        ArtifactBundle bundle = loader(ENCODER, MODELS).get();

        assertThat(bundle.getEncoder().columns()).hasSize(FeatureColumn.values().length);
        assertThat(bundle.getClassifiers().stream().map(FraudClassifier::getName).collect(Collectors.toList()))
                .containsExactly("best", "lightgbm", "randomforest", "xgboost");
        assertThat(bundle.getFrequencyTables().categoryFrequency("gas_transport", 1.0)).isEqualTo(131659.0);
    }

    @Test
    void bundledModelsGiveLowProbabilityToOrdinaryPurchase() {
        ArtifactBundle bundle = loader(ENCODER, MODELS).get();
        double[] row = bundle.getEncoder().encode(
                TestData.features(TestData.normalTransaction().build(), TestData.regularCustomer().build()));

        for (FraudClassifier classifier : bundle.getClassifiers()) {
            assertThat(classifier.predictProbability(row)).isBetween(0.0, 0.1);
        }
    }

    @Test
    void concurrentFirstCallersShareOneLoad() throws Exception {
        ArtifactLoader loader = loader(ENCODER, MODELS);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ArtifactBundle>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return loader.get();
                }));
            }
            start.countDown();

            ArtifactBundle first = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<ArtifactBundle> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loader.loadCount()).isEqualTo(1);
        assertThat(loader.get()).isSameAs(loader.get());
        assertThat(loader.loadCount()).isEqualTo(1);
    }

    @Test
    void missingArtifactIsFatal() {
        ArtifactLoader loader = loader("classpath:artifacts/missing-encoder.json", MODELS);

        assertThatThrownBy(loader::get)
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("missing-encoder.json");
        assertThat(loader.loadCount()).isZero();
    }

    @Test
    void emptyModelDirectoryIsFatal() {
        assertThatThrownBy(() -> loader(ENCODER, "classpath*:no-such-dir/*.json").get())
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("No models");
    }

    @Test
    void modelWidthMustMatchEncoder() {
        assertThatThrownBy(() -> loader(ENCODER, "classpath:bad-artifacts/narrow-models/*.json").get())
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("takes 2 inputs");
    }

    @Test
    void duplicateModelNamesAreRejected() {
        assertThatThrownBy(() -> loader(ENCODER, "classpath:bad-artifacts/duplicate-models/*.json").get())
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void encoderWithUnknownColumnIsFatal() {
        assertThatThrownBy(() -> loader("classpath:bad-artifacts/encoder-unknown-column.json", MODELS).get())
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("merchant_risk_index");
    }
}
