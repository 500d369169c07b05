package com.fraud.scoring.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.scoring.api.ArtifactUnavailableException;
import com.fraud.scoring.risk.engine.FraudClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Reads the scoring artifacts (frequency tables, encoder, ensemble members) exactly once.
 * Concurrent first callers wait on the same load instead of each hitting the disk. A failed load
 * is not cached, so a later call may retry it; at startup the failure is fatal.
 */
@Slf4j
@Component
public class ArtifactLoader {

    private static final TypeReference<Map<String, Double>> COUNT_TABLE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final String merchantFrequenciesLocation;
    private final String categoryFrequenciesLocation;
    private final String encoderLocation;
    private final String modelsLocation;

    private final Object lock = new Object();
    private final AtomicInteger loads = new AtomicInteger();
    private volatile ArtifactBundle bundle;

    public ArtifactLoader(ObjectMapper objectMapper,
                          @Value("${fraud.artifacts.merchant-frequencies:classpath:artifacts/merchant_freq.json}") String merchantFrequenciesLocation,
                          @Value("${fraud.artifacts.category-frequencies:classpath:artifacts/category_freq.json}") String categoryFrequenciesLocation,
                          @Value("${fraud.artifacts.encoder:classpath:artifacts/encoder.json}") String encoderLocation,
                          @Value("${fraud.artifacts.models:classpath:artifacts/models/*.json}") String modelsLocation) {
        this.objectMapper = objectMapper;
        this.merchantFrequenciesLocation = merchantFrequenciesLocation;
        this.categoryFrequenciesLocation = categoryFrequenciesLocation;
        this.encoderLocation = encoderLocation;
        this.modelsLocation = modelsLocation;
    }

    /**
     * The loaded bundle, loading it on first call.
     *
     * @throws ArtifactUnavailableException when any artifact is missing or malformed
     */
    public ArtifactBundle get() {
        ArtifactBundle result = bundle;
        if (result == null) {
            synchronized (lock) {
                result = bundle;
                if (result == null) {
                    result = load();
                    bundle = result;
                }
            }
        }
        return result;
    }

    /** Number of completed loads; stays at 1 once the bundle is cached. */
    int loadCount() {
        return loads.get();
    }

    private ArtifactBundle load() {
        log.info("Loading scoring artifacts: encoder={}, models={}", encoderLocation, modelsLocation);
        FrequencyTables tables = new FrequencyTables(
                readCountTable(merchantFrequenciesLocation),
                readCountTable(categoryFrequenciesLocation));

        EncoderDefinition definition = read(encoderLocation, EncoderDefinition.class);
        StandardScalingFeatureEncoder encoder;
        try {
            encoder = new StandardScalingFeatureEncoder(definition);
        } catch (RuntimeException e) {
            throw new ArtifactUnavailableException("Encoder at " + encoderLocation + " is invalid: " + e.getMessage(), e);
        }

        List<FraudClassifier> classifiers = loadClassifiers(encoder.columns().size());

        ArtifactBundle loaded = ArtifactBundle.builder()
                .encoder(encoder)
                .classifiers(classifiers)
                .frequencyTables(tables)
                .build();
        loads.incrementAndGet();
        log.info("Scoring artifacts loaded: {} encoded columns, models={}, merchants={}, categories={}",
                encoder.columns().size(),
                classifiers.stream().map(FraudClassifier::getName).collect(Collectors.toList()),
                tables.merchantCount(), tables.categoryCount());
        return loaded;
    }

    private List<FraudClassifier> loadClassifiers(int inputWidth) {
        Resource[] resources;
        try {
            resources = resolver.getResources(modelsLocation);
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Cannot list models at " + modelsLocation, e);
        }
        if (resources.length == 0) {
            throw new ArtifactUnavailableException("No models found at " + modelsLocation);
        }
        Arrays.sort(resources, Comparator.comparing((Resource r) -> String.valueOf(r.getFilename())));
        List<FraudClassifier> classifiers = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Resource resource : resources) {
            LogisticRegressionClassifier classifier;
            try {
                classifier = LogisticRegressionClassifier.from(read(resource, ModelDefinition.class));
            } catch (IllegalArgumentException e) {
                throw new ArtifactUnavailableException("Model " + resource.getDescription() + " is invalid: " + e.getMessage(), e);
            }
            if (classifier.inputWidth() != inputWidth) {
                throw new ArtifactUnavailableException("Model '" + classifier.getName() + "' takes "
                        + classifier.inputWidth() + " inputs but the encoder produces " + inputWidth);
            }
            if (!names.add(classifier.getName())) {
                throw new ArtifactUnavailableException("Duplicate model name '" + classifier.getName() + "'");
            }
            log.debug("Model '{}' loaded from {}", classifier.getName(), resource.getDescription());
            classifiers.add(classifier);
        }
        return classifiers;
    }

    private Map<String, Double> readCountTable(String location) {
        Map<String, Double> table = read(location, COUNT_TABLE);
        if (table == null) {
            throw new ArtifactUnavailableException("Frequency table at " + location + " is empty");
        }
        return table;
    }

    private <T> T read(String location, Class<T> type) {
        return read(resolver.getResource(location), type);
    }

    private <T> T read(Resource resource, Class<T> type) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Cannot read " + resource.getDescription(), e);
        }
    }

    private <T> T read(String location, TypeReference<T> type) {
        Resource resource = resolver.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Cannot read " + resource.getDescription(), e);
        }
    }
}
