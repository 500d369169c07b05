package com.fraud.scoring.artifact;

import com.fraud.scoring.risk.engine.FraudClassifier;

/**
 * Ensemble member exported as a linear decision function: p = sigmoid(intercept + w . x).
 */
public final class LogisticRegressionClassifier implements FraudClassifier {

    private final String name;
    private final double intercept;
    private final double[] coefficients;

    public LogisticRegressionClassifier(String name, double intercept, double[] coefficients) {
        this.name = name;
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
    }

    public static LogisticRegressionClassifier from(ModelDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new IllegalArgumentException("Model definition has no name");
        }
        if (definition.getCoefficients() == null || definition.getCoefficients().length == 0) {
            throw new IllegalArgumentException("Model '" + definition.getName() + "' has no coefficients");
        }
        return new LogisticRegressionClassifier(definition.getName(), definition.getIntercept(), definition.getCoefficients());
    }

    @Override
    public String getName() {
        return name;
    }

    public int inputWidth() {
        return coefficients.length;
    }

    @Override
    public double predictProbability(double[] encoded) {
        if (encoded.length != coefficients.length) {
            throw new IllegalArgumentException("Model '" + name + "' expects " + coefficients.length
                    + " inputs, got " + encoded.length);
        }
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * encoded[i];
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
