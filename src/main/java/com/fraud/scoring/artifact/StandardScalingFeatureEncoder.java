package com.fraud.scoring.artifact;

import com.fraud.scoring.api.FeatureContractException;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import com.fraud.scoring.risk.domain.FeatureColumn;
import com.fraud.scoring.risk.engine.FeatureEncoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encoder backed by an {@link EncoderDefinition}. Numeric columns come first, then categorical
 * ones, matching the column transformer the models were trained behind.
 * The definition is checked against {@link FeatureColumn} on construction, so a column the
 * pipeline does not produce, or produces with another type, fails at load time.
 */
public final class StandardScalingFeatureEncoder implements FeatureEncoder {

    private final List<FeatureColumn> numericColumns;
    private final double[] means;
    private final double[] scales;
    private final List<FeatureColumn> categoricalColumns;
    private final List<Map<String, Double>> encodings;
    private final double[] defaults;
    private final List<String> columnNames;

    public StandardScalingFeatureEncoder(EncoderDefinition definition) {
        Set<String> seen = new HashSet<>();
        List<EncoderDefinition.NumericColumn> numeric = definition.getNumeric();
        List<EncoderDefinition.CategoricalColumn> categorical = definition.getCategorical();
        if (numeric.isEmpty() && categorical.isEmpty()) {
            throw new FeatureContractException("Encoder definition declares no columns");
        }

        List<FeatureColumn> numericCols = new ArrayList<>();
        means = new double[numeric.size()];
        scales = new double[numeric.size()];
        for (int i = 0; i < numeric.size(); i++) {
            EncoderDefinition.NumericColumn col = numeric.get(i);
            FeatureColumn column = resolve(col.getName(), seen);
            if (!column.type().isNumeric()) {
                throw new FeatureContractException("Encoder scales '" + col.getName()
                        + "' as numeric but the pipeline produces it as " + column.type());
            }
            numericCols.add(column);
            means[i] = col.getMean();
            // StandardScaler convention: zero variance columns keep scale 1
            scales[i] = col.getScale() == 0.0 ? 1.0 : col.getScale();
        }

        List<FeatureColumn> categoricalCols = new ArrayList<>();
        List<Map<String, Double>> encodingMaps = new ArrayList<>();
        defaults = new double[categorical.size()];
        for (int i = 0; i < categorical.size(); i++) {
            EncoderDefinition.CategoricalColumn col = categorical.get(i);
            FeatureColumn column = resolve(col.getName(), seen);
            if (column.type().isNumeric()) {
                throw new FeatureContractException("Encoder target-encodes '" + col.getName()
                        + "' as categorical but the pipeline produces it as " + column.type());
            }
            categoricalCols.add(column);
            encodingMaps.add(Map.copyOf(col.getEncodings()));
            defaults[i] = col.getDefaultValue();
        }

        this.numericColumns = List.copyOf(numericCols);
        this.categoricalColumns = List.copyOf(categoricalCols);
        this.encodings = List.copyOf(encodingMaps);
        List<String> names = new ArrayList<>();
        numericColumns.forEach(c -> names.add(c.columnName()));
        categoricalColumns.forEach(c -> names.add(c.columnName()));
        this.columnNames = Collections.unmodifiableList(names);
    }

    @Override
    public List<String> columns() {
        return columnNames;
    }

    @Override
    public double[] encode(EngineeredFeatures features) {
        double[] row = new double[columnNames.size()];
        int i = 0;
        for (int n = 0; n < numericColumns.size(); n++, i++) {
            row[i] = (numericColumns.get(n).numericValue(features) - means[n]) / scales[n];
        }
        for (int c = 0; c < categoricalColumns.size(); c++, i++) {
            String value = categoricalColumns.get(c).categoricalValue(features);
            Double encoded = encodings.get(c).get(value);
            row[i] = encoded != null ? encoded : defaults[c];
        }
        return row;
    }

    private static FeatureColumn resolve(String name, Set<String> seen) {
        if (name == null || name.isBlank()) {
            throw new FeatureContractException("Encoder definition has a column without a name");
        }
        if (!seen.add(name)) {
            throw new FeatureContractException("Encoder definition lists column '" + name + "' twice");
        }
        return FeatureColumn.byName(name)
                .orElseThrow(() -> new FeatureContractException(
                        "Encoder expects column '" + name + "' which the feature engineer does not produce"));
    }
}
