package com.fraud.scoring.artifact;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of the fitted preprocessor: standard scaling parameters for numeric columns,
 * smoothed target encodings for categorical ones.
 */
@Data
@NoArgsConstructor
public class EncoderDefinition {

    private List<NumericColumn> numeric = new ArrayList<>();
    private List<CategoricalColumn> categorical = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class NumericColumn {
        private String name;
        private double mean;
        private double scale;
    }

    @Data
    @NoArgsConstructor
    public static class CategoricalColumn {
        private String name;
        /** Encoding for categories not seen in training (the global target mean). */
        private double defaultValue;
        private Map<String, Double> encodings = new HashMap<>();
    }
}
