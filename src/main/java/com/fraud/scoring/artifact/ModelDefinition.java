package com.fraud.scoring.artifact;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON export of one ensemble member as a linear decision function over the encoded row.
 */
@Data
@NoArgsConstructor
public class ModelDefinition {

    private String name;
    private double intercept;
    private double[] coefficients;
}
