package com.fraud.scoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the fraud scoring pipeline. Provides:
 * <ul>
 *   <li>Feature engineering from raw transactions and customer baselines</li>
 *   <li>Statistical anomaly checks next to a weighted model ensemble</li>
 *   <li>A 0-100 risk score, an APPROVE/BLOCK/MANUAL_REVIEW decision and alerts</li>
 * </ul>
 * The pipeline is exposed as the {@link com.fraud.scoring.core.FraudScoringPipeline} bean; transport
 * belongs to the embedding service.
 */
@SpringBootApplication
public class FraudScoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudScoringApplication.class, args);
    }
}
