package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Weights and cut points of the overall risk score.
 * Loaded from application.yml under 'risk' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskConfig {

    private double academicWeight = 0.4;
    private double interestWeight = 0.3;
    private double stressWeight = 0.3;

    /** Overall score at or below this is low risk. */
    private double lowRiskCutoff = 0.3;
    /** Overall score at or below this (and above the low cutoff) is moderate risk. */
    private double moderateRiskCutoff = 0.6;

    /** Dimension scores above this become a primary concern. */
    private double concernThreshold = 0.5;

    /** Level used when a score falls outside every configured band. */
    private String fallbackLevel = "moderate_risk";
}
