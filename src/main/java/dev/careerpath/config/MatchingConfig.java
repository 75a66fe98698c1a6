package dev.careerpath.config;

import dev.careerpath.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mode weight vectors and region descriptors.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig implements InitializingBean {

    public static final String STUDENT = "student";
    public static final String PROFESSIONAL = "professional";
    public static final double WEIGHT_TOLERANCE = 1e-9;

    private Map<String, Weights> modes = defaultModes();
    private Map<String, RegionSettings> regions = defaultRegions();

    /**
     * Per-dimension weights of one mode. The four values must sum to 1.0.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Weights {
        private double interests;
        private double skills;
        private double subjects;
        private double personality;

        public double sum() {
            return interests + skills + subjects + personality;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegionSettings {
        private String careerFile;
        private String roleModelFile;
        private String currency;
        private String salaryPrefix;
    }

    @Override
    public void afterPropertiesSet() {
        modes.forEach((mode, weights) -> {
            if (Math.abs(weights.sum() - 1.0) > WEIGHT_TOLERANCE) {
                throw new IllegalStateException(
                        "Weights of mode '" + mode + "' sum to " + weights.sum() + " instead of 1.0");
            }
        });
    }

    public Weights weightsFor(String mode) {
        Weights weights = modes.get(mode);
        if (weights == null) {
            throw new ValidationException("Unknown mode '" + mode + "', expected one of " + modes.keySet());
        }
        return weights;
    }

    public RegionSettings regionFor(String region) {
        RegionSettings settings = regions.get(region);
        if (settings == null) {
            throw new ValidationException("Unknown region '" + region + "', expected one of " + regions.keySet());
        }
        return settings;
    }

    private static Map<String, Weights> defaultModes() {
        Map<String, Weights> modes = new LinkedHashMap<>();
        modes.put(STUDENT, new Weights(0.45, 0.20, 0.25, 0.10));
        modes.put(PROFESSIONAL, new Weights(0.30, 0.40, 0.10, 0.20));
        return modes;
    }

    private static Map<String, RegionSettings> defaultRegions() {
        Map<String, RegionSettings> regions = new LinkedHashMap<>();
        regions.put("global", new RegionSettings("careers.json", "role_models.json", "USD", "$"));
        regions.put("india", new RegionSettings("careers_india.json", "role_models_india.json", "INR", "₹"));
        return regions;
    }
}
