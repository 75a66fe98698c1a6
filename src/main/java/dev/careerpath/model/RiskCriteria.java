package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Warning bands per risk dimension, the career risk table grouped by category,
 * and the intervention strategy lists.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskCriteria(
        Map<String, DimensionCriteria> failureWarningCriteria,
        Map<String, List<CareerRiskProfile>> careerRiskMapping,
        Map<String, List<String>> interventionStrategies) {

    public static final String ACADEMIC_CONSISTENCY = "academic_consistency";
    public static final String INTEREST_STABILITY = "interest_stability";
    public static final String STRESS_TOLERANCE = "stress_tolerance";

    public RiskCriteria {
        failureWarningCriteria = Frozen.map(failureWarningCriteria);
        careerRiskMapping = Frozen.map(careerRiskMapping);
        interventionStrategies = Frozen.map(interventionStrategies);
    }

    public Map<String, WarningBand> bandsFor(String dimension) {
        DimensionCriteria criteria = failureWarningCriteria.get(dimension);
        return criteria != null ? criteria.warningLevels() : Map.of();
    }

    public Optional<CareerRiskProfile> findCareer(String career) {
        return careerRiskMapping.values().stream()
                .flatMap(List::stream)
                .filter(profile -> profile.career().equals(career))
                .findFirst();
    }

    public List<String> strategies(String group) {
        return interventionStrategies.getOrDefault(group, List.of());
    }
}
