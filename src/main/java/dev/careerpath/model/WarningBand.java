package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

/**
 * A risk level band covering the closed score interval {@code [min, max]}.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record WarningBand(List<Double> scoreRange, List<String> recommendations) {

    public WarningBand {
        scoreRange = Frozen.list(scoreRange);
        if (scoreRange.size() != 2) {
            throw new IllegalArgumentException("score_range must hold exactly [min, max]");
        }
        if (scoreRange.get(0) > scoreRange.get(1)) {
            throw new IllegalArgumentException("score_range min exceeds max: " + scoreRange);
        }
        recommendations = Frozen.list(recommendations);
    }

    public static WarningBand of(double min, double max, List<String> recommendations) {
        return new WarningBand(List.of(min, max), recommendations);
    }

    public boolean covers(double score) {
        return scoreRange.get(0) <= score && score <= scoreRange.get(1);
    }
}
