package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;

import java.util.Map;

/**
 * Warning bands of one risk dimension, keyed by level name in lookup order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DimensionCriteria(Map<String, WarningBand> warningLevels) {

    public DimensionCriteria {
        warningLevels = Frozen.map(warningLevels);
    }
}
