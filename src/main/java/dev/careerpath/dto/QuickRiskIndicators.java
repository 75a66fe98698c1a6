package dev.careerpath.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuickRiskIndicators(
        boolean recentGradeDrop,
        boolean careerUncertainty,
        boolean highStressLevels,
        boolean externalPressure) {
}
