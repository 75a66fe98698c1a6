package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;
import java.util.Map;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealityCheckTable(
        Map<String, RealityCheckEntry> careerRealityData,
        Map<String, List<String>> generalInsights) {

    public static final RealityCheckTable EMPTY = new RealityCheckTable(Map.of(), Map.of());

    public RealityCheckTable {
        careerRealityData = Frozen.map(careerRealityData);
        generalInsights = Frozen.map(generalInsights);
    }
}
