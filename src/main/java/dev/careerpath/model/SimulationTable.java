package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.Map;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationTable(
        Map<String, CareerSimulation> careerSimulations,
        SimulationMetadata simulationMetadata) {

    public static final SimulationTable EMPTY = new SimulationTable(Map.of(), null);

    public SimulationTable {
        careerSimulations = Frozen.map(careerSimulations);
        if (simulationMetadata == null) {
            simulationMetadata = new SimulationMetadata(Map.of());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SimulationMetadata(Map<String, String> stressScale) {
        public SimulationMetadata {
            stressScale = Frozen.map(stressScale);
        }
    }
}
