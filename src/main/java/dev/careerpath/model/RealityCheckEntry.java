package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealityCheckEntry(
        RealityCheck realityCheck,
        List<String> backupCareers,
        List<String> successFactors) {

    public RealityCheckEntry {
        backupCareers = Frozen.list(backupCareers);
        successFactors = Frozen.list(successFactors);
    }
}
