package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record CareerRiskProfile(
        String career,
        double stressLevel,
        String dropoutRate,
        List<String> commonReasons) {

    public CareerRiskProfile {
        commonReasons = Frozen.list(commonReasons);
    }
}
