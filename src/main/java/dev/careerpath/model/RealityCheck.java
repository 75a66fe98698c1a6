package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

/**
 * The "what the job is really like" notes for one career.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealityCheck(
        String stressLevel,
        String workLifeBalance,
        List<String> challenges,
        List<String> commonMisconceptions,
        String entryBarrier,
        String failureRate) {

    public RealityCheck {
        challenges = Frozen.list(challenges);
        commonMisconceptions = Frozen.list(commonMisconceptions);
    }
}
