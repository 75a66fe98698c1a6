package dev.careerpath.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.model.Personality;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

/**
 * Normalised recommendation payload handed over by the caller.
 * Region and mode are explicit; nothing is read from ambient session state.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationRequest(
        String region,
        String mode,
        List<String> interests,
        List<String> skills,
        List<String> subjects,
        Personality personality,
        String experienceLevel,
        String userId) {

    public RecommendationRequest {
        interests = Frozen.list(interests);
        skills = Frozen.list(skills);
        subjects = Frozen.list(subjects);
        if (personality == null) {
            personality = Personality.NONE;
        }
    }
}
