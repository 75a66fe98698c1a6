package dev.careerpath.model;

import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.Set;

/**
 * Normalised view of one request, built fresh per call and never stored.
 * {@code skills} already contains the skills derived from {@code subjects}.
 */
@Builder
public record UserProfile(
        Set<String> interests,
        Set<String> skills,
        Set<String> subjects,
        Set<String> personalityTraits,
        String experienceLevel,
        String region,
        String mode) {

    public UserProfile {
        interests = Frozen.set(interests);
        skills = Frozen.set(skills);
        subjects = Frozen.set(subjects);
        personalityTraits = Frozen.set(personalityTraits);
    }

    public boolean hasExperienceLevel() {
        return experienceLevel != null && !experienceLevel.isBlank();
    }
}
