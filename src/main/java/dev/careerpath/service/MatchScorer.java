package dev.careerpath.service;

import dev.careerpath.config.MatchingConfig;
import dev.careerpath.config.MatchingConfig.Weights;
import dev.careerpath.model.Career;
import dev.careerpath.model.UserProfile;
import dev.careerpath.scoring.ExperienceAdjustment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;

/**
 * Weighted match score between a profile and one career.
 * <p>
 * Each dimension scores the share of the career's own list the user covers, so a career asking
 * for four skills is fully matched by a user holding those four, whatever else they hold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchScorer {

    /** Subject score for a career that lists no subjects. */
    static final double NO_SUBJECTS_SCORE = 0.5;

    private final MatchingConfig matchingConfig;
    private final ExperienceAdjustment experienceAdjustment;

    /**
     * Result of scoring one career, with the per-dimension coverage.
     */
    public record MatchBreakdown(
            double interests,
            double skills,
            double subjects,
            double personality,
            double total) {
    }

    /**
     * Score a career for the profile, using the weights of the profile's mode.
     *
     * @return a value in [0, 1]
     */
    public double score(UserProfile profile, Career career) {
        return breakdown(profile, career).total();
    }

    public MatchBreakdown breakdown(UserProfile profile, Career career) {
        Weights weights = matchingConfig.weightsFor(profile.mode());

        double interests = coverage(profile.interests(), career.interests());
        double skills = coverage(profile.skills(), career.requiredSkills());
        double subjects = subjectCoverage(profile.subjects(), career.subjects());
        double personality = coverage(profile.personalityTraits(), career.personalityTraits());

        double total = interests * weights.getInterests()
                + skills * weights.getSkills()
                + subjects * weights.getSubjects()
                + personality * weights.getPersonality();

        if (MatchingConfig.PROFESSIONAL.equals(profile.mode()) && profile.hasExperienceLevel()) {
            total = experienceAdjustment.adjust(total, profile.experienceLevel(), career);
        }

        log.debug("Career '{}' scored {} (interests {}, skills {}, subjects {}, personality {})",
                career.name(), total, interests, skills, subjects, personality);

        return new MatchBreakdown(interests, skills, subjects, personality, total);
    }

    /**
     * |user ∩ career| / max(|career|, 1), counting each distinct career item once.
     */
    static double coverage(Set<String> userItems, Collection<String> careerItems) {
        Set<String> required = Set.copyOf(careerItems);
        long matched = required.stream().filter(userItems::contains).count();
        return (double) matched / Math.max(required.size(), 1);
    }

    static double subjectCoverage(Set<String> userSubjects, Collection<String> careerSubjects) {
        if (careerSubjects.isEmpty()) {
            return NO_SUBJECTS_SCORE;
        }
        return coverage(userSubjects, careerSubjects);
    }
}
