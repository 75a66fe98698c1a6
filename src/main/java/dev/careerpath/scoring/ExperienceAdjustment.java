package dev.careerpath.scoring;

import dev.careerpath.model.Career;

/**
 * Hook applied to a professional-mode match score when the user states an experience level.
 * Implementations must keep the returned score within [0, 1].
 */
public interface ExperienceAdjustment {

    /**
     * Adjust a weighted match score.
     *
     * @param baseScore       the weighted score before adjustment
     * @param experienceLevel the experience level reported by the user
     * @param career          the career being scored
     * @return the adjusted score
     */
    double adjust(double baseScore, String experienceLevel, Career career);
}
