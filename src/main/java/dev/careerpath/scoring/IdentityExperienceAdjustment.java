package dev.careerpath.scoring;

import dev.careerpath.model.Career;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default adjustment: leaves the score unchanged.
 */
@Slf4j
@Component
public class IdentityExperienceAdjustment implements ExperienceAdjustment {

    public IdentityExperienceAdjustment() {
        log.info("Experience weighting disabled - using identity adjustment");
    }

    @Override
    public double adjust(double baseScore, String experienceLevel, Career career) {
        return baseScore;
    }
}
