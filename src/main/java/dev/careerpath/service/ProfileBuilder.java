package dev.careerpath.service;

import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.model.SkillTaxonomy;
import dev.careerpath.model.UserProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns a raw request into a {@link UserProfile}, adding the skills implied by the user's subjects.
 */
@Service
@RequiredArgsConstructor
public class ProfileBuilder {

    private final ReferenceDataStore referenceData;

    public UserProfile build(RecommendationRequest request, String region, String mode) {
        SkillTaxonomy taxonomy = referenceData.getTaxonomy();

        Set<String> skills = new LinkedHashSet<>(request.skills());
        for (String subject : request.subjects()) {
            skills.addAll(taxonomy.skillsForSubject(subject));
        }

        return UserProfile.builder()
                .interests(new LinkedHashSet<>(request.interests()))
                .skills(skills)
                .subjects(new LinkedHashSet<>(request.subjects()))
                .personalityTraits(new LinkedHashSet<>(request.personality().traits()))
                .experienceLevel(request.experienceLevel())
                .region(region)
                .mode(mode)
                .build();
    }
}
