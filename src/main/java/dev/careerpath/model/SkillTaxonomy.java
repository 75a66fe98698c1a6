package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Subject to skill derivation, skill categories and learning resources.
 * Category iteration order is significant: the first category whose terms match wins.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillTaxonomy(
        Map<String, List<String>> subjectsToSkills,
        Map<String, List<String>> skillCategories,
        Map<String, LearningResource> learningResources) {

    public SkillTaxonomy {
        subjectsToSkills = Frozen.map(subjectsToSkills);
        skillCategories = Frozen.map(skillCategories);
        learningResources = Frozen.map(learningResources);
    }

    public List<String> skillsForSubject(String subject) {
        return subjectsToSkills.getOrDefault(subject, List.of());
    }
}
