package dev.careerpath.service;

import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.model.Career;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Human-readable reasons, strengths and gaps behind a recommendation.
 * <p>
 * The overall match shown here always uses the fixed emphasis below, independent of the
 * mode weights used for ranking.
 */
@Service
public class ExplanationGenerator {

    static final double INTERESTS_WEIGHT = 0.40;
    static final double SKILLS_WEIGHT = 0.35;
    static final double SUBJECTS_WEIGHT = 0.15;
    static final double PERSONALITY_WEIGHT = 0.10;

    static final double STRONG_MATCH = 0.7;
    static final double GOOD_MATCH = 0.4;
    static final double STRONG_BACKGROUND = 0.6;
    static final double SOME_BACKGROUND = 0.3;
    static final double NO_SUBJECTS_SCORE = 0.5;

    public record Explanation(
            int overallMatch,
            List<String> reasons,
            List<String> skillGaps,
            List<String> strengths) {
    }

    /**
     * Explain one career against the raw request. Skills are taken as typed by the user,
     * without the skills derived from subjects.
     */
    public Explanation explain(Career career, RecommendationRequest request) {
        List<String> reasons = new ArrayList<>();
        List<String> strengths = new ArrayList<>();

        double interests = explainInterests(career, Set.copyOf(request.interests()), reasons, strengths);
        List<String> gaps = new ArrayList<>();
        double skills = explainSkills(career, Set.copyOf(request.skills()), reasons, strengths, gaps);
        double subjects = explainSubjects(career, Set.copyOf(request.subjects()), reasons);
        double personality = explainPersonality(career, Set.copyOf(request.personality().traits()), reasons);

        double total = interests * INTERESTS_WEIGHT
                + skills * SKILLS_WEIGHT
                + subjects * SUBJECTS_WEIGHT
                + personality * PERSONALITY_WEIGHT;

        return new Explanation((int) Math.round(total * 100), List.copyOf(reasons), List.copyOf(gaps),
                List.copyOf(strengths));
    }

    private double explainInterests(Career career, Set<String> user, List<String> reasons, List<String> strengths) {
        Set<String> required = new LinkedHashSet<>(career.interests());
        List<String> matched = intersect(required, user);
        double score = ratio(matched.size(), required.size());

        if (!matched.isEmpty()) {
            reasons.add("Your interests in " + String.join(", ", matched) + " align well with this career");
            strengths.addAll(matched);
        }
        // counts, not the ratio: an empty interest list is a strong match
        if (matched.size() >= required.size() * STRONG_MATCH) {
            reasons.add("Strong interest alignment - you share most key interests for this field");
        } else if (matched.size() >= required.size() * GOOD_MATCH) {
            reasons.add("Good interest match - several of your interests align with this career");
        } else {
            reasons.add("Limited interest overlap - explore the field before committing");
        }
        return score;
    }

    private double explainSkills(Career career, Set<String> user, List<String> reasons,
                                 List<String> strengths, List<String> gaps) {
        Set<String> required = new LinkedHashSet<>(career.requiredSkills());
        List<String> matched = intersect(required, user);
        required.stream().filter(skill -> !user.contains(skill)).forEach(gaps::add);
        double score = ratio(matched.size(), required.size());

        if (!matched.isEmpty()) {
            reasons.add("You already have " + matched.size() + " out of " + required.size()
                    + " key skills: " + String.join(", ", matched));
            strengths.addAll(matched);
        }
        if (!gaps.isEmpty()) {
            reasons.add("Skills to develop: " + String.join(", ", gaps));
        }
        if (score >= STRONG_MATCH) {
            reasons.add("Excellent skill match - you have most required skills");
        } else if (score >= GOOD_MATCH) {
            reasons.add("Good skill foundation - some development needed");
        } else {
            reasons.add("Significant skill development opportunity");
        }
        return score;
    }

    private double explainSubjects(Career career, Set<String> user, List<String> reasons) {
        Set<String> required = new LinkedHashSet<>(career.subjects());
        List<String> matched = intersect(required, user);
        double score = required.isEmpty() ? NO_SUBJECTS_SCORE : ratio(matched.size(), required.size());

        if (!matched.isEmpty()) {
            reasons.add("Your background in " + String.join(", ", matched) + " provides a strong foundation");
        }
        if (score >= STRONG_BACKGROUND) {
            reasons.add("Strong academic preparation for this field");
        } else if (score >= SOME_BACKGROUND) {
            reasons.add("Some relevant academic background");
        } else {
            reasons.add("Little related coursework so far - consider a foundation course");
        }
        return score;
    }

    private double explainPersonality(Career career, Set<String> user, List<String> reasons) {
        Set<String> required = new LinkedHashSet<>(career.personalityTraits());
        List<String> matched = intersect(required, user);
        double score = ratio(matched.size(), required.size());

        if (!matched.isEmpty()) {
            reasons.add("Your " + String.join(", ", matched) + " personality traits fit well with this career");
        }
        if (score >= STRONG_BACKGROUND) {
            reasons.add("Strong personality-career alignment");
        } else if (score >= SOME_BACKGROUND) {
            reasons.add("Some personality traits align with this career");
        }
        return score;
    }

    /** Items of {@code required} held by the user, in the career's order. */
    private static List<String> intersect(Set<String> required, Set<String> user) {
        return required.stream().filter(user::contains).toList();
    }

    private static double ratio(int matched, int required) {
        return (double) matched / Math.max(required, 1);
    }
}
