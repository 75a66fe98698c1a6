package dev.careerpath.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.config.GapAnalysisConfig;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.model.Career;
import dev.careerpath.model.LearningResource;
import dev.careerpath.model.SkillTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compares a user's skills with a career's requirements and plans how to close the gap.
 * <p>
 * Every skill token is lower-cased and has its spaces replaced by the configured separator
 * before any set operation, on both the user's side and the career's side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillsGapAnalyzer {

    static final String OTHER_CATEGORY = "other";
    static final String DEFAULT_DIFFICULTY = "beginner";
    static final String GENERIC_TIME_ESTIMATE = "2-4 months";
    static final String PARALLEL_NOTE = "Estimates assume part-time learning with some skills learned in parallel";
    static final int SKILLS_PER_PHASE = 2;

    private final ReferenceDataStore referenceData;
    private final GapAnalysisConfig config;

    public record SkillsGapReport(
            String careerName,
            double skillMatchPercentage,
            CurrentSkills currentSkills,
            MissingSkills missingSkills,
            List<LearningStep> learningPath,
            TimeEstimate timeEstimate,
            Readiness readinessLevel,
            List<String> nextSteps,
            DevelopmentPlan skillDevelopmentPlan) {
    }

    public record CurrentSkills(int count, List<String> skills, Map<String, List<String>> categories) {
    }

    public record MissingSkills(
            int count,
            List<String> skills,
            Map<String, List<String>> categories,
            Priorities priorities) {
    }

    public record Priorities(List<String> high, List<String> medium, List<String> low) {
    }

    public record LearningStep(String skill, LearningResource resources, String difficulty) {
    }

    public record TimeEstimate(String total, List<String> breakdown, String note) {
    }

    public record Readiness(String level, String color, String description, double percentage) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DevelopmentPlan(String message, List<Phase> phases) {
    }

    public record Phase(String name, String duration, String focus, List<String> skills, List<String> activities) {
    }

    public SkillsGapReport analyze(List<String> userSkills, Career career, List<String> userSubjects) {
        Set<String> owned = new LinkedHashSet<>();
        userSkills.forEach(skill -> owned.add(normalize(skill)));
        deriveSkills(userSubjects).forEach(owned::add);

        Set<String> required = new LinkedHashSet<>();
        career.requiredSkills().forEach(skill -> required.add(normalize(skill)));

        List<String> current = required.stream().filter(owned::contains).toList();
        List<String> missing = required.stream().filter(skill -> !owned.contains(skill)).toList();

        double percentage = required.isEmpty()
                ? 100.0
                : Math.round(current.size() * 1000.0 / required.size()) / 10.0;

        log.debug("Skills gap for '{}': {}% matched, {} missing", career.name(), percentage, missing.size());

        return new SkillsGapReport(
                career.name(),
                percentage,
                new CurrentSkills(current.size(), current, categorize(current)),
                new MissingSkills(missing.size(), missing, categorize(missing), prioritize(missing)),
                learningPath(missing),
                estimateTime(missing),
                readiness(percentage),
                nextSteps(missing, percentage),
                developmentPlan(missing));
    }

    /** Lower-cased with spaces replaced by the skill separator. */
    public String normalize(String skill) {
        return skill.toLowerCase(Locale.ROOT).replace(" ", config.getSkillSeparator());
    }

    private List<String> deriveSkills(List<String> subjects) {
        SkillTaxonomy taxonomy = referenceData.getTaxonomy();
        List<String> derived = new ArrayList<>();
        for (String subject : subjects) {
            taxonomy.skillsForSubject(normalize(subject)).forEach(skill -> derived.add(normalize(skill)));
        }
        return derived;
    }

    /**
     * Splits skills by category. A skill goes to the first category with a term contained in it,
     * otherwise to {@value #OTHER_CATEGORY}.
     */
    Map<String, List<String>> categorize(List<String> skills) {
        Map<String, List<String>> table = referenceData.getTaxonomy().skillCategories();
        if (table.isEmpty()) {
            table = config.getFallbackCategories();
        }

        Map<String, List<String>> categorized = new LinkedHashMap<>();
        table.keySet().forEach(category -> categorized.put(category, new ArrayList<>()));
        categorized.put(OTHER_CATEGORY, new ArrayList<>());

        for (String skill : skills) {
            String category = table.entrySet().stream()
                    .filter(entry -> containsAny(skill, entry.getValue()))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(OTHER_CATEGORY);
            categorized.get(category).add(skill);
        }

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        categorized.forEach((category, list) -> frozen.put(category, List.copyOf(list)));
        return frozen;
    }

    Priorities prioritize(List<String> missing) {
        List<String> high = new ArrayList<>();
        List<String> medium = new ArrayList<>();
        List<String> low = new ArrayList<>();
        for (String skill : missing) {
            if (containsAny(skill, config.getCriticalSkills())) {
                high.add(skill);
            } else if (containsAny(skill, config.getMediumPriorityTerms())) {
                medium.add(skill);
            } else {
                low.add(skill);
            }
        }
        return new Priorities(List.copyOf(high), List.copyOf(medium), List.copyOf(low));
    }

    List<LearningStep> learningPath(List<String> missing) {
        Map<String, LearningResource> resources = referenceData.getTaxonomy().learningResources();
        List<LearningStep> path = new ArrayList<>();
        for (String skill : missing) {
            LearningResource resource = resources.entrySet().stream()
                    .filter(entry -> resourceMatches(entry.getKey(), skill))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElseGet(() -> genericResource(skill));
            path.add(new LearningStep(skill, resource, DEFAULT_DIFFICULTY));
        }
        return List.copyOf(path);
    }

    private boolean resourceMatches(String resourceKey, String skill) {
        if (skill.contains(resourceKey)) {
            return true;
        }
        for (String word : resourceKey.split(Pattern.quote(config.getSkillSeparator()))) {
            if (!word.isEmpty() && skill.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static LearningResource genericResource(String skill) {
        return LearningResource.builder()
                .beginner(List.of("Online courses for " + skill, skill + " tutorials", "Books on " + skill))
                .timeEstimate(GENERIC_TIME_ESTIMATE)
                .build();
    }

    TimeEstimate estimateTime(List<String> missing) {
        if (missing.isEmpty()) {
            return new TimeEstimate("0 months", List.of(), "No skills to learn");
        }

        int totalMonths = 0;
        List<String> breakdown = new ArrayList<>();
        for (String skill : missing) {
            int months;
            if (containsAny(skill, config.getComplexSkills())) {
                months = config.getComplexSkillMonths();
            } else if (containsAny(skill, config.getMediumSkills())) {
                months = config.getMediumSkillMonths();
            } else {
                months = config.getSimpleSkillMonths();
            }
            totalMonths += months;
            breakdown.add(skill + ": " + months + " months");
        }

        int adjusted = Math.max(totalMonths / config.getParallelLearningDivisor(), config.getMinimumTotalMonths());
        return new TimeEstimate(adjusted + " months", List.copyOf(breakdown), PARALLEL_NOTE);
    }

    static Readiness readiness(double percentage) {
        if (percentage >= 80) {
            return new Readiness("Ready", "success",
                    "You have most required skills and can start applying", percentage);
        }
        if (percentage >= 60) {
            return new Readiness("Nearly Ready", "warning",
                    "You have good foundation, need to develop a few key skills", percentage);
        }
        if (percentage >= 40) {
            return new Readiness("Developing", "info",
                    "You have some relevant skills, significant development needed", percentage);
        }
        return new Readiness("Early Stage", "danger",
                "Substantial skill development required before pursuing this career", percentage);
    }

    static List<String> nextSteps(List<String> missing, double percentage) {
        if (percentage >= 80) {
            return List.of(
                    "Start applying for entry-level positions",
                    "Build a portfolio showcasing your skills",
                    "Network with professionals in the field",
                    "Consider internships or freelance projects");
        }
        if (percentage >= 60) {
            return List.of(
                    "Focus on developing 2-3 key missing skills",
                    "Take online courses or bootcamps",
                    "Build projects to demonstrate new skills",
                    "Seek mentorship from industry professionals");
        }
        if (missing.isEmpty()) {
            return List.of();
        }

        List<String> steps = new ArrayList<>(List.of(
                "Start learning " + missing.get(0) + " immediately",
                "Dedicate 10-15 hours per week to skill development",
                "Join online communities and forums",
                "Consider formal education or certification programs"));
        if (missing.size() > 1) {
            steps.add("Plan to learn " + missing.get(1) + " after mastering the first skill");
        }
        return List.copyOf(steps);
    }

    /**
     * Three two-month phases filled by position in the missing list: the first two skills,
     * the next two, then everything else.
     */
    static DevelopmentPlan developmentPlan(List<String> missing) {
        if (missing.isEmpty()) {
            return new DevelopmentPlan("No skill development needed - you're ready!", List.of());
        }

        int firstEnd = Math.min(SKILLS_PER_PHASE, missing.size());
        int secondEnd = Math.min(2 * SKILLS_PER_PHASE, missing.size());

        return new DevelopmentPlan(null, List.of(
                new Phase("phase_1", "Months 1-2", "Foundation Building",
                        List.copyOf(missing.subList(0, firstEnd)),
                        List.of("Complete beginner courses", "Practice daily (1-2 hours)",
                                "Join learning communities")),
                new Phase("phase_2", "Months 3-4", "Skill Application",
                        List.copyOf(missing.subList(firstEnd, secondEnd)),
                        List.of("Work on practical projects", "Seek feedback from experts",
                                "Build portfolio pieces")),
                new Phase("phase_3", "Months 5-6", "Advanced Development",
                        List.copyOf(missing.subList(secondEnd, missing.size())),
                        List.of("Take advanced courses", "Contribute to open source",
                                "Network with professionals"))));
    }

    private static boolean containsAny(String skill, List<String> terms) {
        return terms.stream().anyMatch(skill::contains);
    }
}
