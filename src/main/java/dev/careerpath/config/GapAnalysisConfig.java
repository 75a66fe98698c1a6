package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables for skill prioritisation and learning time estimates.
 * Loaded from application.yml under 'gap-analysis' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gap-analysis")
public class GapAnalysisConfig {

    private String skillSeparator = "_";

    private List<String> criticalSkills = new ArrayList<>(
            List.of("programming", "machine_learning", "data_analysis", "leadership", "communication"));
    private List<String> mediumPriorityTerms = new ArrayList<>(List.of("management", "strategy"));

    private List<String> complexSkills = new ArrayList<>(List.of("machine_learning", "programming", "leadership"));
    private List<String> mediumSkills = new ArrayList<>(List.of("data_analysis", "design", "project_management"));
    private int complexSkillMonths = 6;
    private int mediumSkillMonths = 3;
    private int simpleSkillMonths = 2;
    private int parallelLearningDivisor = 2;
    private int minimumTotalMonths = 3;

    /** Used when the taxonomy declares no skill categories. */
    private Map<String, List<String>> fallbackCategories = defaultCategories();

    private static Map<String, List<String>> defaultCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("technical", List.of("programming", "machine_learning", "data_analysis"));
        categories.put("soft", List.of("communication", "leadership", "teamwork"));
        categories.put("business", List.of("project_management", "strategic_thinking", "marketing"));
        return categories;
    }
}
