package dev.careerpath.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds and keyword tables for career comparison.
 * Loaded from application.yml under 'comparison' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "comparison")
public class ComparisonConfig {

    private int minCareers = 2;
    private int maxCareers = 5;
    private int defaultScore = 3;
    private String defaultStressLevel = "Medium";
    private String defaultWorkLifeBalance = "Moderate";

    /** Exact (lower-cased) stress descriptions to a 1-5 score, higher is more stress. */
    private Map<String, Integer> stressLevels = defaultStressLevels();

    /** Checked in order; the first band with a keyword contained in the description wins. */
    private List<KeywordBand> workLifeBands = defaultWorkLifeBands();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeywordBand {
        private int score;
        private List<String> keywords = new ArrayList<>();
    }

    private static Map<String, Integer> defaultStressLevels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        levels.put("low", 1);
        levels.put("medium-low", 2);
        levels.put("medium", 3);
        levels.put("medium-high", 4);
        levels.put("high", 5);
        return levels;
    }

    private static List<KeywordBand> defaultWorkLifeBands() {
        List<KeywordBand> bands = new ArrayList<>();
        bands.add(new KeywordBand(5, List.of("excellent", "great")));
        bands.add(new KeywordBand(4, List.of("good", "flexible")));
        bands.add(new KeywordBand(3, List.of("moderate", "balanced")));
        bands.add(new KeywordBand(2, List.of("challenging", "demanding")));
        bands.add(new KeywordBand(1, List.of("poor", "intense")));
        return bands;
    }
}
