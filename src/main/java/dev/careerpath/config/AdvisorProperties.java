package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Application level settings.
 * Loaded from application.yml under 'advisor' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    private String referenceDataLocation = "classpath:data/";
    private String homeRegion = "global";
    private String defaultRegion = "global";
    private String defaultMode = MatchingConfig.STUDENT;
    private int recommendationLimit = 5;
    private int visualizationSize = 3;
    private String requestFile = "request.json";

    private int roleModelLimit = 3;
    private int weeklyTipCount = 7;
    private int skillTipLimit = 5;
    private List<String> professionalTipCategories = new ArrayList<>(
            List.of("career_advancement", "leadership", "industry_transition", "networking"));
}
