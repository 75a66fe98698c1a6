package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Day-bucket sizes and career lists used by simulation insights.
 * Loaded from application.yml under 'simulation' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "simulation")
public class SimulationConfig {

    private int morningTasks = 3;
    private int afternoonTasks = 3;
    private int minCareersToCompare = 2;

    private List<String> physicallyDemandingCareers = new ArrayList<>(List.of("Doctor", "IAS Officer"));
    private List<String> highGrowthCareers = new ArrayList<>(List.of("Doctor", "IAS Officer", "Software Engineer"));
    private List<String> highSocialImpactCareers = new ArrayList<>(List.of("Doctor", "IAS Officer", "Teacher"));
}
