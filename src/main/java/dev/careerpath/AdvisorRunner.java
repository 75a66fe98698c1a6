package dev.careerpath;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.api.AdvisorApi;
import dev.careerpath.config.AdvisorProperties;
import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.result.Result;
import dev.careerpath.service.CareerAdvisorService.Recommendation;
import dev.careerpath.service.CareerAdvisorService.RecommendationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Reads a recommendation request from disk, runs it and logs the outcome.
 * Separated from the main Application class for better testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdvisorRunner {

    private static final String SEPARATOR = "========================================";
    private static final int TOP_GAPS = 3;

    private final AdvisorApi advisorApi;
    private final AdvisorProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Runs the request file through the advisor.
     *
     * @return number of careers recommended
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Career Path Advisor Starting");
        log.info(SEPARATOR);

        File file = new File(properties.getRequestFile());
        if (!file.exists()) {
            log.warn("{} not found. Nothing to recommend.", file.getPath());
            return 0;
        }

        RecommendationRequest request;
        try {
            request = objectMapper.readValue(file, RecommendationRequest.class);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file.getPath(), e.getMessage(), e);
            throw new IllegalStateException("Could not read recommendation request", e);
        }

        Result<RecommendationResponse> result = advisorApi.recommend(request);
        if (!result.isSuccess()) {
            log.error("Recommendation failed ({}): {}", result.getCode(), result.getMsg());
            throw new IllegalStateException("Recommendation failed: " + result.getMsg());
        }

        List<Recommendation> recommendations = result.getData().recommendations();
        recommendations.forEach(AdvisorRunner::logRecommendation);

        log.info(SEPARATOR);
        log.info("Career Path Advisor Completed Successfully");
        log.info("Careers recommended: {}", recommendations.size());
        log.info(SEPARATOR);
        return recommendations.size();
    }

    private static void logRecommendation(Recommendation recommendation) {
        List<String> missing = recommendation.skillsGap().missingSkills().skills();
        log.info("{} - {}% match, {} ({}% skills), top gaps: {}",
                recommendation.career().name(),
                recommendation.explanation().overallMatch(),
                recommendation.skillsGap().readinessLevel().level(),
                recommendation.skillsGap().skillMatchPercentage(),
                missing.subList(0, Math.min(TOP_GAPS, missing.size())));
    }
}
