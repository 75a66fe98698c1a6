package dev.careerpath.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;

/**
 * Self-reported indicators used by the failure and dropout warning assessment.
 * Scores are on a 1-10 scale; absent values take the neutral defaults below.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record StudentRiskProfile(
        AcademicHistory academicHistory,
        InterestHistory interestHistory,
        StressIndicators stressIndicators,
        List<String> careerPreferences) {

    public StudentRiskProfile {
        if (academicHistory == null) {
            academicHistory = AcademicHistory.builder().build();
        }
        if (interestHistory == null) {
            interestHistory = InterestHistory.builder().build();
        }
        if (stressIndicators == null) {
            stressIndicators = StressIndicators.builder().build();
        }
        careerPreferences = Frozen.list(careerPreferences);
    }

    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AcademicHistory(
            List<Double> grades,
            Double attendanceRate,
            Integer studyConsistencyScore,
            Integer failedSubjects) {

        public AcademicHistory {
            grades = Frozen.list(grades);
            if (attendanceRate == null) {
                attendanceRate = 100.0;
            }
            if (studyConsistencyScore == null) {
                studyConsistencyScore = 5;
            }
            if (failedSubjects == null) {
                failedSubjects = 0;
            }
        }
    }

    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InterestHistory(
            Integer careerChangesCount,
            Integer careerResearchScore,
            Integer externalPressureScore,
            Integer passionIndicatorsScore) {

        public InterestHistory {
            if (careerChangesCount == null) {
                careerChangesCount = 0;
            }
            if (careerResearchScore == null) {
                careerResearchScore = 5;
            }
            if (externalPressureScore == null) {
                externalPressureScore = 3;
            }
            if (passionIndicatorsScore == null) {
                passionIndicatorsScore = 5;
            }
        }
    }

    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StressIndicators(
            Integer anxietyLevel,
            Integer pressurePerformanceScore,
            Integer copingSkillsScore,
            Integer resilienceScore) {

        public StressIndicators {
            if (anxietyLevel == null) {
                anxietyLevel = 3;
            }
            if (pressurePerformanceScore == null) {
                pressurePerformanceScore = 5;
            }
            if (copingSkillsScore == null) {
                copingSkillsScore = 5;
            }
            if (resilienceScore == null) {
                resilienceScore = 5;
            }
        }
    }
}
