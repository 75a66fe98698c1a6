package dev.careerpath.service;

import dev.careerpath.config.RiskConfig;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.dto.QuickRiskIndicators;
import dev.careerpath.dto.StudentRiskProfile;
import dev.careerpath.dto.StudentRiskProfile.AcademicHistory;
import dev.careerpath.dto.StudentRiskProfile.InterestHistory;
import dev.careerpath.dto.StudentRiskProfile.StressIndicators;
import dev.careerpath.model.CareerRiskProfile;
import dev.careerpath.model.RiskCriteria;
import dev.careerpath.model.WarningBand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Failure and dropout warnings: scores academic consistency, interest stability and stress
 * tolerance, then derives an overall risk tier, career warnings and alternative paths.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskAssessor {

    public static final String LOW_RISK = "low_risk";
    public static final String MODERATE_RISK = "moderate_risk";
    public static final String HIGH_RISK = "high_risk";

    static final double MIN_SUCCESS_PROBABILITY = 0.1;

    private final ReferenceDataStore referenceData;
    private final RiskConfig config;

    public record DimensionRisk(
            double score,
            String level,
            List<String> riskFactors,
            List<String> recommendations) {
    }

    public record CareerWarning(
            String career,
            double careerStressLevel,
            String dropoutRate,
            List<String> commonFailureReasons,
            String riskAssessment,
            List<String> specificWarnings) {
    }

    public record SuccessProbability(
            double probability,
            String percentage,
            String outlook,
            String confidenceLevel) {
    }

    public record AlternativePath(String path, String description, String duration, List<String> benefits) {
    }

    public record RiskReport(
            double overallRiskScore,
            String overallRiskLevel,
            List<String> primaryConcerns,
            Map<String, DimensionRisk> riskBreakdown,
            List<CareerWarning> careerWarnings,
            List<String> recommendations,
            List<String> interventionStrategies,
            SuccessProbability successProbability,
            List<AlternativePath> alternativePaths) {
    }

    public record QuickAssessment(
            String riskLevel,
            int riskIndicatorsCount,
            List<String> warnings,
            String recommendation) {
    }

    public RiskReport assess(StudentRiskProfile profile) {
        DimensionRisk academic = academicConsistency(profile.academicHistory());
        DimensionRisk interest = interestStability(profile.interestHistory());
        DimensionRisk stress = stressTolerance(profile.stressIndicators());

        double overall = academic.score() * config.getAcademicWeight()
                + interest.score() * config.getInterestWeight()
                + stress.score() * config.getStressWeight();
        String level = overallLevel(overall);

        Map<String, DimensionRisk> breakdown = new LinkedHashMap<>();
        breakdown.put(RiskCriteria.ACADEMIC_CONSISTENCY, academic);
        breakdown.put(RiskCriteria.INTEREST_STABILITY, interest);
        breakdown.put(RiskCriteria.STRESS_TOLERANCE, stress);

        log.debug("Risk assessed: academic {}, interest {}, stress {}, overall {} ({})",
                academic.score(), interest.score(), stress.score(), overall, level);

        return new RiskReport(
                overall,
                level,
                primaryConcerns(academic, interest, stress),
                breakdown,
                careerWarnings(profile.careerPreferences(), overall),
                recommendations(academic, interest, stress),
                interventionStrategies(level),
                successProbability(overall),
                alternativePaths(overall));
    }

    DimensionRisk academicConsistency(AcademicHistory history) {
        double score = 0.0;
        List<String> factors = new ArrayList<>();

        if (history.grades().size() >= 2 && gradeTrend(history.grades()) < -0.1) {
            score += 0.3;
            factors.add("Declining academic performance");
        }
        if (history.attendanceRate() < 75) {
            score += 0.2;
            factors.add("Poor attendance record");
        }
        if (history.studyConsistencyScore() < 4) {
            score += 0.25;
            factors.add("Inconsistent study habits");
        }
        if (history.failedSubjects() > 0) {
            score += Math.min(0.25, history.failedSubjects() * 0.1);
            factors.add("Failed " + history.failedSubjects() + " subjects");
        }
        return dimension(RiskCriteria.ACADEMIC_CONSISTENCY, score, factors);
    }

    DimensionRisk interestStability(InterestHistory history) {
        double score = 0.0;
        List<String> factors = new ArrayList<>();

        if (history.careerChangesCount() >= 3) {
            score += 0.35;
            factors.add("Changed career goals " + history.careerChangesCount() + " times");
        }
        if (history.careerResearchScore() < 4) {
            score += 0.25;
            factors.add("Limited career research");
        }
        if (history.externalPressureScore() > 7) {
            score += 0.2;
            factors.add("High external pressure in career choice");
        }
        if (history.passionIndicatorsScore() < 4) {
            score += 0.2;
            factors.add("Low passion for chosen field");
        }
        return dimension(RiskCriteria.INTEREST_STABILITY, score, factors);
    }

    DimensionRisk stressTolerance(StressIndicators indicators) {
        double score = 0.0;
        List<String> factors = new ArrayList<>();

        if (indicators.anxietyLevel() > 7) {
            score += 0.3;
            factors.add("High anxiety levels");
        }
        if (indicators.pressurePerformanceScore() < 4) {
            score += 0.25;
            factors.add("Poor performance under pressure");
        }
        if (indicators.copingSkillsScore() < 4) {
            score += 0.25;
            factors.add("Lack of healthy coping mechanisms");
        }
        if (indicators.resilienceScore() < 4) {
            score += 0.2;
            factors.add("Low resilience to setbacks");
        }
        return dimension(RiskCriteria.STRESS_TOLERANCE, score, factors);
    }

    private DimensionRisk dimension(String name, double rawScore, List<String> factors) {
        double score = Math.min(1.0, rawScore);
        Map<String, WarningBand> bands = referenceData.getRiskCriteria().bandsFor(name);

        Optional<Map.Entry<String, WarningBand>> band = bands.entrySet().stream()
                .filter(entry -> entry.getValue().covers(score))
                .findFirst();
        if (band.isEmpty()) {
            log.warn("No {} band covers score {}, using '{}'", name, score, config.getFallbackLevel());
        }

        String level = band.map(Map.Entry::getKey).orElse(config.getFallbackLevel());
        List<String> recommendations = band.map(entry -> entry.getValue().recommendations())
                .orElseGet(() -> Optional.ofNullable(bands.get(level))
                        .map(WarningBand::recommendations)
                        .orElse(List.of()));
        return new DimensionRisk(score, level, List.copyOf(factors), recommendations);
    }

    /**
     * Least-squares slope of the grades over their index, relative to the best grade.
     */
    static double gradeTrend(List<Double> grades) {
        int n = grades.size();
        if (n < 2) {
            return 0.0;
        }
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double y = grades.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumX2 += (double) i * i;
            max = Math.max(max, y);
        }
        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0 || max <= 0) {
            return 0.0;
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        return slope / max;
    }

    String overallLevel(double score) {
        if (score <= config.getLowRiskCutoff()) {
            return LOW_RISK;
        }
        if (score <= config.getModerateRiskCutoff()) {
            return MODERATE_RISK;
        }
        return HIGH_RISK;
    }

    private List<String> primaryConcerns(DimensionRisk academic, DimensionRisk interest, DimensionRisk stress) {
        List<String> concerns = new ArrayList<>();
        if (academic.score() > config.getConcernThreshold()) {
            concerns.add("Academic Performance");
        }
        if (interest.score() > config.getConcernThreshold()) {
            concerns.add("Career Interest Stability");
        }
        if (stress.score() > config.getConcernThreshold()) {
            concerns.add("Stress Management");
        }
        return concerns.isEmpty() ? List.of("Overall Career Readiness") : List.copyOf(concerns);
    }

    private List<CareerWarning> careerWarnings(List<String> careers, double overall) {
        RiskCriteria criteria = referenceData.getRiskCriteria();
        List<CareerWarning> warnings = new ArrayList<>();
        for (String career : careers) {
            criteria.findCareer(career).ifPresent(info -> warnings.add(new CareerWarning(
                    career,
                    info.stressLevel(),
                    info.dropoutRate(),
                    info.commonReasons(),
                    careerFit(info, overall),
                    specificWarnings(info, overall))));
        }
        return List.copyOf(warnings);
    }

    static String careerFit(CareerRiskProfile career, double overall) {
        if (overall > 0.6 && career.stressLevel() > 3.0) {
            return "High Risk - Not Recommended";
        }
        if (overall > 0.4 && career.stressLevel() > 3.5) {
            return "Moderate Risk - Proceed with Caution";
        }
        if (overall < 0.3) {
            return "Good Fit - Low Risk";
        }
        return "Moderate Fit - Monitor Progress";
    }

    private static List<String> specificWarnings(CareerRiskProfile career, double overall) {
        List<String> warnings = new ArrayList<>();
        if (overall > 0.5) {
            warnings.add("High dropout rate (" + career.dropoutRate() + ") in this field");
            warnings.add("Your risk profile suggests challenges in this career");
        }
        if (career.stressLevel() > 3.0 && overall > 0.4) {
            warnings.add("This is a high-stress career that may not suit your stress tolerance");
        }
        return List.copyOf(warnings);
    }

    private List<String> recommendations(DimensionRisk academic, DimensionRisk interest, DimensionRisk stress) {
        List<String> recommendations = new ArrayList<>();
        if (academic.score() > config.getConcernThreshold()) {
            recommendations.addAll(List.of(
                    "Focus on improving study habits and time management",
                    "Consider academic tutoring or support services",
                    "Address attendance and engagement issues"));
        }
        if (interest.score() > config.getConcernThreshold()) {
            recommendations.addAll(List.of(
                    "Spend more time exploring career options through internships",
                    "Talk to professionals in your field of interest",
                    "Consider career counseling to clarify your interests"));
        }
        if (stress.score() > config.getConcernThreshold()) {
            recommendations.addAll(List.of(
                    "Learn stress management and relaxation techniques",
                    "Consider careers with better work-life balance",
                    "Seek counseling for anxiety management"));
        }
        return List.copyOf(recommendations);
    }

    private List<String> interventionStrategies(String level) {
        RiskCriteria criteria = referenceData.getRiskCriteria();
        List<String> strategies = new ArrayList<>();
        switch (level) {
            case HIGH_RISK -> {
                strategies.addAll(criteria.strategies("academic_support"));
                strategies.addAll(criteria.strategies("stress_management"));
                strategies.addAll(criteria.strategies("career_alternatives"));
            }
            case MODERATE_RISK -> {
                strategies.addAll(criteria.strategies("interest_exploration"));
                strategies.addAll(firstTwo(criteria.strategies("academic_support")));
            }
            default -> strategies.addAll(firstTwo(criteria.strategies("interest_exploration")));
        }
        return List.copyOf(strategies);
    }

    static SuccessProbability successProbability(double risk) {
        double probability = Math.max(MIN_SUCCESS_PROBABILITY, 1.0 - risk);

        String outlook;
        if (probability > 0.8) {
            outlook = "Excellent";
        } else if (probability > 0.6) {
            outlook = "Good";
        } else if (probability > 0.4) {
            outlook = "Fair";
        } else {
            outlook = "Challenging";
        }

        return new SuccessProbability(
                probability,
                String.format(Locale.ROOT, "%.1f%%", probability * 100),
                outlook,
                risk < 0.3 || risk > 0.7 ? "High" : "Moderate");
    }

    static List<AlternativePath> alternativePaths(double risk) {
        if (risk > 0.6) {
            return List.of(
                    new AlternativePath("Gap Year with Skill Development",
                            "Take time to build foundational skills and explore interests", "1 year",
                            List.of("Reduced pressure", "Skill building", "Career exploration")),
                    new AlternativePath("Community College Start",
                            "Begin with community college to build academic confidence", "2 years",
                            List.of("Lower cost", "Smaller classes", "Academic support")),
                    new AlternativePath("Trade/Vocational Training",
                            "Consider skilled trades with good job prospects", "6 months - 2 years",
                            List.of("Hands-on learning", "Job security", "Good wages")));
        }
        if (risk > 0.4) {
            return List.of(
                    new AlternativePath("Structured Support Program",
                            "Enroll in programs with built-in academic and career support", "Throughout education",
                            List.of("Mentorship", "Academic support", "Career guidance")),
                    new AlternativePath("Part-time Study Option",
                            "Reduce course load to manage stress and improve performance", "Extended timeline",
                            List.of("Reduced stress", "Work experience", "Better balance")));
        }
        return List.of();
    }

    /**
     * Risk tier from four yes/no indicators: three or more is high, two is moderate.
     */
    public QuickAssessment quickAssessment(QuickRiskIndicators indicators) {
        List<String> warnings = new ArrayList<>();
        if (indicators.recentGradeDrop()) {
            warnings.add("Recent decline in academic performance");
        }
        if (indicators.careerUncertainty()) {
            warnings.add("Uncertainty about career direction");
        }
        if (indicators.highStressLevels()) {
            warnings.add("High stress and anxiety levels");
        }
        if (indicators.externalPressure()) {
            warnings.add("External pressure influencing career choice");
        }

        int count = warnings.size();
        String level = count >= 3 ? HIGH_RISK : count >= 2 ? MODERATE_RISK : LOW_RISK;
        String recommendation = count > 1
                ? "Complete full assessment for detailed analysis"
                : "Continue with current path";
        return new QuickAssessment(level, count, List.copyOf(warnings), recommendation);
    }

    private static List<String> firstTwo(List<String> items) {
        return items.subList(0, Math.min(2, items.size()));
    }
}
