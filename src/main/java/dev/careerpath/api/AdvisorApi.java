package dev.careerpath.api;

import dev.careerpath.dto.ComparisonRequest;
import dev.careerpath.dto.QuickRiskIndicators;
import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.dto.SkillsGapRequest;
import dev.careerpath.dto.StudentRiskProfile;
import dev.careerpath.exception.AdvisorException;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.metrics.AdvisorMetrics;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.RoleModel;
import dev.careerpath.result.ErrorCode;
import dev.careerpath.result.Result;
import dev.careerpath.service.CareerAdvisorService;
import dev.careerpath.service.CareerAdvisorService.RecommendationResponse;
import dev.careerpath.service.CareerAdvisorService.RegionCareers;
import dev.careerpath.service.CareerComparisonService;
import dev.careerpath.service.CareerComparisonService.ComparisonReport;
import dev.careerpath.service.CareerComparisonService.DetailedComparison;
import dev.careerpath.service.CareerSimulationService;
import dev.careerpath.service.CareerSimulationService.CareerInsights;
import dev.careerpath.service.CareerSimulationService.SimulationComparison;
import dev.careerpath.service.CareerSimulationService.SimulationSummary;
import dev.careerpath.service.CareerSimulationService.SimulationView;
import dev.careerpath.service.CareerSimulationService.StressTimeline;
import dev.careerpath.service.PersonalityTestService;
import dev.careerpath.service.PersonalityTestService.PersonalityResult;
import dev.careerpath.service.PersonalityTestService.Question;
import dev.careerpath.service.RealityCheckService;
import dev.careerpath.service.RealityCheckService.RealityCheckReport;
import dev.careerpath.service.RiskAssessor;
import dev.careerpath.service.RiskAssessor.QuickAssessment;
import dev.careerpath.service.RiskAssessor.RiskReport;
import dev.careerpath.service.RoleModelService;
import dev.careerpath.service.RoleModelService.CareerPathExample;
import dev.careerpath.service.RoleModelService.Inspiration;
import dev.careerpath.service.RoleModelService.RegionalAdvice;
import dev.careerpath.service.RoleModelService.SkillTip;
import dev.careerpath.service.SkillsGapAnalyzer.SkillsGapReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for callers such as a web layer. Every operation returns a {@link Result};
 * no exception escapes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdvisorApi {

    private final CareerAdvisorService advisorService;
    private final PersonalityTestService personalityTestService;
    private final CareerComparisonService comparisonService;
    private final CareerSimulationService simulationService;
    private final RealityCheckService realityCheckService;
    private final RoleModelService roleModelService;
    private final RiskAssessor riskAssessor;
    private final AdvisorMetrics metrics;

    public Result<RecommendationResponse> recommend(RecommendationRequest request) {
        return handle("recommend", () -> {
            RecommendationResponse response = advisorService.recommend(required(request, "request"));
            metrics.recordRecommendations(response.recommendations().size());
            return response;
        });
    }

    public Result<List<Question>> personalityQuestions() {
        return handle("personality_questions", personalityTestService::getQuestions);
    }

    public Result<PersonalityResult> personalityResult(List<Integer> answers) {
        return handle("personality_result", () -> personalityTestService.calculate(answers));
    }

    public Result<ComparisonReport> compare(ComparisonRequest request) {
        return handle("compare", () -> {
            ComparisonRequest checked = required(request, "request");
            return comparisonService.compare(checked.careers(), advisorService.resolveRegion(checked.region()));
        });
    }

    public Result<DetailedComparison> compareDetailed(String careerA, String careerB, String region) {
        return handle("compare_detailed", () -> comparisonService.compareDetailed(
                requiredText(careerA, "career_a"), requiredText(careerB, "career_b"),
                advisorService.resolveRegion(region)));
    }

    public Result<List<String>> comparisonCareers(String region) {
        return handle("comparison_careers", () -> comparisonService.availableCareers(
                CareerComparisonService.ALL_REGIONS.equals(region) ? region : advisorService.resolveRegion(region)));
    }

    public Result<SimulationView> careerSimulation(String careerName, String region) {
        return handle("career_simulation", () -> simulationService.simulate(
                requiredText(careerName, "career_name"), advisorService.resolveRegion(region)));
    }

    public Result<SimulationSummary> simulationSummary(String careerName, String region) {
        return handle("simulation_summary", () -> simulationService.summary(
                requiredText(careerName, "career_name"), advisorService.resolveRegion(region)));
    }

    public Result<StressTimeline> stressTimeline(String careerName, String region) {
        return handle("stress_timeline", () -> simulationService.timeline(
                requiredText(careerName, "career_name"), advisorService.resolveRegion(region)));
    }

    public Result<CareerInsights> careerInsights(String careerName, String region) {
        return handle("career_insights", () -> simulationService.insights(
                requiredText(careerName, "career_name"), advisorService.resolveRegion(region)));
    }

    public Result<SimulationComparison> compareSimulations(List<String> careerNames, String region) {
        return handle("compare_simulations", () -> simulationService.compare(
                required(careerNames, "careers"), advisorService.resolveRegion(region)));
    }

    public Result<List<String>> simulationCareers() {
        return handle("simulation_careers", simulationService::availableCareers);
    }

    public Result<SkillsGapReport> skillsGap(SkillsGapRequest request) {
        return handle("skills_gap", () -> advisorService.skillsGap(required(request, "request")));
    }

    public Result<RealityCheckReport> realityCheck(String careerName) {
        return handle("reality_check", () -> realityCheckService.realityCheck(
                requiredText(careerName, "career_name")));
    }

    public Result<RegionCareers> careersByRegion(String region) {
        return handle("careers_by_region", () -> advisorService.careersByRegion(region));
    }

    public Result<CareerTip> dailyTip(String careerFocus, String userId, String mode) {
        return handle("daily_tip", () -> roleModelService.dailyTip(careerFocus, userId,
                advisorService.resolveMode(mode)));
    }

    public Result<List<CareerTip>> weeklyTips(String careerFocus, String mode) {
        return handle("weekly_tips", () -> roleModelService.weeklyTips(careerFocus,
                advisorService.resolveMode(mode)));
    }

    public Result<List<RoleModel>> roleModels(String careerName, String region) {
        return handle("role_models", () -> roleModelService.forCareer(advisorService.resolveRegion(region),
                requiredText(careerName, "career_name")));
    }

    public Result<List<CareerTip>> tipsByCategory(String category) {
        return handle("tips_by_category", () -> roleModelService.tipsByCategory(requiredText(category, "category")));
    }

    public Result<Inspiration> inspiration(String region, String careerName) {
        return handle("inspiration", () -> roleModelService.inspiration(advisorService.resolveRegion(region),
                careerName));
    }

    public Result<CareerPathExample> careerPathExample(String careerName, String region) {
        return handle("career_path_example", () -> roleModelService.careerPathExample(
                advisorService.resolveRegion(region), requiredText(careerName, "career_name")));
    }

    public Result<List<RoleModel>> searchRoleModels(String query, String region) {
        return handle("search_role_models", () -> roleModelService.search(advisorService.resolveRegion(region),
                requiredText(query, "query")));
    }

    public Result<List<SkillTip>> skillDevelopmentTips(List<String> skills) {
        return handle("skill_development_tips", () -> roleModelService.skillDevelopmentTips(
                required(skills, "skills")));
    }

    public Result<List<RegionalAdvice>> regionSpecificAdvice(String careerName, String region) {
        return handle("region_specific_advice", () -> roleModelService.regionSpecificAdvice(
                advisorService.resolveRegion(region), requiredText(careerName, "career_name")));
    }

    public Result<RiskReport> assessRisk(StudentRiskProfile profile) {
        return handle("assess_risk", () -> riskAssessor.assess(required(profile, "profile")));
    }

    public Result<QuickAssessment> quickRiskAssessment(QuickRiskIndicators indicators) {
        return handle("quick_risk_assessment", () -> riskAssessor.quickAssessment(required(indicators, "indicators")));
    }

    <T> Result<T> handle(String operation, Supplier<T> action) {
        metrics.recordRequest(operation);
        try {
            return Result.success(metrics.getOperationTimer(operation).record(action));
        } catch (NotFoundException e) {
            metrics.recordNotFound();
            log.info("{}: {}", operation, e.getMessage());
            return Result.notFound(e.getMessage(), e.getAvailableKeys());
        } catch (ValidationException e) {
            metrics.recordValidationError();
            log.warn("{} rejected: {}", operation, e.getMessage());
            return Result.error(e.getErrorCode(), e.getMessage());
        } catch (AdvisorException e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            return Result.error(e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            metrics.recordUnexpectedError();
            log.error("Unexpected failure in {}", operation, e);
            return Result.error(ErrorCode.UNEXPECTED_ERROR);
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    private static String requiredText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
