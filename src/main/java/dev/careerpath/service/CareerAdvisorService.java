package dev.careerpath.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.config.AdvisorProperties;
import dev.careerpath.config.MatchingConfig;
import dev.careerpath.config.MatchingConfig.RegionSettings;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.dto.RecommendationRequest;
import dev.careerpath.dto.SkillsGapRequest;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.Career;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.RoleModel;
import dev.careerpath.model.UserProfile;
import dev.careerpath.service.CareerRanker.RankedCareer;
import dev.careerpath.service.CareerRanker.Visualization;
import dev.careerpath.service.ExplanationGenerator.Explanation;
import dev.careerpath.service.RoleModelService.Inspiration;
import dev.careerpath.service.SkillsGapAnalyzer.SkillsGapReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a full recommendation: profile, ranking, explanation and skills gap per career, plus
 * role models, the tip of the day and an inspiration quote.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CareerAdvisorService {

    private final ReferenceDataStore referenceData;
    private final AdvisorProperties properties;
    private final MatchingConfig matchingConfig;
    private final ProfileBuilder profileBuilder;
    private final CareerRanker ranker;
    private final ExplanationGenerator explanationGenerator;
    private final SkillsGapAnalyzer skillsGapAnalyzer;
    private final RoleModelService roleModelService;

    public record Recommendation(Career career, Explanation explanation, SkillsGapReport skillsGap) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RecommendationResponse(
            List<Recommendation> recommendations,
            Visualization visualization,
            List<RoleModel> roleModels,
            CareerTip dailyTip,
            Inspiration inspiration,
            RegionSettings regionInfo,
            String mode,
            String region) {
    }

    public record RegionCareers(List<Career> careers, RegionSettings regionInfo, String region) {
    }

    public RecommendationResponse recommend(RecommendationRequest request) {
        String region = resolveRegion(request.region());
        String mode = resolveMode(request.mode());

        UserProfile profile = profileBuilder.build(request, region, mode);
        List<RankedCareer> ranked = ranker.recommend(profile, referenceData.getCareers(region),
                properties.getRecommendationLimit());

        List<Recommendation> recommendations = ranked.stream()
                .map(RankedCareer::career)
                .map(career -> new Recommendation(
                        career,
                        explanationGenerator.explain(career, request),
                        skillsGapAnalyzer.analyze(request.skills(), career, request.subjects())))
                .toList();

        List<String> names = ranked.stream().map(entry -> entry.career().name()).toList();
        String topCareer = names.isEmpty() ? null : names.get(0);

        log.info("Recommended {} careers for region '{}' in {} mode", names.size(), region, mode);

        return new RecommendationResponse(
                recommendations,
                ranker.visualize(profile, ranked, properties.getVisualizationSize()),
                roleModelService.forCareers(region, names),
                topCareer != null ? roleModelService.dailyTip(topCareer, request.userId(), mode) : null,
                roleModelService.inspiration(region, topCareer),
                matchingConfig.regionFor(region),
                mode,
                region);
    }

    /**
     * Skills gap against a career of the request's region, matched by name ignoring case.
     */
    public SkillsGapReport skillsGap(SkillsGapRequest request) {
        if (request.careerName() == null || request.careerName().isBlank()) {
            throw new ValidationException("Career name is required");
        }
        String region = resolveRegion(request.region());
        List<Career> careers = referenceData.getCareers(region);

        Career career = careers.stream()
                .filter(candidate -> candidate.name().equalsIgnoreCase(request.careerName()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Career not found: " + request.careerName(),
                        careers.stream().map(Career::name).toList()));

        return skillsGapAnalyzer.analyze(request.userSkills(), career, request.userSubjects());
    }

    public RegionCareers careersByRegion(String requestedRegion) {
        String region = resolveRegion(requestedRegion);
        return new RegionCareers(referenceData.getCareers(region), matchingConfig.regionFor(region), region);
    }

    /**
     * The given region, or the default one when absent. Fails on a region with no settings.
     */
    public String resolveRegion(String region) {
        String resolved = region == null || region.isBlank() ? properties.getDefaultRegion() : region;
        matchingConfig.regionFor(resolved);
        return resolved;
    }

    public String resolveMode(String mode) {
        String resolved = mode == null || mode.isBlank() ? properties.getDefaultMode() : mode;
        matchingConfig.weightsFor(resolved);
        return resolved;
    }
}
