package dev.careerpath.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.config.AdvisorProperties;
import dev.careerpath.config.MatchingConfig;
import dev.careerpath.model.Career;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.PersonalityArchetype;
import dev.careerpath.model.RealityCheckTable;
import dev.careerpath.model.RiskCriteria;
import dev.careerpath.model.RoleModel;
import dev.careerpath.model.SimulationTable;
import dev.careerpath.model.SkillTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads the reference JSON files and freezes them into a {@link ReferenceDataStore}.
 * A missing file falls back to {@link DefaultReferenceData}; a malformed one fails the load.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDataLoader {

    static final String SKILLS_FILE = "skills_mapping.json";
    static final String PERSONALITY_FILE = "personality_types.json";
    static final String TIPS_FILE = "career_tips.json";
    static final String REALITY_FILE = "career_reality_check.json";
    static final String SIMULATIONS_FILE = "career_simulations.json";
    static final String RISK_FILE = "failure_warning_criteria.json";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final AdvisorProperties advisorProperties;
    private final MatchingConfig matchingConfig;

    public ReferenceDataStore load() {
        InMemoryReferenceDataStore.InMemoryReferenceDataStoreBuilder builder = InMemoryReferenceDataStore.builder()
                .homeRegion(advisorProperties.getHomeRegion());

        matchingConfig.getRegions().forEach((region, settings) -> {
            List<Career> careers = read(settings.getCareerFile(), new TypeReference<List<Career>>() {
            }, DefaultReferenceData::careers);
            List<RoleModel> roleModels = read(settings.getRoleModelFile(), new TypeReference<List<RoleModel>>() {
            }, List::of);
            log.info("Region '{}': {} careers, {} role models", region, careers.size(), roleModels.size());
            builder.regionCareers(region, careers).regionRoleModels(region, roleModels);
        });

        ReferenceDataStore store = builder
                .taxonomy(read(SKILLS_FILE, new TypeReference<SkillTaxonomy>() {
                }, DefaultReferenceData::taxonomy))
                .personalityTypes(read(PERSONALITY_FILE, new TypeReference<Map<String, PersonalityArchetype>>() {
                }, DefaultReferenceData::personalityTypes))
                .tips(read(TIPS_FILE, new TypeReference<List<CareerTip>>() {
                }, List::of))
                .realityChecks(read(REALITY_FILE, new TypeReference<RealityCheckTable>() {
                }, () -> RealityCheckTable.EMPTY))
                .simulations(read(SIMULATIONS_FILE, new TypeReference<SimulationTable>() {
                }, () -> SimulationTable.EMPTY))
                .riskCriteria(read(RISK_FILE, new TypeReference<RiskCriteria>() {
                }, DefaultReferenceData::riskCriteria))
                .build();

        log.info("Reference data loaded: {} catalog careers, {} tips, {} simulations",
                store.getCareerCatalog().size(), store.getTips().size(),
                store.getSimulations().careerSimulations().size());
        return store;
    }

    private <T> T read(String fileName, TypeReference<T> type, Supplier<T> fallback) {
        String location = advisorProperties.getReferenceDataLocation() + fileName;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("{} not found. Using built-in defaults.", location);
            return fallback.get();
        }

        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it matches the required structure.", location, e);
            throw new IllegalStateException("Could not load reference data " + fileName, e);
        }
    }
}
