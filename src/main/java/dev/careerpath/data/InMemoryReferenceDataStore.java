package dev.careerpath.data;

import dev.careerpath.model.Career;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.PersonalityArchetype;
import dev.careerpath.model.RealityCheckTable;
import dev.careerpath.model.RiskCriteria;
import dev.careerpath.model.RoleModel;
import dev.careerpath.model.SimulationTable;
import dev.careerpath.model.SkillTaxonomy;
import dev.careerpath.util.Frozen;
import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of every reference table.
 */
public class InMemoryReferenceDataStore implements ReferenceDataStore {

    public static final String DEFAULT_HOME_REGION = "global";

    private final String homeRegion;
    private final Map<String, List<Career>> careersByRegion;
    private final Map<String, List<RoleModel>> roleModelsByRegion;
    private final Map<String, Career> catalog;
    private final SkillTaxonomy taxonomy;
    private final Map<String, PersonalityArchetype> personalityTypes;
    private final List<CareerTip> tips;
    private final RealityCheckTable realityChecks;
    private final SimulationTable simulations;
    private final RiskCriteria riskCriteria;

    @Builder
    private InMemoryReferenceDataStore(
            String homeRegion,
            @Singular("regionCareers") Map<String, List<Career>> careersByRegion,
            @Singular("regionRoleModels") Map<String, List<RoleModel>> roleModelsByRegion,
            SkillTaxonomy taxonomy,
            Map<String, PersonalityArchetype> personalityTypes,
            List<CareerTip> tips,
            RealityCheckTable realityChecks,
            SimulationTable simulations,
            RiskCriteria riskCriteria) {
        this.homeRegion = homeRegion != null ? homeRegion : DEFAULT_HOME_REGION;
        this.careersByRegion = tagRegions(careersByRegion);
        this.roleModelsByRegion = freezeValues(roleModelsByRegion);
        this.catalog = mergeCatalog(this.homeRegion, this.careersByRegion);
        this.taxonomy = taxonomy != null ? taxonomy : SkillTaxonomy.builder().build();
        this.personalityTypes = Frozen.map(personalityTypes);
        this.tips = Frozen.list(tips);
        this.realityChecks = realityChecks != null ? realityChecks : RealityCheckTable.EMPTY;
        this.simulations = simulations != null ? simulations : SimulationTable.EMPTY;
        this.riskCriteria = riskCriteria != null ? riskCriteria : DefaultReferenceData.riskCriteria();
    }

    @Override
    public List<Career> getCareers(String region) {
        return careersByRegion.getOrDefault(region, List.of());
    }

    @Override
    public Map<String, Career> getCareerCatalog() {
        return catalog;
    }

    @Override
    public Set<String> getRegions() {
        return careersByRegion.keySet();
    }

    @Override
    public SkillTaxonomy getTaxonomy() {
        return taxonomy;
    }

    @Override
    public Map<String, PersonalityArchetype> getPersonalityTypes() {
        return personalityTypes;
    }

    @Override
    public List<RoleModel> getRoleModels(String region) {
        return roleModelsByRegion.getOrDefault(region, List.of());
    }

    @Override
    public List<CareerTip> getTips() {
        return tips;
    }

    @Override
    public RealityCheckTable getRealityChecks() {
        return realityChecks;
    }

    @Override
    public SimulationTable getSimulations() {
        return simulations;
    }

    @Override
    public RiskCriteria getRiskCriteria() {
        return riskCriteria;
    }

    private static Map<String, List<Career>> tagRegions(Map<String, List<Career>> source) {
        Map<String, List<Career>> tagged = new LinkedHashMap<>();
        source.forEach((region, careers) -> tagged.put(region, careers.stream()
                .map(career -> career.toBuilder().region(region).build())
                .toList()));
        return Collections.unmodifiableMap(tagged);
    }

    private static <T> Map<String, List<T>> freezeValues(Map<String, List<T>> source) {
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        source.forEach((key, values) -> frozen.put(key, Frozen.list(values)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, Career> mergeCatalog(String homeRegion, Map<String, List<Career>> careersByRegion) {
        Map<String, Career> merged = new LinkedHashMap<>();
        careersByRegion.getOrDefault(homeRegion, List.of())
                .forEach(career -> merged.put(career.name(), career));

        careersByRegion.forEach((region, careers) -> {
            if (region.equals(homeRegion)) {
                return;
            }
            for (Career career : careers) {
                Career existing = merged.get(career.name());
                if (existing == null) {
                    merged.put(career.name(), career);
                    continue;
                }
                Map<String, String> salaries = new HashMap<>(existing.regionalSalary());
                Map<String, String> outlooks = new HashMap<>(existing.regionalOutlook());
                salaries.put(region, career.medianSalary() != null ? career.medianSalary() : "N/A");
                outlooks.put(region, career.jobOutlook() != null ? career.jobOutlook() : "N/A");
                merged.put(career.name(), existing.toBuilder()
                        .regionalSalary(salaries)
                        .regionalOutlook(outlooks)
                        .build());
            }
        });
        return Collections.unmodifiableMap(merged);
    }
}
