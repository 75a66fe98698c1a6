package dev.careerpath.data;

import dev.careerpath.model.Career;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.PersonalityArchetype;
import dev.careerpath.model.RealityCheckTable;
import dev.careerpath.model.RiskCriteria;
import dev.careerpath.model.RoleModel;
import dev.careerpath.model.SimulationTable;
import dev.careerpath.model.SkillTaxonomy;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the static reference tables. Implementations are loaded once
 * and never change afterwards, so they can be shared freely between threads.
 */
public interface ReferenceDataStore {

    /**
     * Careers of one region's table, in file order. Empty for an unknown region.
     */
    List<Career> getCareers(String region);

    /**
     * Careers of every region merged by name: home-region careers carrying the salary and
     * outlook overlays of the other regions, followed by region-only careers.
     */
    Map<String, Career> getCareerCatalog();

    Set<String> getRegions();

    SkillTaxonomy getTaxonomy();

    Map<String, PersonalityArchetype> getPersonalityTypes();

    List<RoleModel> getRoleModels(String region);

    List<CareerTip> getTips();

    RealityCheckTable getRealityChecks();

    SimulationTable getSimulations();

    RiskCriteria getRiskCriteria();
}
