package dev.careerpath.service;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import dev.careerpath.config.SimulationConfig;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.CareerSimulation;
import dev.careerpath.model.ScheduleTask;
import dev.careerpath.model.WorkingHours;
import dev.careerpath.service.SimulationMetricsEngine.DailyPatterns;
import dev.careerpath.service.SimulationMetricsEngine.PeakStress;
import dev.careerpath.service.SimulationMetricsEngine.ScheduleMetrics;
import dev.careerpath.service.SimulationMetricsEngine.WorkIntensity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * "A day in the life" views of a career: the raw simulation with derived metrics, a summary,
 * a stress timeline, insights, and a comparison across careers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CareerSimulationService {

    static final int KEY_ITEMS = 3;

    private final ReferenceDataStore referenceData;
    private final SimulationMetricsEngine metricsEngine;
    private final SimulationConfig config;

    public record SimulationView(
            @JsonUnwrapped CareerSimulation simulation,
            int totalTasks,
            PeakStress peakStressTime,
            Map<Integer, Integer> stressDistribution,
            WorkIntensity workIntensity) {
    }

    public record SimulationSummary(
            String careerTitle,
            String overview,
            WorkingHours workingHours,
            double averageStressLevel,
            String workLifeBalance,
            String salaryRange,
            List<String> keyStressFactors,
            List<String> keyRewards,
            PeakStress peakStressTime,
            WorkIntensity workIntensity) {
    }

    public record SimulationComparison(List<SimulationSummary> careers, Map<String, List<String>> rankings) {
    }

    public record StressTimeline(
            String careerTitle,
            List<ScheduleTask> timeline,
            Map<String, String> stressScale,
            double averageStress) {
    }

    public record CareerInsights(
            String careerTitle,
            DailyPatterns dailyPatterns,
            WorkCharacteristics workCharacteristics,
            CareerProgression careerProgression,
            LifestyleImpact lifestyleImpact) {
    }

    public record WorkCharacteristics(
            double totalWorkingHours,
            String flexibility,
            String physicalDemands,
            String mentalDemands) {
    }

    public record CareerProgression(String entryBarrier, String learningCurve, String growthPotential) {
    }

    public record LifestyleImpact(int workLifeBalanceRating, String socialImpact, String financialStability) {
    }

    public List<String> availableCareers() {
        return List.copyOf(referenceData.getSimulations().careerSimulations().keySet());
    }

    public SimulationView simulate(String careerName, String region) {
        CareerSimulation simulation = find(careerName).forRegion(region);
        ScheduleMetrics metrics = metricsEngine.metrics(simulation.dailySchedule());
        return new SimulationView(simulation, metrics.totalTasks(), metrics.peakStressTime(),
                metrics.stressDistribution(), metrics.workIntensity());
    }

    public SimulationSummary summary(String careerName, String region) {
        return summarize(find(careerName).forRegion(region));
    }

    public StressTimeline timeline(String careerName, String region) {
        CareerSimulation simulation = find(careerName).forRegion(region);
        return new StressTimeline(
                simulation.careerTitle(),
                simulation.dailySchedule(),
                referenceData.getSimulations().simulationMetadata().stressScale(),
                simulation.averageStressLevel());
    }

    public CareerInsights insights(String careerName, String region) {
        String canonical = canonicalName(careerName);
        CareerSimulation simulation = find(canonical).forRegion(region);
        List<ScheduleTask> schedule = simulation.dailySchedule();
        boolean stressful = simulation.averageStressLevel() > 3;
        WorkingHours hours = simulation.workingHours();

        WorkCharacteristics work = new WorkCharacteristics(
                hours != null ? hours.totalHours() : 0.0,
                hours != null && hours.flexible() ? "High" : "Medium",
                config.getPhysicallyDemandingCareers().contains(canonical) ? "High" : "Low",
                stressful ? "High" : "Medium");

        CareerProgression progression = new CareerProgression(
                simulation.educationRequired().toLowerCase(Locale.ROOT).contains("degree") ? "High" : "Medium",
                stressful ? "Steep" : "Moderate",
                config.getHighGrowthCareers().contains(canonical) ? "High" : "Medium");

        String salary = simulation.salaryRange();
        LifestyleImpact lifestyle = new LifestyleImpact(
                metricsEngine.workLifeBalanceScore(schedule),
                config.getHighSocialImpactCareers().contains(canonical) ? "High" : "Medium",
                salary.toLowerCase(Locale.ROOT).contains("high") || salary.contains("$") ? "High" : "Medium");

        return new CareerInsights(simulation.careerTitle(), metricsEngine.dailyPatterns(schedule),
                work, progression, lifestyle);
    }

    /**
     * Compare the simulations of several careers. Names without a simulation are skipped, but at
     * least two must remain.
     */
    public SimulationComparison compare(List<String> careerNames, String region) {
        if (careerNames.size() < config.getMinCareersToCompare()) {
            throw new ValidationException(
                    "Please select at least " + config.getMinCareersToCompare() + " careers to compare");
        }

        List<SimulationSummary> summaries = new ArrayList<>();
        for (String name : careerNames) {
            lookup(name).ifPresentOrElse(
                    simulation -> summaries.add(summarize(simulation.forRegion(region))),
                    () -> log.warn("No simulation for '{}', skipping it in the comparison", name));
        }
        if (summaries.size() < config.getMinCareersToCompare()) {
            throw new ValidationException("Not enough valid careers for comparison");
        }

        Map<String, List<String>> rankings = new LinkedHashMap<>();
        rankings.put("lowest_stress", rank(summaries,
                Comparator.comparingDouble(SimulationSummary::averageStressLevel)));
        rankings.put("best_work_life_balance", rank(summaries,
                Comparator.comparingInt((SimulationSummary s) -> s.workIntensity().workLifeBalanceScore()).reversed()));
        rankings.put("shortest_hours", rank(summaries,
                Comparator.comparingDouble(CareerSimulationService::totalHours)));
        rankings.put("highest_intensity", rank(summaries,
                Comparator.comparingDouble((SimulationSummary s) -> s.workIntensity().averageIntensity()).reversed()));

        return new SimulationComparison(List.copyOf(summaries), rankings);
    }

    private SimulationSummary summarize(CareerSimulation simulation) {
        List<ScheduleTask> schedule = simulation.dailySchedule();
        return new SimulationSummary(
                simulation.careerTitle(),
                simulation.overview(),
                simulation.workingHours(),
                simulation.averageStressLevel(),
                simulation.workLifeBalance(),
                simulation.salaryRange(),
                first(simulation.stressFactors()),
                first(simulation.rewards()),
                metricsEngine.peakStress(schedule),
                metricsEngine.workIntensity(schedule));
    }

    private CareerSimulation find(String careerName) {
        return lookup(careerName).orElseThrow(() -> new NotFoundException(
                "Simulation not available for " + careerName, availableCareers()));
    }

    private Optional<CareerSimulation> lookup(String careerName) {
        Map<String, CareerSimulation> simulations = referenceData.getSimulations().careerSimulations();
        return Optional.ofNullable(simulations.get(canonicalName(careerName)));
    }

    /** The table key matching the name, ignoring case, or the name itself. */
    private String canonicalName(String careerName) {
        Map<String, CareerSimulation> simulations = referenceData.getSimulations().careerSimulations();
        if (simulations.containsKey(careerName)) {
            return careerName;
        }
        return simulations.keySet().stream()
                .filter(key -> key.equalsIgnoreCase(careerName))
                .findFirst()
                .orElse(careerName);
    }

    private static double totalHours(SimulationSummary summary) {
        return summary.workingHours() != null ? summary.workingHours().totalHours() : 0.0;
    }

    private static List<String> first(List<String> items) {
        return List.copyOf(items.subList(0, Math.min(KEY_ITEMS, items.size())));
    }

    private static List<String> rank(List<SimulationSummary> summaries, Comparator<SimulationSummary> order) {
        return summaries.stream().sorted(order).map(SimulationSummary::careerTitle).toList();
    }
}
