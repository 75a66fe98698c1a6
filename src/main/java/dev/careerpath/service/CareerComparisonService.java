package dev.careerpath.service;

import dev.careerpath.config.ComparisonConfig;
import dev.careerpath.config.ComparisonConfig.KeywordBand;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.exception.NotFoundException;
import dev.careerpath.exception.ValidationException;
import dev.careerpath.model.Career;
import dev.careerpath.model.RealityCheck;
import dev.careerpath.model.RealityCheckEntry;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Side-by-side comparison of two to five careers over salary, stress, work-life balance,
 * growth and skill complexity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CareerComparisonService {

    public static final String ALL_REGIONS = "all";

    static final String SALARY = "salary";
    static final String STRESS_LEVEL = "stress_level";
    static final String WORK_LIFE_BALANCE = "work_life_balance";
    static final String GROWTH_RATE = "growth_rate";
    static final String SKILLS_COMPLEXITY = "skills_complexity";

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern LAKH = Pattern.compile("lakh|lac\\b|lpa\\b|\\d\\s*l\\b");
    private static final Pattern CRORE = Pattern.compile("crore|\\bcr\\b|\\d\\s*cr\\b");
    private static final Pattern THOUSAND = Pattern.compile("\\d\\s*k\\b");
    private static final Pattern RANGE = Pattern.compile("\\d\\s*k?\\s*(?:-|–|to)\\s*\\D{0,3}\\d");

    private final ReferenceDataStore referenceData;
    private final ComparisonConfig config;

    public record CareerMetrics(
            String name,
            String salary,
            long salaryNumeric,
            String stressLevel,
            int stressScore,
            String workLifeBalance,
            int workLifeScore,
            String growthRate,
            double growthNumeric,
            List<String> requiredSkills,
            int skillsComplexity,
            String description,
            String jobOutlook) {
    }

    public record ComparisonReport(
            List<CareerMetrics> careers,
            Map<String, List<String>> rankings,
            String region) {
    }

    public record DetailedComparison(
            CareerMetrics careerA,
            CareerMetrics careerB,
            Map<String, String> winnerAnalysis,
            String region) {
    }

    /**
     * Career names that can be compared in a region, sorted. {@value #ALL_REGIONS} lists every career.
     */
    public List<String> availableCareers(String region) {
        Map<String, Career> catalog = referenceData.getCareerCatalog();
        if (ALL_REGIONS.equals(region)) {
            return List.copyOf(catalog.keySet());
        }
        if (!referenceData.getRegions().contains(region)) {
            throw new ValidationException("Unknown region '" + region + "', expected one of "
                    + referenceData.getRegions() + " or '" + ALL_REGIONS + "'");
        }
        return catalog.values().stream()
                .filter(career -> career.isOfferedIn(region))
                .map(Career::name)
                .sorted()
                .toList();
    }

    /**
     * Names are matched ignoring case and reported under their catalog spelling.
     */
    public ComparisonReport compare(List<String> careerNames, String region) {
        if (careerNames.size() < config.getMinCareers()) {
            throw new ValidationException(
                    "Please select at least " + config.getMinCareers() + " careers to compare");
        }
        if (careerNames.size() > config.getMaxCareers()) {
            throw new ValidationException(
                    "Maximum " + config.getMaxCareers() + " careers can be compared at once");
        }

        List<CareerMetrics> metrics = careerNames.stream()
                .map(name -> metricsFor(resolve(name), region))
                .toList();

        log.debug("Compared {} careers in region '{}'", metrics.size(), region);
        return new ComparisonReport(metrics, rankings(metrics), region);
    }

    /**
     * Two careers side by side with the winner of each dimension. A tie goes to the second career.
     */
    public DetailedComparison compareDetailed(String first, String second, String region) {
        List<CareerMetrics> metrics = compare(List.of(first, second), region).careers();
        CareerMetrics a = metrics.get(0);
        CareerMetrics b = metrics.get(1);

        Map<String, String> winners = new LinkedHashMap<>();
        winners.put(SALARY, a.salaryNumeric() > b.salaryNumeric() ? a.name() : b.name());
        winners.put(WORK_LIFE_BALANCE, a.workLifeScore() > b.workLifeScore() ? a.name() : b.name());
        winners.put("low_stress", a.stressScore() < b.stressScore() ? a.name() : b.name());
        winners.put("growth_potential", a.growthNumeric() > b.growthNumeric() ? a.name() : b.name());
        winners.put("easier_entry", a.skillsComplexity() < b.skillsComplexity() ? a.name() : b.name());

        return new DetailedComparison(a, b, winners, region);
    }

    private Career resolve(String name) {
        Map<String, Career> catalog = referenceData.getCareerCatalog();
        Career career = catalog.get(name);
        if (career != null) {
            return career;
        }
        return catalog.values().stream()
                .filter(candidate -> candidate.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "Career '" + name + "' is not available for comparison",
                        List.copyOf(catalog.keySet())));
    }

    CareerMetrics metricsFor(Career career, String region) {
        Optional<RealityCheck> reality = Optional
                .ofNullable(referenceData.getRealityChecks().careerRealityData().get(career.name()))
                .map(RealityCheckEntry::realityCheck);
        String stress = reality.map(RealityCheck::stressLevel).orElse(config.getDefaultStressLevel());
        String balance = reality.map(RealityCheck::workLifeBalance).orElse(config.getDefaultWorkLifeBalance());

        String salary = career.salaryFor(region);
        String growth = career.growthRate() != null ? career.growthRate() : "N/A";

        return new CareerMetrics(
                career.name(),
                salary != null ? salary : "N/A",
                normalizeSalary(salary),
                stress,
                stressScore(stress),
                balance,
                workLifeScore(balance),
                growth,
                extractGrowthRate(growth),
                career.requiredSkills(),
                skillsComplexity(career.requiredSkills().size()),
                career.description() != null ? career.description() : "",
                career.jobOutlook() != null ? career.jobOutlook() : "N/A");
    }

    /**
     * Numeric value of a salary string. Ranges are averaged, lakh and crore amounts are expanded,
     * and anything without a number is 0.
     */
    public static long normalizeSalary(String salary) {
        if (salary == null || salary.isBlank()) {
            return 0;
        }
        String text = salary.toLowerCase(Locale.ROOT).replace(",", "");

        List<Double> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            numbers.add(Double.parseDouble(matcher.group()));
        }
        if (numbers.isEmpty()) {
            return 0;
        }

        double value = numbers.size() >= 2 && RANGE.matcher(text).find()
                ? (numbers.get(0) + numbers.get(1)) / 2
                : numbers.get(0);

        if (CRORE.matcher(text).find()) {
            value *= 10_000_000;
        } else if (LAKH.matcher(text).find()) {
            value *= 100_000;
        } else if (THOUSAND.matcher(text).find()) {
            value *= 1_000;
        }
        return (long) value;
    }

    int stressScore(String stressLevel) {
        return config.getStressLevels().getOrDefault(stressLevel.toLowerCase(Locale.ROOT), config.getDefaultScore());
    }

    int workLifeScore(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        for (KeywordBand band : config.getWorkLifeBands()) {
            if (band.getKeywords().stream().anyMatch(text::contains)) {
                return band.getScore();
            }
        }
        return config.getDefaultScore();
    }

    static double extractGrowthRate(String growth) {
        Matcher matcher = NUMBER.matcher(growth);
        return matcher.find() ? Double.parseDouble(matcher.group()) : 0.0;
    }

    static int skillsComplexity(int requiredSkillCount) {
        return Math.min(5, Math.max(1, requiredSkillCount / 2));
    }

    private static Map<String, List<String>> rankings(List<CareerMetrics> metrics) {
        Map<String, List<String>> rankings = new LinkedHashMap<>();
        rankings.put(SALARY, rank(metrics, Comparator.comparingLong(CareerMetrics::salaryNumeric).reversed()));
        rankings.put(STRESS_LEVEL, rank(metrics, Comparator.comparingInt(CareerMetrics::stressScore)));
        rankings.put(WORK_LIFE_BALANCE, rank(metrics, Comparator.comparingInt(CareerMetrics::workLifeScore).reversed()));
        rankings.put(GROWTH_RATE, rank(metrics, Comparator.comparingDouble(CareerMetrics::growthNumeric).reversed()));
        rankings.put(SKILLS_COMPLEXITY, rank(metrics, Comparator.comparingInt(CareerMetrics::skillsComplexity)));
        return rankings;
    }

    private static List<String> rank(List<CareerMetrics> metrics, Comparator<CareerMetrics> order) {
        return metrics.stream().sorted(order).map(CareerMetrics::name).toList();
    }
}
