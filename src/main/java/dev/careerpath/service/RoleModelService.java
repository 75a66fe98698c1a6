package dev.careerpath.service;

import dev.careerpath.config.AdvisorProperties;
import dev.careerpath.config.MatchingConfig;
import dev.careerpath.data.ReferenceDataStore;
import dev.careerpath.model.CareerTip;
import dev.careerpath.model.RoleModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.zip.CRC32;

/**
 * Role models, inspiration and career tips.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleModelService {

    private final ReferenceDataStore referenceData;
    private final AdvisorProperties properties;
    private final Clock clock;

    public record Inspiration(String quote, String author, String title) {
    }

    public record CareerPathExample(String name, List<String> careerPath, String advice, List<String> achievements) {
    }

    public record SkillTip(String skill, CareerTip tip) {
    }

    public record RegionalAdvice(String name, String context, String advice) {
    }

    /**
     * Role models whose career contains, or is contained in, the given name ignoring case.
     * Every role model of the region when none matches.
     */
    public List<RoleModel> forCareer(String region, String careerName) {
        List<RoleModel> all = referenceData.getRoleModels(region);
        String wanted = careerName.toLowerCase(Locale.ROOT);
        List<RoleModel> matching = all.stream()
                .filter(model -> {
                    String career = model.career() != null ? model.career().toLowerCase(Locale.ROOT) : "";
                    return !career.isEmpty() && (career.contains(wanted) || wanted.contains(career));
                })
                .toList();
        return matching.isEmpty() ? all : matching;
    }

    /**
     * Role models for a list of careers, without repeating a person, capped at the configured limit.
     */
    public List<RoleModel> forCareers(String region, List<String> careerNames) {
        Map<String, RoleModel> unique = new LinkedHashMap<>();
        for (String career : careerNames) {
            forCareer(region, career).forEach(model -> unique.putIfAbsent(model.name(), model));
        }
        return unique.values().stream().limit(properties.getRoleModelLimit()).toList();
    }

    /**
     * Tip of the day. A known user gets the same tip all day, chosen from a CRC32 of
     * {@code userId + "_" + date}; anonymous callers get a random one.
     *
     * @return the tip, or null when there are no tips at all
     */
    public CareerTip dailyTip(String careerFocus, String userId, String mode) {
        List<CareerTip> tips = relevantTips(careerFocus, mode);
        if (tips.isEmpty()) {
            tips = referenceData.getTips();
        }
        if (tips.isEmpty()) {
            return null;
        }

        if (userId == null || userId.isBlank()) {
            return tips.get(ThreadLocalRandom.current().nextInt(tips.size()));
        }
        return tips.get(stableIndex(userId, LocalDate.now(clock), tips.size()));
    }

    static int stableIndex(String userId, LocalDate date, int size) {
        CRC32 crc = new CRC32();
        crc.update((userId + "_" + date).getBytes(StandardCharsets.UTF_8));
        return (int) (crc.getValue() % size);
    }

    /**
     * Up to a week's worth of distinct tips in random order.
     */
    public List<CareerTip> weeklyTips(String careerFocus, String mode) {
        List<CareerTip> tips = new ArrayList<>(relevantTips(careerFocus, mode));
        Collections.shuffle(tips, ThreadLocalRandom.current());
        return List.copyOf(tips.subList(0, Math.min(properties.getWeeklyTipCount(), tips.size())));
    }

    public List<CareerTip> tipsByCategory(String category) {
        return referenceData.getTips().stream()
                .filter(tip -> category.equals(tip.category()))
                .toList();
    }

    /**
     * A random quote from the role models of a career, or of the whole region when no career is given.
     */
    public Inspiration inspiration(String region, String careerName) {
        List<RoleModel> models = careerName != null
                ? forCareer(region, careerName)
                : referenceData.getRoleModels(region);
        if (models.isEmpty()) {
            return null;
        }
        RoleModel model = pick(models);
        return new Inspiration(model.inspirationQuote(), model.name(), model.title());
    }

    public CareerPathExample careerPathExample(String region, String careerName) {
        List<RoleModel> models = forCareer(region, careerName);
        if (models.isEmpty()) {
            return null;
        }
        RoleModel model = pick(models);
        return new CareerPathExample(model.name(), model.careerPath(), model.advice(), model.achievements());
    }

    /**
     * Role models whose name, career, title or key skills contain the query, ignoring case.
     */
    public List<RoleModel> search(String region, String query) {
        String wanted = query.toLowerCase(Locale.ROOT);
        return referenceData.getRoleModels(region).stream()
                .filter(model -> searchableText(model).contains(wanted))
                .toList();
    }

    public List<SkillTip> skillDevelopmentTips(List<String> skills) {
        List<SkillTip> matches = new ArrayList<>();
        for (String skill : skills) {
            String wanted = skill.toLowerCase(Locale.ROOT);
            for (CareerTip tip : referenceData.getTips()) {
                if (lower(tip.tip()).contains(wanted) || lower(tip.title()).contains(wanted)) {
                    matches.add(new SkillTip(skill, tip));
                }
            }
        }
        return List.copyOf(matches.subList(0, Math.min(properties.getSkillTipLimit(), matches.size())));
    }

    public List<RegionalAdvice> regionSpecificAdvice(String region, String careerName) {
        return forCareer(region, careerName).stream()
                .filter(model -> model.regionalContext() != null)
                .map(model -> new RegionalAdvice(model.name(), model.regionalContext(), model.advice()))
                .toList();
    }

    private List<CareerTip> relevantTips(String careerFocus, String mode) {
        List<CareerTip> tips = referenceData.getTips();
        if (careerFocus != null) {
            tips = tips.stream().filter(tip -> tip.appliesTo(careerFocus)).toList();
        }
        if (MatchingConfig.PROFESSIONAL.equals(mode)) {
            List<String> categories = properties.getProfessionalTipCategories();
            tips = tips.stream().filter(tip -> categories.contains(tip.category())).toList();
        }
        return tips;
    }

    private static String searchableText(RoleModel model) {
        return String.join(" ", lower(model.name()), lower(model.career()), lower(model.title()),
                String.join(" ", model.keySkills()).toLowerCase(Locale.ROOT));
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }

    private static <T> T pick(List<T> items) {
        return items.get(ThreadLocalRandom.current().nextInt(items.size()));
    }
}
