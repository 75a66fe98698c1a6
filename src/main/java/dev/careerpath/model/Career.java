package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A career as loaded from a regional career table.
 * <p>
 * {@code region} is the table the career originated from. Regional overlays carry
 * the salary and outlook another region publishes for the same career name.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Career(
        String name,
        List<String> requiredSkills,
        List<String> interests,
        List<String> subjects,
        List<String> personalityTraits,
        String description,
        String growthRate,
        String medianSalary,
        String jobOutlook,
        String region,
        Map<String, String> regionalSalary,
        Map<String, String> regionalOutlook) {

    public Career {
        requiredSkills = Frozen.list(requiredSkills);
        interests = Frozen.list(interests);
        subjects = Frozen.list(subjects);
        personalityTraits = Frozen.list(personalityTraits);
        regionalSalary = Frozen.map(regionalSalary);
        regionalOutlook = Frozen.map(regionalOutlook);
    }

    /**
     * Salary to show for the given region, falling back to the career's own median.
     */
    public String salaryFor(String region) {
        return regionalSalary.getOrDefault(region, medianSalary);
    }

    public boolean isOfferedIn(String region) {
        return region.equals(this.region) || regionalSalary.containsKey(region);
    }
}
