package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.careerpath.util.Frozen;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * "A day in the life" record for one career.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CareerSimulation(
        String careerTitle,
        String overview,
        WorkingHours workingHours,
        double averageStressLevel,
        String workLifeBalance,
        String salaryRange,
        String educationRequired,
        String workCulture,
        List<ScheduleTask> dailySchedule,
        List<String> stressFactors,
        List<String> rewards,
        Map<String, RegionOverride> regionSpecific) {

    public static final String STANDARD_WORK_CULTURE = "Standard work culture";

    public CareerSimulation {
        dailySchedule = Frozen.list(dailySchedule);
        stressFactors = Frozen.list(stressFactors);
        rewards = Frozen.list(rewards);
        regionSpecific = Frozen.map(regionSpecific);
        if (educationRequired == null) {
            educationRequired = "";
        }
        if (salaryRange == null) {
            salaryRange = "";
        }
    }

    /**
     * Copy with the salary range and work culture of the given region applied, if the
     * simulation declares an override for it.
     */
    public CareerSimulation forRegion(String region) {
        RegionOverride override = regionSpecific.get(region);
        if (override == null) {
            return this;
        }
        return toBuilder()
                .salaryRange(override.salary() != null ? override.salary() : salaryRange)
                .workCulture(override.workCulture() != null ? override.workCulture() : STANDARD_WORK_CULTURE)
                .build();
    }
}
