package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

/**
 * One slot of a simulated working day. Stress is rated 1 (very low) to 5 (very high).
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleTask(
        String time,
        String task,
        int duration,
        int stressLevel,
        String description) {

    public static final int MIN_STRESS = 1;
    public static final int MAX_STRESS = 5;

    public ScheduleTask {
        if (stressLevel < MIN_STRESS || stressLevel > MAX_STRESS) {
            throw new IllegalArgumentException(
                    "stress_level must be between 1 and 5 but was " + stressLevel + " for task '" + task + "'");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("duration must not be negative for task '" + task + "'");
        }
    }
}
