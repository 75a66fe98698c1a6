package dev.careerpath.service;

import dev.careerpath.config.SimulationConfig;
import dev.careerpath.model.ScheduleTask;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stress and workload figures derived from a simulated working day.
 */
@Service
@RequiredArgsConstructor
public class SimulationMetricsEngine {

    /** Tasks at or above this stress count as active work. */
    static final int ACTIVE_WORK_STRESS = 2;
    static final int HIGH_STRESS = 4;
    static final int BREAK_STRESS = 1;

    private final SimulationConfig config;

    public record PeakStress(String time, String task, int stressLevel) {
    }

    public record WorkIntensity(
            int totalWorkMinutes,
            double averageIntensity,
            int maxContinuousWorkMinutes,
            int workLifeBalanceScore) {
    }

    public record DailyPatterns(
            double morningStressAvg,
            double afternoonStressAvg,
            double eveningStressAvg,
            String mostStressfulPeriod) {
    }

    public record ScheduleMetrics(
            int totalTasks,
            PeakStress peakStressTime,
            Map<Integer, Integer> stressDistribution,
            WorkIntensity workIntensity) {
    }

    public ScheduleMetrics metrics(List<ScheduleTask> schedule) {
        return new ScheduleMetrics(
                schedule.size(),
                peakStress(schedule),
                stressDistribution(schedule),
                workIntensity(schedule));
    }

    /**
     * The most stressful task. The earliest one wins a tie.
     */
    public PeakStress peakStress(List<ScheduleTask> schedule) {
        ScheduleTask peak = null;
        for (ScheduleTask task : schedule) {
            if (peak == null || task.stressLevel() > peak.stressLevel()) {
                peak = task;
            }
        }
        return peak == null
                ? new PeakStress(null, null, 0)
                : new PeakStress(peak.time(), peak.task(), peak.stressLevel());
    }

    /**
     * Number of tasks at each stress level, with every level from 1 to 5 present.
     */
    public Map<Integer, Integer> stressDistribution(List<ScheduleTask> schedule) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (int level = ScheduleTask.MIN_STRESS; level <= ScheduleTask.MAX_STRESS; level++) {
            histogram.put(level, 0);
        }
        schedule.forEach(task -> histogram.merge(task.stressLevel(), 1, Integer::sum));
        return Collections.unmodifiableMap(histogram);
    }

    public WorkIntensity workIntensity(List<ScheduleTask> schedule) {
        int totalDuration = 0;
        long weighted = 0;
        int longestRun = 0;
        int currentRun = 0;

        for (ScheduleTask task : schedule) {
            totalDuration += task.duration();
            weighted += (long) task.duration() * task.stressLevel();

            if (task.stressLevel() >= ACTIVE_WORK_STRESS) {
                currentRun += task.duration();
                longestRun = Math.max(longestRun, currentRun);
            } else {
                currentRun = 0;
            }
        }

        double average = totalDuration > 0 ? (double) weighted / totalDuration : 0.0;
        return new WorkIntensity(totalDuration, round(average, 2), longestRun, workLifeBalanceScore(schedule));
    }

    /**
     * 1-5, higher is better. Driven by the share of high-stress tasks, then the share of breaks.
     */
    public int workLifeBalanceScore(List<ScheduleTask> schedule) {
        if (schedule.isEmpty()) {
            return 3;
        }
        double total = schedule.size();
        double highShare = schedule.stream().filter(task -> task.stressLevel() >= HIGH_STRESS).count() / total;
        double breakShare = schedule.stream().filter(task -> task.stressLevel() <= BREAK_STRESS).count() / total;

        if (highShare > 0.4) {
            return 2;
        }
        if (highShare > 0.2) {
            return 3;
        }
        if (breakShare > 0.2) {
            return 4;
        }
        return 3;
    }

    /**
     * Average stress of the morning, afternoon and evening task buckets. An empty bucket averages 0;
     * ties for the most stressful period prefer the earlier one.
     */
    public DailyPatterns dailyPatterns(List<ScheduleTask> schedule) {
        int morningEnd = Math.min(config.getMorningTasks(), schedule.size());
        int afternoonEnd = Math.min(morningEnd + config.getAfternoonTasks(), schedule.size());

        double morning = averageStress(schedule.subList(0, morningEnd));
        double afternoon = averageStress(schedule.subList(morningEnd, afternoonEnd));
        double evening = averageStress(schedule.subList(afternoonEnd, schedule.size()));

        String period;
        if (morning >= Math.max(afternoon, evening)) {
            period = "Morning";
        } else if (afternoon >= evening) {
            period = "Afternoon";
        } else {
            period = "Evening";
        }
        return new DailyPatterns(round(morning, 1), round(afternoon, 1), round(evening, 1), period);
    }

    private static double averageStress(List<ScheduleTask> tasks) {
        return tasks.stream().mapToInt(ScheduleTask::stressLevel).average().orElse(0.0);
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
