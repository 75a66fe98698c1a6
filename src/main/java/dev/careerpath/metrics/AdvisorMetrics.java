package dev.careerpath.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for advisor operations.
 */
@Component
public class AdvisorMetrics {

    private static final String TAG_OPERATION = "operation";
    private final MeterRegistry registry;

    // Counters
    private final Counter validationErrorsCounter;
    private final Counter notFoundCounter;
    private final Counter unexpectedErrorsCounter;
    private final Counter recommendationsCounter;

    // Per operation
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> operationTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRecommendationCount = new AtomicInteger(0);

    public AdvisorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.validationErrorsCounter = Counter.builder("career_advisor_validation_errors_total")
                .description("Requests rejected because of invalid input")
                .register(registry);

        this.notFoundCounter = Counter.builder("career_advisor_not_found_total")
                .description("Requests naming a career or entry that does not exist")
                .register(registry);

        this.unexpectedErrorsCounter = Counter.builder("career_advisor_unexpected_errors_total")
                .description("Requests that failed with an unexpected error")
                .register(registry);

        this.recommendationsCounter = Counter.builder("career_advisor_recommendations_total")
                .description("Total careers recommended")
                .register(registry);

        Gauge.builder("career_advisor_last_recommendation_count", lastRecommendationCount, AtomicInteger::get)
                .description("Careers recommended by the last recommendation request")
                .register(registry);
    }

    public Timer getOperationTimer(String operation) {
        return operationTimers.computeIfAbsent(operation, name ->
                Timer.builder("career_advisor_operation_duration")
                        .description("Time to serve an advisor operation")
                        .tag(TAG_OPERATION, name)
                        .register(registry));
    }

    public void recordRequest(String operation) {
        requestCounters.computeIfAbsent(operation, name ->
                Counter.builder("career_advisor_requests_total")
                        .description("Advisor requests by operation")
                        .tag(TAG_OPERATION, name)
                        .register(registry))
                .increment();
    }

    public void recordValidationError() {
        validationErrorsCounter.increment();
    }

    public void recordNotFound() {
        notFoundCounter.increment();
    }

    public void recordUnexpectedError() {
        unexpectedErrorsCounter.increment();
    }

    /**
     * Record the size of a recommendation list.
     */
    public void recordRecommendations(int count) {
        recommendationsCounter.increment(count);
        lastRecommendationCount.set(count);
    }
}
