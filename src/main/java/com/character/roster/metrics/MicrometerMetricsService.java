package com.character.roster.metrics;

import com.character.roster.loader.IssueType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code character.load.duration} - Timer (tag: outcome)</li>
 *   <li>{@code character.load.records} - DistributionSummary</li>
 *   <li>{@code character.load.registered} - DistributionSummary</li>
 *   <li>{@code character.load.issues} - Counter (tag: type)</li>
 *   <li>{@code character.links.resolved} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<IssueType, Counter> issueCounters = new ConcurrentHashMap<>();
    private final DistributionSummary recordsSummary;
    private final DistributionSummary registeredSummary;
    private final Counter linksResolvedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.recordsSummary = DistributionSummary.builder("character.load.records")
                .description("Number of raw records read per load")
                .register(registry);
        this.registeredSummary = DistributionSummary.builder("character.load.registered")
                .description("Number of characters registered per load")
                .register(registry);
        this.linksResolvedCounter = Counter.builder("character.links.resolved")
                .description("Number of relationship links resolved")
                .register(registry);
    }

    @Override
    public void recordLoadDuration(Duration duration, boolean hasErrors) {
        String outcome = hasErrors ? "with_errors" : "clean";
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("character.load.duration")
                        .description("Duration of character load runs")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRecordsRead(int count) {
        recordsSummary.record(count);
    }

    @Override
    public void recordEntitiesRegistered(int count) {
        registeredSummary.record(count);
    }

    @Override
    public void incrementIssue(IssueType type) {
        Counter counter = issueCounters.computeIfAbsent(type, t ->
                Counter.builder("character.load.issues")
                        .description("Number of load issues by type")
                        .tag("type", t.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementLinksResolved(int count) {
        linksResolvedCounter.increment(count);
    }
}
