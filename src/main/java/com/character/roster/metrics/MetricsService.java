package com.character.roster.metrics;

import com.character.roster.loader.IssueType;

import java.time.Duration;

/**
 * Interface for recording loader metrics.
 * The default {@link NoOpMetricsService} does nothing, so the loader works
 * without a meter registry.
 */
public interface MetricsService {

    void recordLoadDuration(Duration duration, boolean hasErrors);

    void recordRecordsRead(int count);

    void recordEntitiesRegistered(int count);

    void incrementIssue(IssueType type);

    void incrementLinksResolved(int count);
}
