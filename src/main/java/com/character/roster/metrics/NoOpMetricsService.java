package com.character.roster.metrics;

import com.character.roster.loader.IssueType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLoadDuration(Duration duration, boolean hasErrors) {
    }

    @Override
    public void recordRecordsRead(int count) {
    }

    @Override
    public void recordEntitiesRegistered(int count) {
    }

    @Override
    public void incrementIssue(IssueType type) {
    }

    @Override
    public void incrementLinksResolved(int count) {
    }
}
