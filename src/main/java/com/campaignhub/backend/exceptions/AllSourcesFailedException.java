package com.campaignhub.backend.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every configured source failed during one aggregation, which usually points at
 * the shared gateway rather than a single platform.
 */
public class AllSourcesFailedException extends RuntimeException {

    private final List<PlatformIntegrationException> failures;

    public AllSourcesFailedException(List<PlatformIntegrationException> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }

    public List<PlatformIntegrationException> getFailures() {
        return failures;
    }

    private static String buildMessage(List<PlatformIntegrationException> failures) {
        return "All " + failures.size() + " campaign sources failed: " + failures.stream()
                .map(f -> f.getPlatform().getValue() + " (" + f.getReason() + ")")
                .collect(Collectors.joining(", "));
    }
}
