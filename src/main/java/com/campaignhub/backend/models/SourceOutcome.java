package com.campaignhub.backend.models;

import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of one source adapter within an aggregation: either its records or the
 * error that replaced them.
 */
public final class SourceOutcome {

    private final Platform platform;
    private final List<UnifiedCampaign> campaigns;
    private final PlatformIntegrationException error;
    private final Duration elapsed;

    private SourceOutcome(Platform platform,
                          List<UnifiedCampaign> campaigns,
                          PlatformIntegrationException error,
                          Duration elapsed) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.campaigns = campaigns;
        this.error = error;
        this.elapsed = elapsed;
    }

    public static SourceOutcome success(Platform platform, List<UnifiedCampaign> campaigns, Duration elapsed) {
        return new SourceOutcome(platform, List.copyOf(campaigns), null, elapsed);
    }

    public static SourceOutcome failure(PlatformIntegrationException error, Duration elapsed) {
        Objects.requireNonNull(error, "error");
        return new SourceOutcome(error.getPlatform(), List.of(), error, elapsed);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Platform getPlatform() {
        return platform;
    }

    /**
     * Records of a successful fetch; empty for a failure.
     */
    public List<UnifiedCampaign> getCampaigns() {
        return campaigns;
    }

    public PlatformIntegrationException getError() {
        return error;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "SourceOutcome[" + platform.getValue() + ", " + campaigns.size() + " campaigns]"
                : "SourceOutcome[" + platform.getValue() + ", failed: " + error.getReason() + "]";
    }
}
