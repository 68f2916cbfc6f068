package com.campaignhub.backend.integrations;

import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.models.UnifiedCampaign;

import java.util.List;

/**
 * Interface for platform-specific campaign sources.
 * Each advertising platform reachable through the gateway implements this interface.
 * Implementations must not share mutable state and must be safe to call from any thread.
 */
public interface CampaignSourceClient {

    /**
     * Platform every returned record is tagged with
     */
    Platform getPlatform();

    /**
     * Fetch the platform's campaigns and normalize them to the unified schema
     * @param context shared deadline of the current aggregation
     * @return records in the order the platform returned them, possibly empty
     * @throws PlatformIntegrationException on transport errors, non-success responses,
     *         payloads that cannot be mapped, or deadline expiry
     */
    List<UnifiedCampaign> fetchCampaigns(FetchContext context) throws PlatformIntegrationException;
}
