package com.campaignhub.backend.services;

import com.campaignhub.backend.config.AggregationConfig.AggregationProperties;
import com.campaignhub.backend.exceptions.AllSourcesFailedException;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.integrations.CampaignSourceRegistry;
import com.campaignhub.backend.models.SourceOutcome;
import com.campaignhub.backend.models.UnifiedCampaign;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * CampaignAggregationService
 *
 * Single entry point for the unified campaign list:
 * - fans out to every enabled source under the configured deadline
 * - drops the records of sources that failed (partial results are a success)
 * - ranks what is left by daily budget
 *
 * Nothing is cached; every call queries the sources again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignAggregationService {

    private final CampaignSourceRegistry sourceRegistry;
    private final CampaignFanOutCoordinator fanOutCoordinator;
    private final CampaignRankingService rankingService;
    private final AggregationProperties aggregationProperties;
    private final MeterRegistry meterRegistry;

    /**
     * @return ranked campaigns of every source that answered in time
     * @throws AllSourcesFailedException when no source produced a result
     */
    public List<UnifiedCampaign> getCampaigns() {
        long started = System.currentTimeMillis();

        List<SourceOutcome> outcomes = fanOutCoordinator.fetchAll(
                sourceRegistry.getSources(), aggregationProperties.timeout());

        List<PlatformIntegrationException> failures = outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(SourceOutcome::getError)
                .toList();

        if (failures.size() == outcomes.size()) {
            Counter.builder("campaign.aggregation.all_failed")
                    .description("Aggregations in which every source failed")
                    .register(meterRegistry)
                    .increment();

            AllSourcesFailedException ex = new AllSourcesFailedException(failures);
            log.error(ex.getMessage());
            throw ex;
        }

        List<UnifiedCampaign> campaigns = rankingService.rank(outcomes);

        log.info("Aggregated {} campaigns from {}/{} sources in {}ms",
                campaigns.size(), outcomes.size() - failures.size(), outcomes.size(),
                System.currentTimeMillis() - started);

        return campaigns;
    }
}
