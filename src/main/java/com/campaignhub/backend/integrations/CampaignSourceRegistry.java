package com.campaignhub.backend.integrations;

import com.campaignhub.backend.config.AggregationConfig.AggregationProperties;
import com.campaignhub.backend.enums.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Enabled campaign sources in registration order.
 * The order is the order in which successful records are concatenated before ranking.
 */
@Component
@Slf4j
public class CampaignSourceRegistry {

    private final List<CampaignSourceClient> sources;

    public CampaignSourceRegistry(List<CampaignSourceClient> clients, AggregationProperties aggregationProperties) {
        Map<Platform, CampaignSourceClient> byPlatform = new EnumMap<>(Platform.class);
        for (CampaignSourceClient client : clients) {
            if (byPlatform.put(client.getPlatform(), client) != null) {
                throw new IllegalStateException("More than one source client for platform " + client.getPlatform());
            }
        }

        List<CampaignSourceClient> ordered = new ArrayList<>();
        for (Platform platform : new LinkedHashSet<>(aggregationProperties.sources())) {
            CampaignSourceClient client = byPlatform.get(platform);
            if (client == null) {
                throw new IllegalStateException("No source client available for configured platform " + platform);
            }
            ordered.add(client);
        }

        if (ordered.isEmpty()) {
            throw new IllegalStateException("aggregation.sources must name at least one platform");
        }

        this.sources = Collections.unmodifiableList(ordered);
        log.info("Campaign aggregation initialized with {} sources: {}", sources.size(),
                sources.stream().map(s -> s.getPlatform().getValue()).toList());
    }

    public List<CampaignSourceClient> getSources() {
        return sources;
    }
}
