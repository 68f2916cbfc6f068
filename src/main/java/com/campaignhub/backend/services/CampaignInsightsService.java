package com.campaignhub.backend.services;

import com.campaignhub.backend.dto.CampaignFilter;
import com.campaignhub.backend.dto.CampaignStatsDto;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.models.UnifiedCampaign;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only views over an aggregated campaign list. Budgets are summed as-is,
 * without currency conversion.
 */
@Service
public class CampaignInsightsService {

    /**
     * Keeps the campaigns matching every non-null criterion, in input order.
     * Campaigns without a daily budget never satisfy a budget bound.
     */
    public List<UnifiedCampaign> filter(List<UnifiedCampaign> campaigns, CampaignFilter filter) {
        if (filter == null) {
            return campaigns;
        }
        if (filter.getMinBudget() != null && filter.getMaxBudget() != null
                && filter.getMinBudget().compareTo(filter.getMaxBudget()) > 0) {
            throw new IllegalArgumentException("minBudget must not exceed maxBudget");
        }

        return campaigns.stream()
                .filter(c -> filter.getPlatform() == null || c.getPlatform() == filter.getPlatform())
                .filter(c -> filter.getStatus() == null || c.getStatus() == filter.getStatus())
                .filter(c -> !filter.hasBudgetBounds() || withinBudget(c.getDailyBudget(), filter))
                .toList();
    }

    public BigDecimal totalEnabledBudget(List<UnifiedCampaign> campaigns) {
        return campaigns.stream()
                .filter(UnifiedCampaign::isEnabled)
                .map(UnifiedCampaign::getDailyBudget)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public CampaignStatsDto calculateStats(List<UnifiedCampaign> campaigns) {
        long enabled = 0;
        long paused = 0;
        long removed = 0;
        BigDecimal totalSpend = BigDecimal.ZERO;
        Map<String, Long> byPlatform = new LinkedHashMap<>();
        for (Platform platform : Platform.values()) {
            byPlatform.put(platform.getValue(), 0L);
        }

        for (UnifiedCampaign campaign : campaigns) {
            switch (campaign.getStatus()) {
                case ENABLED -> enabled++;
                case PAUSED -> paused++;
                case REMOVED -> removed++;
            }
            totalSpend = totalSpend.add(campaign.getMetrics().getCost());
            byPlatform.merge(campaign.getPlatform().getValue(), 1L, Long::sum);
        }

        return CampaignStatsDto.builder()
                .total(campaigns.size())
                .enabled(enabled)
                .paused(paused)
                .removed(removed)
                .totalBudget(totalEnabledBudget(campaigns))
                .totalSpend(totalSpend)
                .byPlatform(byPlatform)
                .build();
    }

    /**
     * Splits campaigns by platform. Every supported platform is a key; each group keeps
     * input order and the group sizes add up to the input size.
     */
    public Map<Platform, List<UnifiedCampaign>> groupByPlatform(List<UnifiedCampaign> campaigns) {
        Map<Platform, List<UnifiedCampaign>> groups = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            groups.put(platform, new ArrayList<>());
        }
        for (UnifiedCampaign campaign : campaigns) {
            groups.get(campaign.getPlatform()).add(campaign);
        }
        groups.replaceAll((platform, group) -> Collections.unmodifiableList(group));
        return groups;
    }

    private static boolean withinBudget(BigDecimal budget, CampaignFilter filter) {
        if (budget == null) {
            return false;
        }
        if (filter.getMinBudget() != null && budget.compareTo(filter.getMinBudget()) < 0) {
            return false;
        }
        return filter.getMaxBudget() == null || budget.compareTo(filter.getMaxBudget()) <= 0;
    }
}
