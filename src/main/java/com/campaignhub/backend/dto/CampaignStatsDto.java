package com.campaignhub.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStatsDto {

    private long total;
    private long enabled;
    private long paused;
    private long removed;

    // Daily budgets of ENABLED campaigns only
    private BigDecimal totalBudget;

    // metrics.cost across every campaign
    private BigDecimal totalSpend;

    // Keyed by platform value ("google", "meta")
    private Map<String, Long> byPlatform;
}
