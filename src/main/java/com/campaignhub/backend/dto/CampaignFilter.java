package com.campaignhub.backend.dto;

import com.campaignhub.backend.enums.CampaignStatus;
import com.campaignhub.backend.enums.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Optional criteria for narrowing a campaign list. Null fields match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignFilter {

    private Platform platform;
    private CampaignStatus status;
    private BigDecimal minBudget; // inclusive
    private BigDecimal maxBudget; // inclusive

    public boolean hasBudgetBounds() {
        return minBudget != null || maxBudget != null;
    }
}
