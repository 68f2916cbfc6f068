package com.campaignhub.backend.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Delivery metrics as reported by the source platform.
 * CTR is a percentage, CPA is in the campaign's currency.
 */
@Value
@Builder
@Jacksonized
public class CampaignMetrics {

    public static final CampaignMetrics EMPTY = CampaignMetrics.builder().build();

    @Builder.Default
    long impressions = 0L;

    @Builder.Default
    long clicks = 0L;

    @Builder.Default
    long conversions = 0L;

    @Builder.Default
    BigDecimal cost = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal ctr = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal cpa = BigDecimal.ZERO;
}
