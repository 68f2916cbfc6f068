package com.campaignhub.backend.models;

import com.campaignhub.backend.enums.CampaignStatus;
import com.campaignhub.backend.enums.Platform;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Platform-independent campaign record.
 *
 * Built once by a source adapter per request and never modified afterwards.
 * {@code id} is only unique within its {@code platform}. {@code dailyBudget} is in
 * {@code currency} and may be null when the source reported no usable daily budget.
 */
@Value
@Builder
@Jacksonized
public class UnifiedCampaign {

    @NonNull
    String id;

    @NonNull
    Platform platform;

    String name;

    @NonNull
    CampaignStatus status;

    @JsonProperty("daily_budget")
    BigDecimal dailyBudget;

    String currency;

    @NonNull
    @Builder.Default
    CampaignMetrics metrics = CampaignMetrics.EMPTY;

    @JsonIgnore
    public boolean isEnabled() {
        return status.isEnabled();
    }

    @JsonIgnore
    public boolean hasDailyBudget() {
        return dailyBudget != null;
    }
}
