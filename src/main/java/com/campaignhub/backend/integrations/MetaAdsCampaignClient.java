package com.campaignhub.backend.integrations;

import com.campaignhub.backend.enums.CampaignStatus;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.models.CampaignMetrics;
import com.campaignhub.backend.models.UnifiedCampaign;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.util.Currency;

/**
 * Meta Ads (Facebook/Instagram) campaigns through the gateway
 *
 * Records follow the Graph API campaign shape with insights inlined.
 * daily_budget is in the account currency's minor units; spend is in major units
 * and ctr is already a percentage.
 */
@Service
public class MetaAdsCampaignClient extends GatewayCampaignClient {

    static final String CAMPAIGNS_PATH = "/v1/meta/campaigns";

    public MetaAdsCampaignClient(WebClient gatewayWebClient, ObjectMapper objectMapper) {
        super(gatewayWebClient, objectMapper);
    }

    @Override
    public Platform getPlatform() {
        return Platform.META;
    }

    @Override
    protected String getCampaignsPath() {
        return CAMPAIGNS_PATH;
    }

    @Override
    protected String getEnvelopeField() {
        return "data";
    }

    @Override
    protected UnifiedCampaign toUnifiedCampaign(JsonNode item) throws PlatformIntegrationException {
        String id = requiredText(item, "id");
        CampaignStatus status = toCampaignStatus(text(item.path("effective_status")));
        Currency currency = resolveCurrency(text(item.path("account_currency")));

        // Lifetime-budget campaigns have no daily_budget
        BigDecimal dailyBudget = fromMinorUnits(decimalOrNull(item.path("daily_budget"), "daily_budget"), currency);

        JsonNode insights = item.path("insights").path("data").path(0);

        return UnifiedCampaign.builder()
                .id(id)
                .platform(Platform.META)
                .name(text(item.path("name")))
                .status(status)
                .dailyBudget(dailyBudget)
                .currency(currency.getCurrencyCode())
                .metrics(CampaignMetrics.builder()
                        .impressions(countOrZero(insights.path("impressions"), "impressions"))
                        .clicks(countOrZero(insights.path("clicks"), "clicks"))
                        .conversions(countOrZero(insights.path("conversions"), "conversions"))
                        .cost(money(decimalOrZero(insights.path("spend"), "spend")))
                        .ctr(money(decimalOrZero(insights.path("ctr"), "ctr")))
                        .cpa(money(decimalOrZero(insights.path("cost_per_conversion"), "cost_per_conversion")))
                        .build())
                .build();
    }

    /**
     * Campaign-level effective_status values. Delivery sub-states of an active campaign
     * (IN_PROCESS, WITH_ISSUES) count as enabled.
     */
    CampaignStatus toCampaignStatus(String effectiveStatus) throws PlatformIntegrationException {
        if (effectiveStatus == null) {
            throw unmappedStatus(null);
        }
        return switch (effectiveStatus) {
            case "ACTIVE", "IN_PROCESS", "WITH_ISSUES" -> CampaignStatus.ENABLED;
            case "PAUSED" -> CampaignStatus.PAUSED;
            case "DELETED", "ARCHIVED" -> CampaignStatus.REMOVED;
            default -> throw unmappedStatus(effectiveStatus);
        };
    }

    private static BigDecimal fromMinorUnits(BigDecimal minorUnits, Currency currency) {
        if (minorUnits == null) {
            return null;
        }
        int fractionDigits = Math.max(currency.getDefaultFractionDigits(), 0);
        return money(minorUnits.movePointLeft(fractionDigits));
    }
}
