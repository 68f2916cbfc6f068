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
import java.math.RoundingMode;

/**
 * Google Ads campaigns through the gateway
 *
 * Rows follow the Google Ads search layout: campaign, campaignBudget, customer and
 * metrics objects per result. Money is reported in micros and CTR as a fraction.
 */
@Service
public class GoogleAdsCampaignClient extends GatewayCampaignClient {

    static final String CAMPAIGNS_PATH = "/v1/google/campaigns";

    private static final int MICROS_EXPONENT = 6;
    private static final BigDecimal PERCENT = BigDecimal.valueOf(100);

    public GoogleAdsCampaignClient(WebClient gatewayWebClient, ObjectMapper objectMapper) {
        super(gatewayWebClient, objectMapper);
    }

    @Override
    public Platform getPlatform() {
        return Platform.GOOGLE;
    }

    @Override
    protected String getCampaignsPath() {
        return CAMPAIGNS_PATH;
    }

    @Override
    protected String getEnvelopeField() {
        return "results";
    }

    @Override
    protected UnifiedCampaign toUnifiedCampaign(JsonNode row) throws PlatformIntegrationException {
        JsonNode campaign = row.path("campaign");
        JsonNode metrics = row.path("metrics");

        String id = requiredText(campaign, "id");
        CampaignStatus status = toCampaignStatus(text(campaign.path("status")));
        String currency = resolveCurrency(text(row.path("customer").path("currencyCode"))).getCurrencyCode();

        BigDecimal ctr = decimalOrZero(metrics.path("ctr"), "ctr")
                .multiply(PERCENT)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        return UnifiedCampaign.builder()
                .id(id)
                .platform(Platform.GOOGLE)
                .name(text(campaign.path("name")))
                .status(status)
                .dailyBudget(fromMicros(decimalOrNull(row.path("campaignBudget").path("amountMicros"), "amountMicros")))
                .currency(currency)
                .metrics(CampaignMetrics.builder()
                        .impressions(countOrZero(metrics.path("impressions"), "impressions"))
                        .clicks(countOrZero(metrics.path("clicks"), "clicks"))
                        .conversions(countOrZero(metrics.path("conversions"), "conversions"))
                        .cost(fromMicros(decimalOrZero(metrics.path("costMicros"), "costMicros")))
                        .ctr(ctr)
                        .cpa(fromMicros(decimalOrZero(metrics.path("costPerConversion"), "costPerConversion")))
                        .build())
                .build();
    }

    /**
     * Google Ads CampaignStatus. UNSPECIFIED and UNKNOWN are legal API values but carry
     * no lifecycle meaning, so they are rejected along with anything new.
     */
    CampaignStatus toCampaignStatus(String nativeStatus) throws PlatformIntegrationException {
        if (nativeStatus == null) {
            throw unmappedStatus(null);
        }
        return switch (nativeStatus) {
            case "ENABLED" -> CampaignStatus.ENABLED;
            case "PAUSED" -> CampaignStatus.PAUSED;
            case "REMOVED" -> CampaignStatus.REMOVED;
            default -> throw unmappedStatus(nativeStatus);
        };
    }

    private static BigDecimal fromMicros(BigDecimal micros) {
        return micros != null ? money(micros.movePointLeft(MICROS_EXPONENT)) : null;
    }
}
