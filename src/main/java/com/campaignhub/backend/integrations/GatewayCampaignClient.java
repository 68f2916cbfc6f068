package com.campaignhub.backend.integrations;

import com.campaignhub.backend.enums.FailureReason;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.exceptions.PlatformIntegrationException;
import com.campaignhub.backend.models.UnifiedCampaign;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Base for sources served by the internal ads gateway.
 *
 * Issues one authenticated GET per fetch, bounded by the remaining shared deadline,
 * and hands every element of the platform's envelope array to {@link #toUnifiedCampaign}.
 * Every failure leaves as a {@link PlatformIntegrationException} tagged with this platform.
 */
@Slf4j
public abstract class GatewayCampaignClient implements CampaignSourceClient {

    protected static final int MONEY_SCALE = 2;

    private final WebClient gatewayWebClient;
    private final ObjectMapper objectMapper;

    protected GatewayCampaignClient(WebClient gatewayWebClient, ObjectMapper objectMapper) {
        this.gatewayWebClient = gatewayWebClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Gateway path of the platform's campaign listing
     */
    protected abstract String getCampaignsPath();

    /**
     * Top-level field holding the campaign array
     */
    protected abstract String getEnvelopeField();

    /**
     * Map one platform-native element to the unified schema
     */
    protected abstract UnifiedCampaign toUnifiedCampaign(JsonNode item) throws PlatformIntegrationException;

    @Override
    public List<UnifiedCampaign> fetchCampaigns(FetchContext context) throws PlatformIntegrationException {
        String body = fetchBody(context);
        JsonNode root = parse(body);

        JsonNode items = root.get(getEnvelopeField());
        if (items == null || items.isNull()) {
            // Error bodies and renamed envelopes both land here; an empty account sends []
            throw failure(FailureReason.MALFORMED_PAYLOAD,
                    "Response has no '" + getEnvelopeField() + "' array (fields: " + fieldNames(root) + ")");
        }
        if (!items.isArray()) {
            throw failure(FailureReason.MALFORMED_PAYLOAD,
                    "Expected '" + getEnvelopeField() + "' to be an array but was " + items.getNodeType());
        }

        List<UnifiedCampaign> campaigns = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            campaigns.add(toUnifiedCampaign(item));
        }

        log.debug("Fetched {} {} campaigns", campaigns.size(), getPlatform().getDisplayName());
        return campaigns;
    }

    private String fetchBody(FetchContext context) throws PlatformIntegrationException {
        if (context.isExpired()) {
            throw failure(FailureReason.TIMEOUT, "Deadline expired before the request was sent");
        }

        try {
            return gatewayWebClient.get()
                    .uri(getCampaignsPath())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(context.remaining())
                    .block();

        } catch (WebClientResponseException e) {
            throw failure(FailureReason.UPSTREAM_STATUS,
                    "Gateway returned " + e.getStatusCode().value() + " for " + getCampaignsPath(), e);

        } catch (WebClientRequestException e) {
            throw failure(FailureReason.TRANSPORT, "Gateway request failed: " + e.getMessage(), e);

        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw failure(FailureReason.TIMEOUT,
                        "No response within " + context.getBudget().toMillis() + "ms", cause);
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw failure(FailureReason.TIMEOUT, "Fetch interrupted", cause);
            }
            throw failure(FailureReason.TRANSPORT, "Gateway request failed: " + cause.getMessage(), cause);
        }
    }

    private JsonNode parse(String body) throws PlatformIntegrationException {
        if (body == null || body.isBlank()) {
            throw failure(FailureReason.MALFORMED_PAYLOAD, "Empty response body");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isObject()) {
                throw failure(FailureReason.MALFORMED_PAYLOAD, "Expected a JSON object but got " + root.getNodeType());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw failure(FailureReason.MALFORMED_PAYLOAD, "Unparseable response: " + e.getOriginalMessage(), e);
        }
    }

    private static String fieldNames(JsonNode root) {
        List<String> names = new ArrayList<>();
        root.fieldNames().forEachRemaining(names::add);
        return String.join(", ", names);
    }

    // ---- Mapping helpers ----

    protected PlatformIntegrationException failure(FailureReason reason, String message) {
        return new PlatformIntegrationException(getPlatform(), reason, message);
    }

    protected PlatformIntegrationException failure(FailureReason reason, String message, Throwable cause) {
        return new PlatformIntegrationException(getPlatform(), reason, message, cause);
    }

    protected PlatformIntegrationException unmappedStatus(String nativeStatus) {
        return failure(FailureReason.UNMAPPED_VALUE, "Unrecognized " + getPlatform().getDisplayName()
                + " campaign status: " + nativeStatus);
    }

    protected static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    protected String requiredText(JsonNode parent, String field) throws PlatformIntegrationException {
        String value = text(parent.path(field));
        if (value == null || value.isBlank()) {
            throw failure(FailureReason.MALFORMED_PAYLOAD, "Campaign record without '" + field + "'");
        }
        return value;
    }

    protected Currency resolveCurrency(String code) throws PlatformIntegrationException {
        if (code == null || code.isBlank()) {
            throw failure(FailureReason.MALFORMED_PAYLOAD, "Campaign record without currency");
        }
        try {
            return Currency.getInstance(code.trim());
        } catch (IllegalArgumentException e) {
            throw failure(FailureReason.MALFORMED_PAYLOAD, "Unknown currency code: " + code, e);
        }
    }

    /**
     * Lenient decimal read. Int64 fields may arrive as JSON strings.
     * Missing, unparseable or negative values yield null.
     */
    protected BigDecimal decimalOrNull(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        BigDecimal value;
        if (node.isNumber()) {
            value = node.decimalValue();
        } else {
            try {
                value = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparseable {} value '{}' from {}", field, node.asText(), getPlatform());
                return null;
            }
        }
        if (value.signum() < 0) {
            log.warn("Ignoring negative {} value {} from {}", field, value, getPlatform());
            return null;
        }
        return value;
    }

    protected BigDecimal decimalOrZero(JsonNode node, String field) {
        BigDecimal value = decimalOrNull(node, field);
        return value != null ? value : BigDecimal.ZERO;
    }

    protected long countOrZero(JsonNode node, String field) {
        BigDecimal value = decimalOrNull(node, field);
        return value != null ? value.setScale(0, RoundingMode.HALF_UP).longValue() : 0L;
    }

    protected static BigDecimal money(BigDecimal value) {
        return value != null ? value.setScale(MONEY_SCALE, RoundingMode.HALF_UP) : null;
    }
}
