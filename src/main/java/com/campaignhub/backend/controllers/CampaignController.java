package com.campaignhub.backend.controllers;

import com.campaignhub.backend.dto.CampaignFilter;
import com.campaignhub.backend.dto.CampaignStatsDto;
import com.campaignhub.backend.enums.CampaignStatus;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.models.UnifiedCampaign;
import com.campaignhub.backend.services.CampaignAggregationService;
import com.campaignhub.backend.services.CampaignInsightsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unified campaign endpoints across every configured ad platform
 */
@RestController
@RequestMapping("/api/v1/campaigns")
@Slf4j
public class CampaignController {

    private final CampaignAggregationService aggregationService;
    private final CampaignInsightsService insightsService;

    public CampaignController(CampaignAggregationService aggregationService,
                              CampaignInsightsService insightsService) {
        this.aggregationService = aggregationService;
        this.insightsService = insightsService;
    }

    /**
     * Ranked campaigns, highest daily budget first
     * GET /api/v1/campaigns?platform=google&status=ENABLED&minBudget=100
     */
    @GetMapping
    public ResponseEntity<List<UnifiedCampaign>> getCampaigns(
            @RequestParam(required = false) String platform,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) BigDecimal minBudget,
            @RequestParam(required = false) BigDecimal maxBudget) {

        CampaignFilter filter = CampaignFilter.builder()
                .platform(platform != null ? Platform.fromValue(platform) : null)
                .status(status != null ? CampaignStatus.fromValue(status) : null)
                .minBudget(minBudget)
                .maxBudget(maxBudget)
                .build();

        List<UnifiedCampaign> campaigns = aggregationService.getCampaigns();
        return ResponseEntity.ok(insightsService.filter(campaigns, filter));
    }

    @GetMapping("/stats")
    public ResponseEntity<CampaignStatsDto> getStats() {
        return ResponseEntity.ok(insightsService.calculateStats(aggregationService.getCampaigns()));
    }

    /**
     * Ranked campaigns keyed by platform value ("google", "meta")
     */
    @GetMapping("/by-platform")
    public ResponseEntity<Map<String, List<UnifiedCampaign>>> getCampaignsByPlatform() {
        Map<String, List<UnifiedCampaign>> response = new LinkedHashMap<>();
        insightsService.groupByPlatform(aggregationService.getCampaigns())
                .forEach((platform, group) -> response.put(platform.getValue(), group));
        return ResponseEntity.ok(response);
    }
}
