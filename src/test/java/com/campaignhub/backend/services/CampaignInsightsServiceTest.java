package com.campaignhub.backend.services;

import com.campaignhub.backend.dto.CampaignFilter;
import com.campaignhub.backend.dto.CampaignStatsDto;
import com.campaignhub.backend.enums.CampaignStatus;
import com.campaignhub.backend.enums.Platform;
import com.campaignhub.backend.models.UnifiedCampaign;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.campaignhub.backend.util.CampaignTestData.campaign;
import static com.campaignhub.backend.util.CampaignTestData.withCost;
import static org.assertj.core.api.Assertions.*;

class CampaignInsightsServiceTest {

    private CampaignInsightsService insightsService;

    @BeforeEach
    void setUp() {
        insightsService = new CampaignInsightsService();
    }

    @Test
    void totalEnabledBudget_CountsOnlyEnabledCampaigns() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                campaign("1", Platform.GOOGLE, CampaignStatus.ENABLED, "100.0"),
                campaign("2", Platform.META, CampaignStatus.PAUSED, "200.0"));

        // When
        BigDecimal total = insightsService.totalEnabledBudget(campaigns);

        // Then
        assertThat(total).isEqualByComparingTo("100");
    }

    @Test
    void totalEnabledBudget_MatchesReferenceSumAndSkipsMissingBudgets() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                campaign("1", Platform.GOOGLE, CampaignStatus.ENABLED, "10.25"),
                campaign("2", Platform.GOOGLE, CampaignStatus.REMOVED, "99.00"),
                campaign("3", Platform.META, CampaignStatus.ENABLED, null),
                campaign("4", Platform.META, CampaignStatus.ENABLED, "4.75"),
                campaign("5", Platform.META, CampaignStatus.PAUSED, "1.00"));

        BigDecimal reference = BigDecimal.ZERO;
        for (UnifiedCampaign c : campaigns) {
            if (c.getStatus() == CampaignStatus.ENABLED && c.getDailyBudget() != null) {
                reference = reference.add(c.getDailyBudget());
            }
        }

        // When
        BigDecimal total = insightsService.totalEnabledBudget(campaigns);

        // Then
        assertThat(total).isEqualByComparingTo(reference);
        assertThat(total).isEqualByComparingTo("15.00");
    }

    @Test
    void groupByPlatform_SplitsOneGoogleAndOneMeta() {
        // Given
        UnifiedCampaign google = campaign("g1", Platform.GOOGLE, "100");
        UnifiedCampaign meta = campaign("m1", Platform.META, "200");

        // When
        Map<Platform, List<UnifiedCampaign>> groups = insightsService.groupByPlatform(List.of(google, meta));

        // Then
        assertThat(groups.get(Platform.GOOGLE)).containsExactly(google);
        assertThat(groups.get(Platform.META)).containsExactly(meta);
    }

    @Test
    void groupByPlatform_GroupsFormAPartitionOfTheInput() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                campaign("g1", Platform.GOOGLE, "5"),
                campaign("m1", Platform.META, "4"),
                campaign("g2", Platform.GOOGLE, "3"),
                campaign("g3", Platform.GOOGLE, "2"),
                campaign("m2", Platform.META, "1"));

        // When
        Map<Platform, List<UnifiedCampaign>> groups = insightsService.groupByPlatform(campaigns);

        // Then
        List<UnifiedCampaign> union = new ArrayList<>();
        groups.values().forEach(union::addAll);
        assertThat(union).hasSize(campaigns.size());
        assertThat(union).containsExactlyInAnyOrderElementsOf(campaigns);
        assertThat(groups.get(Platform.GOOGLE)).extracting(UnifiedCampaign::getId)
                .containsExactly("g1", "g2", "g3");
    }

    @Test
    void groupByPlatform_EmptyInputStillHasEveryPlatform() {
        Map<Platform, List<UnifiedCampaign>> groups = insightsService.groupByPlatform(List.of());

        assertThat(groups).containsOnlyKeys(Platform.GOOGLE, Platform.META);
        assertThat(groups.values()).allMatch(List::isEmpty);
    }

    @Test
    void filter_ByPlatformStatusAndBudgetRange() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                campaign("g1", Platform.GOOGLE, CampaignStatus.ENABLED, "300"),
                campaign("g2", Platform.GOOGLE, CampaignStatus.ENABLED, "150"),
                campaign("g3", Platform.GOOGLE, CampaignStatus.PAUSED, "120"),
                campaign("g4", Platform.GOOGLE, CampaignStatus.ENABLED, "100"),
                campaign("g5", Platform.GOOGLE, CampaignStatus.ENABLED, null),
                campaign("m1", Platform.META, CampaignStatus.ENABLED, "140"));

        CampaignFilter filter = CampaignFilter.builder()
                .platform(Platform.GOOGLE)
                .status(CampaignStatus.ENABLED)
                .minBudget(new BigDecimal("100"))
                .maxBudget(new BigDecimal("200"))
                .build();

        // When
        List<UnifiedCampaign> filtered = insightsService.filter(campaigns, filter);

        // Then
        assertThat(filtered).extracting(UnifiedCampaign::getId).containsExactly("g2", "g4");
    }

    @Test
    void filter_EmptyFilterKeepsEverythingIncludingUnbudgeted() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                campaign("g1", Platform.GOOGLE, "300"),
                campaign("m1", Platform.META, null));

        // When
        List<UnifiedCampaign> filtered = insightsService.filter(campaigns, new CampaignFilter());

        // Then
        assertThat(filtered).containsExactlyElementsOf(campaigns);
    }

    @Test
    void filter_MinGreaterThanMax_Rejected() {
        CampaignFilter filter = CampaignFilter.builder()
                .minBudget(new BigDecimal("500"))
                .maxBudget(new BigDecimal("100"))
                .build();

        assertThatThrownBy(() -> insightsService.filter(List.of(), filter))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculateStats_CountsStatusesBudgetAndSpend() {
        // Given
        List<UnifiedCampaign> campaigns = List.of(
                withCost(campaign("g1", Platform.GOOGLE, CampaignStatus.ENABLED, "100.00"), "90.00"),
                withCost(campaign("m1", Platform.META, CampaignStatus.PAUSED, "200.00"), "45.00"),
                withCost(campaign("m2", Platform.META, CampaignStatus.REMOVED, "50.00"), "5.50"),
                withCost(campaign("m3", Platform.META, CampaignStatus.ENABLED, "25.00"), "0"));

        // When
        CampaignStatsDto stats = insightsService.calculateStats(campaigns);

        // Then
        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getEnabled()).isEqualTo(2);
        assertThat(stats.getPaused()).isEqualTo(1);
        assertThat(stats.getRemoved()).isEqualTo(1);
        assertThat(stats.getTotalBudget()).isEqualByComparingTo("125.00");
        assertThat(stats.getTotalSpend()).isEqualByComparingTo("140.50");
        assertThat(stats.getByPlatform()).containsEntry("google", 1L).containsEntry("meta", 3L);
    }
}
