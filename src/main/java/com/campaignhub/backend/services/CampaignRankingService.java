package com.campaignhub.backend.services;

import com.campaignhub.backend.models.SourceOutcome;
import com.campaignhub.backend.models.UnifiedCampaign;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the records of successful sources and ranks them by daily budget.
 */
@Service
public class CampaignRankingService {

    /**
     * Highest daily budget first. Records without a budget cannot be compared and rank
     * after every budgeted record. {@link List#sort} is stable, so equal budgets keep
     * their merge order.
     */
    public static final Comparator<UnifiedCampaign> BY_DAILY_BUDGET_DESC = Comparator.comparing(
            UnifiedCampaign::getDailyBudget,
            Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()));

    /**
     * @param outcomes one outcome per source, in source registration order
     * @return every record of every successful source, ranked; failed sources add nothing
     */
    public List<UnifiedCampaign> rank(List<SourceOutcome> outcomes) {
        List<UnifiedCampaign> merged = new ArrayList<>();
        for (SourceOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                merged.addAll(outcome.getCampaigns());
            }
        }

        merged.sort(BY_DAILY_BUDGET_DESC);
        return Collections.unmodifiableList(merged);
    }
}
