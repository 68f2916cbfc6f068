package com.campaignhub.backend.enums;

import java.util.Locale;

public enum CampaignStatus {
    ENABLED("Active"),
    PAUSED("Paused"),
    REMOVED("Removed");

    private final String displayName;

    CampaignStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isEnabled() {
        return this == ENABLED;
    }

    public static CampaignStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported campaign status: " + value);
        }
    }
}
