package com.campaignhub.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Platform {
    GOOGLE("google", "Google Ads"),
    META("meta", "Meta Ads");

    private final String value;
    private final String displayName;

    Platform(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup by wire value or constant name ("google", "GOOGLE").
     */
    @JsonCreator
    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Platform must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.value.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unsupported platform: " + value);
    }
}
