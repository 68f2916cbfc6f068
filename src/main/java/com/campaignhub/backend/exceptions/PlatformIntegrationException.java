package com.campaignhub.backend.exceptions;

import com.campaignhub.backend.enums.FailureReason;
import com.campaignhub.backend.enums.Platform;

/**
 * A source adapter could not produce records for its platform.
 * Always scoped to one platform; the underlying cause is kept for logging.
 */
public class PlatformIntegrationException extends Exception {

    private final Platform platform;
    private final FailureReason reason;

    public PlatformIntegrationException(Platform platform, FailureReason reason, String message) {
        super(message);
        this.platform = platform;
        this.reason = reason;
    }

    public PlatformIntegrationException(Platform platform, FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.platform = platform;
        this.reason = reason;
    }

    public Platform getPlatform() {
        return platform;
    }

    public FailureReason getReason() {
        return reason;
    }
}
