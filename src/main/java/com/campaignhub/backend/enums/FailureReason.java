package com.campaignhub.backend.enums;

/**
 * Why a single source adapter produced no records.
 */
public enum FailureReason {
    TRANSPORT,
    UPSTREAM_STATUS,
    MALFORMED_PAYLOAD,
    UNMAPPED_VALUE,
    TIMEOUT,
    UNEXPECTED
}
