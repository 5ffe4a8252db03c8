package com.opendining.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative fullness of a slot, ordered from emptiest to fullest.
 */
public enum PacingStatus {
    AVAILABLE,
    MODERATE,
    BUSY,
    PACING_FULL,
    PHYSICALLY_FULL;

    /** Slots that can be suggested to a guest without any override. */
    public boolean isBookable() {
        return this == AVAILABLE || this == MODERATE;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
