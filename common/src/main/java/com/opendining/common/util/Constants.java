package com.opendining.common.util;

/**
 * Limits and key prefixes shared by the API layer and the lock registry.
 */
public final class Constants {

    /** Prefix of every slot lock key: {@code booking-lock:<restaurant>:<yyyy-MM-dd>:<HH:mm>}. */
    public static final String BOOKING_LOCK_PREFIX = "booking-lock:";

    /** Smallest party a booking may be taken for. */
    public static final int MIN_PARTY_SIZE = 1;

    /** Largest party a single booking may seat, joined tables included. */
    public static final int MAX_PARTY_SIZE = 50;

    private Constants() {
    }
}
