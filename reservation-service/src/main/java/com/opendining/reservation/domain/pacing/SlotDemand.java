package com.opendining.reservation.domain.pacing;

/**
 * What is already committed at one slot, plus the party asking to join it.
 *
 * @param tablesAvailable   assignable options for the party (0 means no table can take it)
 * @param committedCovers   covers of occupying bookings starting at the slot
 * @param committedBookings occupying bookings starting at the slot
 * @param occupiedTables    assignable tables held by any booking at the slot
 * @param totalTables       assignable tables of the restaurant
 * @param partySize         size of the requesting party
 */
public record SlotDemand(
        int tablesAvailable,
        int committedCovers,
        int committedBookings,
        long occupiedTables,
        int totalTables,
        int partySize
) {
}
