package com.opendining.reservation.domain.availability;

import java.util.List;

/**
 * @param bestAvailability bookable slots, least utilized first
 * @param quietTimes       slots with no pacing pressure at all
 * @param peakTimes        busy or pacing-full slots
 */
public record AvailabilitySuggestions(List<SlotAvailability> bestAvailability,
                                      List<SlotAvailability> quietTimes,
                                      List<SlotAvailability> peakTimes) {
}
