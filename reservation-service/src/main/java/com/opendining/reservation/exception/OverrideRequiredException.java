package com.opendining.reservation.exception;

import com.opendining.common.exception.ConflictException;
import com.opendining.reservation.domain.pacing.PacingClassification;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * The slot has reached its pacing ceiling but tables are still free. An expected branch of
 * the booking flow: staff resubmit with overridePacing and a reason.
 */
@Getter
public class OverrideRequiredException extends ConflictException {

    public static final String ERROR_CODE = "OVERRIDE_REQUIRED";

    private final LocalDate date;
    private final LocalTime time;
    private final PacingClassification classification;

    public OverrideRequiredException(LocalDate date, LocalTime time, PacingClassification classification) {
        super(String.format("Slot %s %s is pacing full (%.1f%% utilized); override with a reason to book",
                date, time, classification.utilizationPercent()), ERROR_CODE);
        this.date = date;
        this.time = time;
        this.classification = classification;
    }
}
