package com.opendining.reservation.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.opendining.reservation.domain.assignment.AvailableTables;
import com.opendining.reservation.domain.assignment.TableAssignment;
import com.opendining.reservation.domain.availability.SlotEvaluation;
import com.opendining.reservation.domain.availability.TableAvailability;
import com.opendining.reservation.domain.model.PacingStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Free tables at one time.
 *
 * @param suggestedTableIds best assignment, primary table first; empty when nothing fits
 */
public record AvailableTablesResponse(
        Long restaurantId,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm")
        LocalTime time,
        int partySize,
        int durationMinutes,
        int count,
        List<TableResponse> tables,
        List<Long> suggestedTableIds,
        boolean combination,
        PacingStatus status,
        double utilizationPercent,
        boolean canOverride
) {
    public static AvailableTablesResponse from(TableAvailability availability) {
        SlotEvaluation evaluation = availability.evaluation();
        AvailableTables tables = evaluation.tables();
        return new AvailableTablesResponse(
                availability.restaurantId(),
                availability.date(),
                evaluation.time(),
                availability.partySize(),
                availability.durationMinutes(),
                tables.count(),
                tables.candidates().stream().map(TableResponse::from).toList(),
                tables.best().map(TableAssignment::tableIds).orElse(List.of()),
                tables.best().map(TableAssignment::isCombination).orElse(false),
                evaluation.classification().status(),
                evaluation.classification().utilizationPercent(),
                evaluation.classification().canOverride());
    }
}
