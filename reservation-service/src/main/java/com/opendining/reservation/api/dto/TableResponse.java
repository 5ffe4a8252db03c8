package com.opendining.reservation.api.dto;

import com.opendining.reservation.domain.model.DiningTable;

public record TableResponse(Long id, String label, int minCapacity, int maxCapacity, boolean combinable,
                            String combinationGroup, int priority) {

    public static TableResponse from(DiningTable table) {
        return new TableResponse(table.getId(), table.getLabel(), table.getMinCapacity(), table.getMaxCapacity(),
                table.isCombinable(), table.getCombinationGroup(), table.getPriority());
    }
}
