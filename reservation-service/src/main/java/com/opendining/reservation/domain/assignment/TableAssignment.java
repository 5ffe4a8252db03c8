package com.opendining.reservation.domain.assignment;

import com.opendining.reservation.domain.model.DiningTable;

import java.util.List;

/**
 * One table, or several joined tables, chosen for a party. The first table is the primary.
 */
public record TableAssignment(List<DiningTable> tables) {

    public TableAssignment {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one table");
        }
        tables = List.copyOf(tables);
    }

    public static TableAssignment single(DiningTable table) {
        return new TableAssignment(List.of(table));
    }

    public DiningTable primaryTable() {
        return tables.get(0);
    }

    public List<Long> joinedTableIds() {
        return tables.stream().skip(1).map(DiningTable::getId).toList();
    }

    public List<Long> tableIds() {
        return tables.stream().map(DiningTable::getId).toList();
    }

    public boolean isCombination() {
        return tables.size() > 1;
    }

    public int totalMaxCapacity() {
        return tables.stream().mapToInt(DiningTable::getMaxCapacity).sum();
    }

    public int totalPriority() {
        return tables.stream().mapToInt(DiningTable::getPriority).sum();
    }
}
