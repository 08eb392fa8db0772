package com.tapas.superstore.etl.feature;

import java.time.LocalDate;

/**
 * Calendar decompositions applied to an ancestor's own date attributes.
 */
public enum DatePartPrimitive {
    MONTH,
    YEAR;

    public Long apply(LocalDate date) {
        if (date == null) {
            return null;
        }
        return switch (this) {
            case MONTH -> (long) date.getMonthValue();
            case YEAR -> (long) date.getYear();
        };
    }
}
