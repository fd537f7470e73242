package com.example.mlops.dto;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Descriptor of the period a training dataset was drawn from.
 *
 * @param id           stable identifier used in logs, the registry and the ingestion API (e.g. {@code 2024-05})
 * @param start        first day included
 * @param endExclusive first day no longer included
 */
public record DataWindow(String id, LocalDate start, LocalDate endExclusive) {

    public static DataWindow ofMonth(YearMonth month) {
        return new DataWindow(month.toString(), month.atDay(1), month.plusMonths(1).atDay(1));
    }
}
