package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Analysis window in UTC days. The start day is included from midnight, the end day is
 * included up to its last millisecond.
 */
public record DateRange(
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate
) {

    public DateRange {
        if (startDate == null || endDate == null) {
            throw new FunnelAnalyticsException(ErrorKind.INVALID_DATE_RANGE, "Both dates are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DATE_RANGE,
                    "start_date " + startDate + " is after end_date " + endDate
            );
        }
    }

    public long startEpochMillis() {
        return startDate.atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    public long endEpochMillis() {
        return endDate.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC).toEpochMilli();
    }
}
