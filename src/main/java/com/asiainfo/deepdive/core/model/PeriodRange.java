package com.asiainfo.deepdive.core.model;

import com.asiainfo.deepdive.shared.InvariantViolationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 对比周期，闭区间 [start, end]
 */
public record PeriodRange(
    LocalDate start,
    LocalDate end
) {
    public PeriodRange {
        if (start == null || end == null) {
            throw new InvariantViolationException("Period start and end are required");
        }
        if (start.isAfter(end)) {
            throw new InvariantViolationException(
                    String.format("Period start %s is after end %s", start, end));
        }
    }

    public static PeriodRange of(String start, String end) {
        try {
            return new PeriodRange(LocalDate.parse(start), LocalDate.parse(end));
        } catch (DateTimeParseException e) {
            throw new InvariantViolationException("Invalid period date: " + e.getParsedString(), e);
        }
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
