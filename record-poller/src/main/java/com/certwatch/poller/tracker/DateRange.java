package com.certwatch.poller.tracker;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds and validates the list of registration dates a job polls.
 */
public final class DateRange {

    private DateRange() {
    }

    /** Every day from start to end, both inclusive, at most {@code maxDays} of them. */
    public static List<LocalDate> between(LocalDate start, LocalDate end, int maxDays) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Start date and end date are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidRangeException("Start date " + start + " is after end date " + end);
        }
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        if (days > maxDays) {
            throw new InvalidRangeException("Date range spans " + days + " days, more than the maximum of " + maxDays);
        }
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return List.copyOf(dates);
    }

    /** Rejects an empty range, null entries, or dates out of chronological order. */
    public static List<LocalDate> validate(List<LocalDate> dates) {
        if (dates == null || dates.isEmpty()) {
            throw new InvalidRangeException("Date range must contain at least one date");
        }
        LocalDate previous = null;
        for (LocalDate date : dates) {
            if (date == null) {
                throw new InvalidRangeException("Date range contains a null date");
            }
            if (previous != null && date.isBefore(previous)) {
                throw new InvalidRangeException("Date range is not in chronological order: " + previous + " before " + date);
            }
            previous = date;
        }
        return List.copyOf(dates);
    }
}
