package com.socialfeed.ingest.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Half-open UTC interval {@code [start, until)} aligned to calendar days.
 */
public record IngestWindow(LocalDate startDate, LocalDate untilDate) {

    public IngestWindow {
        if (startDate == null || untilDate == null) {
            throw new IllegalArgumentException("Window bounds must not be null");
        }
        if (!startDate.isBefore(untilDate)) {
            throw new IllegalArgumentException("Window start " + startDate + " must be before until " + untilDate);
        }
    }

    /**
     * Window ending at the start of tomorrow (UTC) and reaching {@code lookbackDays} back.
     */
    public static IngestWindow endingTomorrow(Instant now, int lookbackDays) {
        LocalDate until = now.atZone(ZoneOffset.UTC).toLocalDate().plusDays(1);
        return new IngestWindow(until.minusDays(Math.max(1, lookbackDays)), until);
    }

    public Instant start() {
        return startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant until() {
        return untilDate.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start()) && instant.isBefore(until());
    }

    @Override
    public String toString() {
        return "[" + startDate + " .. " + untilDate + ")";
    }
}
