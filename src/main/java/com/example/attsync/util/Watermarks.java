package com.example.attsync.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Date arithmetic around the watermark. A watermark is a calendar day; everything
 * punched on a later day is new.
 */
public final class Watermarks {
    private Watermarks() {
    }

    /**
     * The watermark {@code lookbackDays} before today, in the clock's zone.
     */
    public static LocalDate fromLookback(Clock clock, int lookbackDays) {
        Objects.requireNonNull(clock, "clock");
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("lookbackDays must not be negative");
        }
        return LocalDate.now(clock).minusDays(lookbackDays);
    }

    /**
     * First instant that lies strictly after the watermark day.
     */
    public static LocalDateTime lowerBound(LocalDate watermark) {
        Objects.requireNonNull(watermark, "watermark");
        return watermark.plusDays(1).atStartOfDay();
    }

    public static LocalDate parse(String text) {
        try {
            return LocalDate.parse(Objects.requireNonNull(text, "text").trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid watermark date: " + text, ex);
        }
    }
}
