package com.accessmonitoring.domain.activity;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Inclusive business-hours window, evaluated in a fixed zone.
 *
 * @param startHour first hour of the day counted as business hours (0-23)
 * @param endHour last hour of the day counted as business hours (0-23)
 */
public record BusinessHours(int startHour, int endHour, ZoneId zone) {

    public BusinessHours {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23) {
            throw new IllegalArgumentException("Business hours must be within 0-23");
        }
        if (startHour > endHour) {
            throw new IllegalArgumentException("Business hours start must not be after end");
        }
    }

    public boolean isOutside(Instant instant) {
        int hour = instant.atZone(zone).getHour();
        return hour < startHour || hour > endHour;
    }
}
