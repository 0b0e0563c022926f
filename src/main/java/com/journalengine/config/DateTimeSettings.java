package com.journalengine.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Application timezone settings used when journal dates are written.
 */
@Component
@Getter
public class DateTimeSettings {

    private static final ZoneId UTC = ZoneId.of("UTC");

    private final ZoneId applicationZone;

    private final boolean forceUtc;

    public DateTimeSettings(
            @Value("${journal-engine.timezone:UTC}") String timezone,
            @Value("${journal-engine.force-utc:false}") boolean forceUtc) {
        this.applicationZone = ZoneId.of(timezone);
        this.forceUtc = forceUtc;
    }

    public static DateTimeSettings of(ZoneId zone, boolean forceUtc) {
        return new DateTimeSettings(zone.getId(), forceUtc);
    }

    /**
     * Moves a parsed date into the application zone, or into UTC when the
     * global override is active.
     */
    public ZonedDateTime normalize(ZonedDateTime value) {
        ZonedDateTime local = value.withZoneSameInstant(applicationZone);
        if (forceUtc) {
            return local.withZoneSameInstant(UTC);
        }
        return local;
    }
}
