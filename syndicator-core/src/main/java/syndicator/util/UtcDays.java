package syndicator.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * UTC calendar-day helpers for the daily budget.
 */
public final class UtcDays {

    private UtcDays() {
    }

    /** Day key in {@code yyyy-MM-dd} form. */
    public static String dayKey(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
    }

    /** Start of the UTC day following {@code instant}. */
    public static Instant nextMidnight(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC)
                .plusDays(1)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }
}
