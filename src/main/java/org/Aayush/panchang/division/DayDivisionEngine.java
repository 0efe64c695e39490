package org.Aayush.panchang.division;

import org.Aayush.core.table.StaticTables;
import org.Aayush.core.time.AstroTime;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.core.time.TimeContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits daylight (sunrise to sunset) or night (sunset to next sunrise) into equal parts and
 * names them from weekday-indexed tables.
 *
 * <p>Part {@code k} (1-based) of an interval split in {@code n} spans
 * {@code [start + (k-1)*d, start + k*d]} with {@code d = (end - start) / n}. A window whose end
 * falls at or past one full day after the governing sunrise is flagged as spilling into the next
 * day.</p>
 */
public final class DayDivisionEngine {
    public static final int KALAM_PARTS = 8;
    public static final int MUHURTHA_PARTS = 30;
    public static final int GOWRI_PARTS = 8;
    public static final int HORA_PARTS = 12;

    private DayDivisionEngine() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Rahu Kalam: one eighth of daylight picked by weekday.
     *
     * @param weekday 0=Sunday ... 6=Saturday.
     */
    public static Window rahuKalam(JulianInstant sunrise, JulianInstant sunset, int weekday, TimeContext timeContext) {
        int position = StaticTables.at(DivisionTables.RAHU_KALAM_POSITIONS, weekday, "rahuKalamPositions");
        return part(sunrise, sunset, KALAM_PARTS, position, sunrise, timeContext);
    }

    /**
     * Yamagandam: one eighth of daylight picked by weekday.
     */
    public static Window yamagandam(JulianInstant sunrise, JulianInstant sunset, int weekday, TimeContext timeContext) {
        int position = StaticTables.at(DivisionTables.YAMAGANDAM_POSITIONS, weekday, "yamagandamPositions");
        return part(sunrise, sunset, KALAM_PARTS, position, sunrise, timeContext);
    }

    /**
     * Gulikai Kalam: one eighth of daylight picked by weekday.
     */
    public static Window gulikaiKalam(JulianInstant sunrise, JulianInstant sunset, int weekday, TimeContext timeContext) {
        int position = StaticTables.at(DivisionTables.GULIKAI_POSITIONS, weekday, "gulikaiPositions");
        return part(sunrise, sunset, KALAM_PARTS, position, sunrise, timeContext);
    }

    /**
     * Dhurmuhurtham: one thirtieth of daylight picked by weekday.
     */
    public static Muhurtham dhurmuhurtham(JulianInstant sunrise, JulianInstant sunset, int weekday, TimeContext timeContext) {
        int position = StaticTables.at(DivisionTables.DHURMUHURTHAM_POSITIONS, weekday, "dhurmuhurthamPositions");
        Window window = part(sunrise, sunset, MUHURTHA_PARTS, position, sunrise, timeContext);
        double minutes = sunrise.daysUntil(sunset) * AstroTime.MINUTES_PER_DAY / MUHURTHA_PARTS;
        return new Muhurtham(position, AstroTime.round2(minutes), window);
    }

    /**
     * Daylight Gowri Panchangam: eight parts named by the weekday's day permutation.
     */
    public static List<NamedPeriod> gowriDay(JulianInstant sunrise, JulianInstant sunset, int weekday, TimeContext timeContext) {
        List<GowriPeriod> names = StaticTables.at(DivisionTables.GOWRI_DAY, weekday, "gowriDay");
        return gowri(partition(sunrise, sunset, GOWRI_PARTS, sunrise, timeContext), names);
    }

    /**
     * Night Gowri Panchangam: eight parts of sunset to next sunrise named by the weekday's night permutation.
     */
    public static List<NamedPeriod> gowriNight(
            JulianInstant sunrise,
            JulianInstant sunset,
            JulianInstant nextSunrise,
            int weekday,
            TimeContext timeContext
    ) {
        List<GowriPeriod> names = StaticTables.at(DivisionTables.GOWRI_NIGHT, weekday, "gowriNight");
        return gowri(partition(sunset, nextSunrise, GOWRI_PARTS, sunrise, timeContext), names);
    }

    /**
     * Nalla Neram: the auspicious subsequence of Gowri periods, order preserved.
     */
    public static List<NamedPeriod> nallaNeram(List<NamedPeriod> gowriPeriods) {
        List<NamedPeriod> auspicious = new ArrayList<>();
        for (NamedPeriod period : gowriPeriods) {
            if (period.isAuspicious()) {
                auspicious.add(period);
            }
        }
        return Collections.unmodifiableList(auspicious);
    }

    /**
     * Planetary hours: 12 daylight and 12 night horas numbered 1-24.
     *
     * <p>The first hora belongs to the weekday's lord; each following hora advances one step in
     * Chaldean order, continuing from day into night.</p>
     */
    public static List<NamedPeriod> hora(
            JulianInstant sunrise,
            JulianInstant sunset,
            JulianInstant nextSunrise,
            int weekday,
            TimeContext timeContext
    ) {
        List<Window> windows = new ArrayList<>(HORA_PARTS * 2);
        windows.addAll(partition(sunrise, sunset, HORA_PARTS, sunrise, timeContext));
        windows.addAll(partition(sunset, nextSunrise, HORA_PARTS, sunrise, timeContext));

        Planet dayRuler = StaticTables.at(DivisionTables.HORA_DAY_RULERS, weekday, "horaDayRulers");
        int first = Planet.CHALDEAN_ORDER.indexOf(dayRuler);
        List<NamedPeriod> horas = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            int chaldeanIndex = (first + i) % Planet.CHALDEAN_ORDER.size();
            Planet ruler = StaticTables.at(Planet.CHALDEAN_ORDER, chaldeanIndex, "chaldeanOrder");
            horas.add(NamedPeriod.builder()
                    .index(i + 1)
                    .name(ruler.getEnglishName())
                    .localName(ruler.getTamilName())
                    .auspiciousClass(ruler.getAuspiciousClass())
                    .window(windows.get(i))
                    .build());
        }
        return Collections.unmodifiableList(horas);
    }

    /**
     * Splits {@code [start, end]} into {@code parts} equal windows.
     *
     * @param governingSunrise sunrise that opens the panchang day, used for the next-day flag.
     */
    public static List<Window> partition(
            JulianInstant start,
            JulianInstant end,
            int parts,
            JulianInstant governingSunrise,
            TimeContext timeContext
    ) {
        List<Window> windows = new ArrayList<>(parts);
        for (int k = 1; k <= parts; k++) {
            windows.add(part(start, end, parts, k, governingSunrise, timeContext));
        }
        return Collections.unmodifiableList(windows);
    }

    /**
     * Returns the {@code position}-th (1-based) of {@code parts} equal windows of {@code [start, end]}.
     */
    public static Window part(
            JulianInstant start,
            JulianInstant end,
            int parts,
            int position,
            JulianInstant governingSunrise,
            TimeContext timeContext
    ) {
        Objects.requireNonNull(timeContext, "timeContext");
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be positive");
        }
        if (position < 1 || position > parts) {
            throw new AssertionError("lookup defect: position " + position + " outside [1, " + parts + "]");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("interval end precedes start");
        }
        double partDays = start.daysUntil(end) / parts;
        JulianInstant windowStart = start.plusDays((position - 1) * partDays);
        JulianInstant windowEnd = start.plusDays(position * partDays);
        return Window.builder()
                .start(windowStart)
                .end(windowEnd)
                .crossesIntoNextDay(!windowEnd.isBefore(governingSunrise.plusDays(1.0d)))
                .startTime(timeContext.label(windowStart))
                .endTime(timeContext.label(windowEnd))
                .build();
    }

    private static List<NamedPeriod> gowri(List<Window> windows, List<GowriPeriod> names) {
        List<NamedPeriod> periods = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            GowriPeriod period = StaticTables.at(names, i, "gowriPermutation");
            periods.add(NamedPeriod.builder()
                    .index(i + 1)
                    .name(period.getDisplayName())
                    .localName(period.getDisplayName())
                    .auspiciousClass(period.getAuspiciousClass())
                    .window(windows.get(i))
                    .build());
        }
        return Collections.unmodifiableList(periods);
    }
}
