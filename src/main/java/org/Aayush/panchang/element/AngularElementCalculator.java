package org.Aayush.panchang.element;

import lombok.experimental.UtilityClass;
import org.Aayush.core.table.StaticTables;
import org.Aayush.core.time.AstroTime;
import org.Aayush.panchang.ephemeris.SiderealPositions;

/**
 * Pure mapping from sidereal Sun/Moon longitudes to the angular panchang elements.
 *
 * <p>All inputs are sidereal degrees. Results are deterministic and depend on the two longitudes
 * only.</p>
 */
@UtilityClass
public class AngularElementCalculator {
    private static final double TITHI_SPAN_DEGREES = 12.0d;
    private static final double KARANA_SPAN_DEGREES = 6.0d;
    private static final double SIGN_SPAN_DEGREES = 30.0d;
    private static final double MANSIONS = 27.0d;
    private static final double FULL_CIRCLE_DEGREES = 360.0d;
    private static final int TITHIS_PER_PAKSHA = 15;
    private static final int FIRST_FIXED_KARANA_SLOT = 57;
    private static final int MOVABLE_KARANAS = 7;
    private static final int LAST_KARANA_SLOT = 10;

    /**
     * Lunar day from Moon-Sun elongation: 30 units of 12 degrees.
     */
    public static PanchangElement tithi(double sunLongitude, double moonLongitude) {
        double diff = AstroTime.normalizeDegrees(moonLongitude - sunLongitude);
        int num = (int) Math.floor(diff / TITHI_SPAN_DEGREES);
        double elapsed = AstroTime.modulo(diff, TITHI_SPAN_DEGREES) / TITHI_SPAN_DEGREES;
        return PanchangElement.builder()
                .kind(ElementKind.TITHI)
                .number(num + 1)
                .name(StaticTables.at(PanchangNames.TITHIS, num % TITHIS_PER_PAKSHA, "tithi"))
                .paksha(num < TITHIS_PER_PAKSHA ? Paksha.SHUKLA : Paksha.KRISHNA)
                .remainingPercent(AstroTime.round2((1.0d - elapsed) * 100.0d))
                .build();
    }

    /**
     * Lunar mansion: 27 sectors of 13°20' of the Moon's longitude.
     */
    public static PanchangElement nakshatra(double moonLongitude) {
        double mansion = mansionValue(moonLongitude);
        int num = (int) Math.floor(mansion);
        return PanchangElement.builder()
                .kind(ElementKind.NAKSHATRA)
                .number(num + 1)
                .name(StaticTables.at(PanchangNames.NAKSHATRAS, num, "nakshatra"))
                .remainingPercent(AstroTime.round2((1.0d - AstroTime.modulo(mansion, 1.0d)) * 100.0d))
                .build();
    }

    /**
     * Yoga: 27 sectors of the Sun + Moon longitude sum.
     */
    public static PanchangElement yoga(double sunLongitude, double moonLongitude) {
        double yogaValue = mansionValue(sunLongitude + moonLongitude);
        int num = (int) Math.floor(yogaValue);
        return PanchangElement.builder()
                .kind(ElementKind.YOGA)
                .number(num + 1)
                .name(StaticTables.at(PanchangNames.YOGAS, num, "yoga"))
                .remainingPercent(AstroTime.round2((1.0d - AstroTime.modulo(yogaValue, 1.0d)) * 100.0d))
                .build();
    }

    /**
     * Half-tithi: 60 units of 6 degrees over 11 karana names.
     *
     * <p>Units 58-60 of the cycle take the fixed karanas; the others cycle through the seven movable
     * ones.</p>
     */
    public static PanchangElement karana(double sunLongitude, double moonLongitude) {
        double diff = AstroTime.normalizeDegrees(moonLongitude - sunLongitude);
        int num = (int) Math.floor(diff / KARANA_SPAN_DEGREES);
        double elapsed = AstroTime.modulo(diff, KARANA_SPAN_DEGREES) / KARANA_SPAN_DEGREES;
        return PanchangElement.builder()
                .kind(ElementKind.KARANA)
                .number(num + 1)
                .name(StaticTables.at(PanchangNames.KARANAS, karanaSlot(num), "karana"))
                .remainingPercent(AstroTime.round2((1.0d - elapsed) * 100.0d))
                .build();
    }

    /**
     * Maps a 0-based karana unit (0-59) to its name slot (0-10).
     */
    public static int karanaSlot(int karanaUnit) {
        int slot = karanaUnit >= FIRST_FIXED_KARANA_SLOT
                ? MOVABLE_KARANAS + (karanaUnit - FIRST_FIXED_KARANA_SLOT)
                : karanaUnit % MOVABLE_KARANAS;
        return Math.min(slot, LAST_KARANA_SLOT);
    }

    /**
     * Tamil solar month from the Sun's sign.
     */
    public static SolarMonth solarMonth(double sunLongitude) {
        int num = signIndex(sunLongitude);
        return new SolarMonth(num, StaticTables.at(PanchangNames.SOLAR_MONTHS, num, "solarMonth"));
    }

    /**
     * Sign occupied by a body at the given sidereal longitude.
     */
    public static RasiPosition rasi(double longitude) {
        int num = signIndex(longitude);
        return new RasiPosition(
                AstroTime.round2(AstroTime.normalizeDegrees(longitude)),
                num,
                StaticTables.at(PanchangNames.RASIS, num, "rasi")
        );
    }

    /**
     * Evaluates one element kind at a position pair.
     */
    public static PanchangElement evaluate(ElementKind kind, SiderealPositions positions) {
        return kind.evaluate(positions);
    }

    /**
     * Position in units of 13°20'. Evaluated as {@code x * 27 / 360} in that order so that sector
     * boundaries land on whole units.
     */
    private static double mansionValue(double longitude) {
        return AstroTime.normalizeDegrees(longitude) * MANSIONS / FULL_CIRCLE_DEGREES;
    }

    private static int signIndex(double longitude) {
        return (int) Math.floor(AstroTime.normalizeDegrees(longitude) / SIGN_SPAN_DEGREES);
    }
}
