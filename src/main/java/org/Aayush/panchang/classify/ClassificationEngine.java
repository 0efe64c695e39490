package org.Aayush.panchang.classify;

import lombok.experimental.UtilityClass;
import org.Aayush.core.table.StaticTables;
import org.Aayush.core.time.AstroTime;
import org.Aayush.panchang.division.AuspiciousClass;
import org.Aayush.panchang.element.PanchangNames;

import java.util.List;

/**
 * Table-driven classifications derived from already computed panchang elements.
 *
 * <p>Every function is total over valid indices and side-effect free.</p>
 */
@UtilityClass
public class ClassificationEngine {
    /** "8th from" under inclusive counting is an offset of 7. */
    private static final int ASHTAMA_OFFSET = 7;

    /**
     * Nokku Naal group of a nakshatra, looked up by name.
     *
     * @return the group, or {@link NokkuDirection#UNCLASSIFIED} for names outside all three groups.
     */
    public static NokkuNaal nokkuNaal(String nakshatraName) {
        NokkuDirection direction = nokkuDirection(nakshatraName);
        return new NokkuNaal(nakshatraName, direction, direction.getLabel(), direction.getGuidance());
    }

    /**
     * Amirthathi yoga for a weekday and 1-based nakshatra number.
     *
     * @param weekday 0=Sunday ... 6=Saturday.
     * @param nakshatraNumber 1-27.
     */
    public static AmirthathiYoga amirthathiYoga(int weekday, int nakshatraNumber) {
        List<String> table = ClassificationTables.AMIRTHATHI_YOGAS;
        int index = Math.floorMod(weekday + nakshatraNumber - 1, table.size());
        String name = StaticTables.at(table, index, "amirthathiYogas");
        return new AmirthathiYoga(index, name, amirthathiClass(name));
    }

    /**
     * Auspiciousness of an Amirthathi yoga name; names in neither set are neutral.
     */
    public static AuspiciousClass amirthathiClass(String yogaName) {
        if (ClassificationTables.AMIRTHATHI_AUSPICIOUS.contains(yogaName)) {
            return AuspiciousClass.AUSPICIOUS;
        }
        if (ClassificationTables.AMIRTHATHI_INAUSPICIOUS.contains(yogaName)) {
            return AuspiciousClass.INAUSPICIOUS;
        }
        return AuspiciousClass.NEUTRAL;
    }

    /**
     * Special yoga for a weekday and 0-based nakshatra index.
     */
    public static SpecialYoga specialYoga(int weekday, int nakshatraIndex) {
        List<SpecialYogaType> row = StaticTables.at(ClassificationTables.SPECIAL_YOGA_GRID, weekday, "specialYogaGrid");
        SpecialYogaType type = StaticTables.at(row, nakshatraIndex, "specialYogaGrid[" + weekday + "]");
        return new SpecialYoga(type, type.getLocalName(), type.getSeverity(), type.getDescription(), type.getColor());
    }

    /**
     * Chandrashtamam positions eight places (inclusive count) ahead of the Moon's rasi and nakshatra.
     *
     * @param rasiIndex Moon's current rasi, 0-11.
     * @param nakshatraIndex Moon's current nakshatra, 0-26.
     */
    public static Chandrashtamam chandrashtamam(int rasiIndex, int nakshatraIndex) {
        List<String> rasis = PanchangNames.RASIS;
        List<String> nakshatras = PanchangNames.NAKSHATRAS;
        String currentRasi = StaticTables.at(rasis, rasiIndex, "rasi");
        String currentNakshatra = StaticTables.at(nakshatras, nakshatraIndex, "nakshatra");
        int offsetRasiIndex = (rasiIndex + ASHTAMA_OFFSET) % rasis.size();
        int offsetNakshatraIndex = (nakshatraIndex + ASHTAMA_OFFSET) % nakshatras.size();
        String offsetRasi = StaticTables.at(rasis, offsetRasiIndex, "rasi");
        String offsetNakshatra = StaticTables.at(nakshatras, offsetNakshatraIndex, "nakshatra");

        return Chandrashtamam.builder()
                .currentRasiIndex(rasiIndex)
                .currentRasi(currentRasi)
                .currentNakshatraIndex(nakshatraIndex)
                .currentNakshatra(currentNakshatra)
                .rasiIndex(offsetRasiIndex)
                .rasi(offsetRasi)
                .nakshatraIndex(offsetNakshatraIndex)
                .nakshatra(offsetNakshatra)
                .description(String.format(
                        "Moon transits %s rasi in %s nakshatra. Chandrashtamam falls on %s rasi (%s nakshatra); "
                                + "avoid new undertakings and important decisions if your birth star sits there.",
                        currentRasi, currentNakshatra, offsetRasi, offsetNakshatra))
                .build();
    }

    /**
     * Solar half-year from the Sun's sidereal longitude.
     */
    public static Ayana ayana(double sunLongitude) {
        double longitude = AstroTime.normalizeDegrees(sunLongitude);
        return longitude >= 270.0d || longitude < 90.0d ? Ayana.UTTARAYANA : Ayana.DAKSHINAYANA;
    }

    /**
     * Season of a solar month name.
     *
     * @throws AssertionError for names outside the solar month table.
     */
    public static Rutu rutu(String solarMonthName) {
        Rutu rutu = ClassificationTables.RUTU_BY_MONTH.get(solarMonthName);
        if (rutu == null) {
            throw new AssertionError("lookup defect: no season for solar month " + solarMonthName);
        }
        return rutu;
    }

    private static NokkuDirection nokkuDirection(String nakshatraName) {
        if (nakshatraName == null) {
            return NokkuDirection.UNCLASSIFIED;
        }
        if (ClassificationTables.NOKKU_UPWARD.contains(nakshatraName)) {
            return NokkuDirection.UPWARD;
        }
        if (ClassificationTables.NOKKU_DOWNWARD.contains(nakshatraName)) {
            return NokkuDirection.DOWNWARD;
        }
        if (ClassificationTables.NOKKU_FORWARD.contains(nakshatraName)) {
            return NokkuDirection.FORWARD;
        }
        return NokkuDirection.UNCLASSIFIED;
    }
}
