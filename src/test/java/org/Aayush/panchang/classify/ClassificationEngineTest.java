package org.Aayush.panchang.classify;

import org.Aayush.panchang.division.AuspiciousClass;
import org.Aayush.panchang.element.PanchangNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Classification Engine Tests")
class ClassificationEngineTest {

    // ========== Nokku Naal ==========

    @Test
    @DisplayName("Nokku groups partition all 27 nakshatras into three groups of nine")
    void testNokkuPartition() {
        Map<NokkuDirection, Integer> counts = new EnumMap<>(NokkuDirection.class);
        for (String nakshatra : PanchangNames.NAKSHATRAS) {
            NokkuNaal nokku = ClassificationEngine.nokkuNaal(nakshatra);
            counts.merge(nokku.getDirection(), 1, Integer::sum);
        }
        assertEquals(9, counts.get(NokkuDirection.UPWARD));
        assertEquals(9, counts.get(NokkuDirection.DOWNWARD));
        assertEquals(9, counts.get(NokkuDirection.FORWARD));
        assertEquals(null, counts.get(NokkuDirection.UNCLASSIFIED));
    }

    @ParameterizedTest
    @CsvSource({
            "Rohini, UPWARD, Mel Nokku Naal",
            "Bharani, DOWNWARD, Keezh Nokku Naal",
            "Revathi, FORWARD, Sama Nokku Naal",
            "Pluto, UNCLASSIFIED, Unclassified"
    })
    void testNokkuLookup(String nakshatra, NokkuDirection direction, String label) {
        NokkuNaal nokku = ClassificationEngine.nokkuNaal(nakshatra);
        assertEquals(nakshatra, nokku.getNakshatra());
        assertEquals(direction, nokku.getDirection());
        assertEquals(label, nokku.getLabel());
        assertEquals(direction.getGuidance(), nokku.getGuidance());
    }

    @Test
    void testNokkuNullNameIsUnclassified() {
        assertEquals(NokkuDirection.UNCLASSIFIED, ClassificationEngine.nokkuNaal(null).getDirection());
    }

    // ========== Amirthathi ==========

    @ParameterizedTest
    @CsvSource({
            "0, 1, 0, Ananda, AUSPICIOUS",
            "1, 2, 2, Dhumra, INAUSPICIOUS",
            "6, 27, 5, Dhwanksha, INAUSPICIOUS",
            "0, 26, 25, Chara, NEUTRAL",
            "6, 21, 26, Sthira, AUSPICIOUS"
    })
    void testAmirthathiYoga(int weekday, int nakshatraNumber, int index, String name, AuspiciousClass auspiciousClass) {
        AmirthathiYoga yoga = ClassificationEngine.amirthathiYoga(weekday, nakshatraNumber);
        assertEquals(index, yoga.getIndex());
        assertEquals(name, yoga.getName());
        assertEquals(auspiciousClass, yoga.getAuspiciousClass());
    }

    @Test
    void testAmirthathiClassOfUnknownNameIsNeutral() {
        assertEquals(AuspiciousClass.NEUTRAL, ClassificationEngine.amirthathiClass("Unknown"));
    }

    // ========== Special Yoga ==========

    @Test
    @DisplayName("Special yoga grid is total over weekdays and nakshatras")
    void testSpecialYogaTotal() {
        Map<SpecialYogaType, Integer> counts = new EnumMap<>(SpecialYogaType.class);
        for (int weekday = 0; weekday < 7; weekday++) {
            for (int nakshatra = 0; nakshatra < 27; nakshatra++) {
                SpecialYoga yoga = ClassificationEngine.specialYoga(weekday, nakshatra);
                assertEquals(yoga.getType().getLocalName(), yoga.getName());
                counts.merge(yoga.getType(), 1, Integer::sum);
            }
        }
        assertEquals(34, counts.get(SpecialYogaType.AMRITA));
        assertEquals(134, counts.get(SpecialYogaType.SIDDHA));
        assertEquals(21, counts.get(SpecialYogaType.MARANA));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0, AMRITA, Amirtha Yogam, Highly Auspicious",
            "0, 1, MARANA, Marana Yogam, Inauspicious",
            "1, 1, SIDDHA, Siddha Yogam, Auspicious",
            "3, 0, MARANA, Marana Yogam, Inauspicious"
    })
    void testSpecialYogaLookup(int weekday, int nakshatraIndex, SpecialYogaType type, String name, String severity) {
        SpecialYoga yoga = ClassificationEngine.specialYoga(weekday, nakshatraIndex);
        assertEquals(type, yoga.getType());
        assertEquals(name, yoga.getName());
        assertEquals(severity, yoga.getSeverity());
        assertTrue(yoga.getColor().startsWith("#"));
    }

    @Test
    void testSpecialYogaOutOfRangeIsDefect() {
        assertThrows(AssertionError.class, () -> ClassificationEngine.specialYoga(7, 0));
        assertThrows(AssertionError.class, () -> ClassificationEngine.specialYoga(0, 27));
    }

    // ========== Chandrashtamam ==========

    @ParameterizedTest
    @CsvSource({
            "0, 0, 7, Vrischika, 7, Poosam",
            "11, 26, 6, Tula, 6, Punarpoosam",
            "5, 20, 0, Mesha, 0, Aswini"
    })
    void testChandrashtamam(int rasi, int nakshatra, int rasiIndex, String rasiName, int nakshatraIndex, String nakshatraName) {
        Chandrashtamam result = ClassificationEngine.chandrashtamam(rasi, nakshatra);
        assertEquals(rasi, result.getCurrentRasiIndex());
        assertEquals(nakshatra, result.getCurrentNakshatraIndex());
        assertEquals(rasiIndex, result.getRasiIndex());
        assertEquals(rasiName, result.getRasi());
        assertEquals(nakshatraIndex, result.getNakshatraIndex());
        assertEquals(nakshatraName, result.getNakshatra());
        assertTrue(result.getDescription().contains(rasiName));
    }

    // ========== Ayana / Rutu ==========

    @ParameterizedTest
    @CsvSource({
            "269.999, DAKSHINAYANA",
            "270.0, UTTARAYANA",
            "0.0, UTTARAYANA",
            "89.999, UTTARAYANA",
            "90.0, DAKSHINAYANA",
            "-45.0, UTTARAYANA"
    })
    void testAyana(double sunLongitude, Ayana expected) {
        assertEquals(expected, ClassificationEngine.ayana(sunLongitude));
    }

    @ParameterizedTest
    @CsvSource({
            "Chithirai, VASANTHA",
            "Vaikasi, VASANTHA",
            "Aani, GRISHMA",
            "Aavani, VARSHA",
            "Aippasi, SHARAD",
            "Margazhi, HEMANTHA",
            "Thai, HEMANTHA",
            "Panguni, SHISHIRA"
    })
    void testRutu(String month, Rutu expected) {
        assertEquals(expected, ClassificationEngine.rutu(month));
    }

    @Test
    void testRutuUnknownMonthIsDefect() {
        assertThrows(AssertionError.class, () -> ClassificationEngine.rutu("Smarch"));
    }
}
