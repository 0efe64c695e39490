package org.Aayush.panchang.classify;

import org.Aayush.panchang.element.PanchangNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static tables behind the classification engine.
 */
final class ClassificationTables {

    static final Set<String> NOKKU_UPWARD = Set.of(
            "Rohini", "Thiruvathirai", "Poosam", "Uthiram", "Uthiradam",
            "Thiruvonam", "Avittam", "Sadayam", "Uthirattathi"
    );
    static final Set<String> NOKKU_DOWNWARD = Set.of(
            "Bharani", "Karthigai", "Ayilyam", "Makam", "Puram",
            "Visakam", "Moolam", "Pooradam", "Poorattathi"
    );
    static final Set<String> NOKKU_FORWARD = Set.of(
            "Aswini", "Mirugasiridam", "Punarpoosam", "Hastham", "Chithirai",
            "Swathi", "Anusham", "Kettai", "Revathi"
    );

    static final List<String> AMIRTHATHI_YOGAS = List.of(
            "Ananda", "Kaladanda", "Dhumra", "Prajapati", "Saumya",
            "Dhwanksha", "Dhwaja", "Srivatsa", "Vajra", "Mudgara",
            "Chatra", "Mitra", "Manasa", "Padma", "Lumbaka",
            "Utpata", "Mrityu", "Kana", "Siddhi", "Shubha",
            "Amrita", "Musala", "Gada", "Matanga", "Rakshasa",
            "Chara", "Sthira"
    );
    static final Set<String> AMIRTHATHI_AUSPICIOUS = Set.of(
            "Ananda", "Prajapati", "Saumya", "Dhwaja", "Srivatsa", "Chatra", "Mitra",
            "Manasa", "Padma", "Siddhi", "Shubha", "Amrita", "Matanga", "Sthira"
    );
    static final Set<String> AMIRTHATHI_INAUSPICIOUS = Set.of(
            "Kaladanda", "Dhumra", "Dhwanksha", "Vajra", "Mudgara", "Lumbaka",
            "Utpata", "Mrityu", "Kana", "Musala", "Gada", "Rakshasa"
    );

    /** Sunday first; one code per nakshatra (Aswini first): A=Amrita, S=Siddha, M=Marana. */
    private static final List<String> SPECIAL_YOGA_ROWS = List.of(
            "AMSSSSSASMSAASSSSMASASSSSAS",
            "SSSAASSASSSSSMSSASSSMASSMSS",
            "ASASSMSSASSSSSSSSSSSMSSMSAS",
            "MSAAASSSSSSSASSSAMSSSSMSSSS",
            "ASSSSMAASSSSSMSSASSSSSSSMSA",
            "ASSSSSSSMSSSSSMSASSMSASSASA",
            "SSSASSSSSSMSMSASSSSSSAMSSSS"
    );

    /** 7 x 27 special-yoga grid keyed by (weekday, 0-based nakshatra). */
    static final List<List<SpecialYogaType>> SPECIAL_YOGA_GRID = parseSpecialYogaGrid();

    /** Solar month name to season; months pair up from Chithirai. */
    static final Map<String, Rutu> RUTU_BY_MONTH = rutuByMonth();

    private ClassificationTables() {
    }

    private static List<List<SpecialYogaType>> parseSpecialYogaGrid() {
        List<List<SpecialYogaType>> grid = new ArrayList<>(SPECIAL_YOGA_ROWS.size());
        for (String row : SPECIAL_YOGA_ROWS) {
            if (row.length() != PanchangNames.NAKSHATRAS.size()) {
                throw new IllegalStateException("special yoga row must cover every nakshatra: " + row);
            }
            List<SpecialYogaType> cells = new ArrayList<>(row.length());
            for (int i = 0; i < row.length(); i++) {
                cells.add(decode(row.charAt(i)));
            }
            grid.add(List.copyOf(cells));
        }
        return List.copyOf(grid);
    }

    private static SpecialYogaType decode(char code) {
        switch (code) {
            case 'A':
                return SpecialYogaType.AMRITA;
            case 'S':
                return SpecialYogaType.SIDDHA;
            case 'M':
                return SpecialYogaType.MARANA;
            default:
                throw new IllegalStateException("unknown special yoga code: " + code);
        }
    }

    private static Map<String, Rutu> rutuByMonth() {
        Rutu[] seasons = Rutu.values();
        Map<String, Rutu> byMonth = new LinkedHashMap<>();
        for (int i = 0; i < PanchangNames.SOLAR_MONTHS.size(); i++) {
            byMonth.put(PanchangNames.SOLAR_MONTHS.get(i), seasons[i / 2]);
        }
        return Collections.unmodifiableMap(byMonth);
    }
}
