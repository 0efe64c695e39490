package org.Aayush.panchang.element;

import java.util.List;

/**
 * Ordered name tables shared by the element, division and classification engines.
 */
public final class PanchangNames {

    /** Solar (Tamil) months, Chithirai first: Sun entering Mesha. */
    public static final List<String> SOLAR_MONTHS = List.of(
            "Chithirai", "Vaikasi", "Aani", "Aadi", "Aavani", "Purattasi",
            "Aippasi", "Karthigai", "Margazhi", "Thai", "Maasi", "Panguni"
    );

    public static final List<String> NAKSHATRAS = List.of(
            "Aswini", "Bharani", "Karthigai", "Rohini", "Mirugasiridam",
            "Thiruvathirai", "Punarpoosam", "Poosam", "Ayilyam", "Makam",
            "Puram", "Uthiram", "Hastham", "Chithirai", "Swathi",
            "Visakam", "Anusham", "Kettai", "Moolam", "Pooradam",
            "Uthiradam", "Thiruvonam", "Avittam", "Sadayam", "Poorattathi",
            "Uthirattathi", "Revathi"
    );

    /** Fifteen tithi names, reused by both pakshas; the last entry covers full and new moon. */
    public static final List<String> TITHIS = List.of(
            "Prathama", "Dwithiya", "Thrithiya", "Chathurthi", "Panchami",
            "Shashthi", "Sapthami", "Ashtami", "Navami", "Dasami",
            "Ekadasi", "Dwadasi", "Trayodasi", "Chaturdasi", "Pournami/Amavasya"
    );

    public static final List<String> YOGAS = List.of(
            "Vishkambha", "Priti", "Ayushman", "Saubhagya", "Shobhana",
            "Atiganda", "Sukarman", "Dhriti", "Shoola", "Ganda",
            "Vriddhi", "Dhruva", "Vyaghata", "Harshana", "Vajra",
            "Siddhi", "Vyatipata", "Variyan", "Parigha", "Shiva",
            "Siddha", "Sadhya", "Shubha", "Shukla", "Brahma",
            "Indra", "Vaidhriti"
    );

    /** Seven movable karanas followed by the four fixed ones. */
    public static final List<String> KARANAS = List.of(
            "Bava", "Balava", "Kaulava", "Taitila", "Garaja",
            "Vanija", "Vishti", "Shakuni", "Chatushpada", "Naga", "Kimstughna"
    );

    public static final List<String> RASIS = List.of(
            "Mesha", "Vrishabha", "Mithuna", "Kataka", "Simha", "Kanya",
            "Tula", "Vrischika", "Dhanus", "Makara", "Kumbha", "Meena"
    );

    /** Sunday first. */
    public static final List<String> WEEKDAYS_TAMIL = List.of(
            "Gnayiru", "Thingal", "Sevvai", "Budhan", "Viyazhan", "Velli", "Sani"
    );

    /** Sunday first. */
    public static final List<String> WEEKDAYS_ENGLISH = List.of(
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    );

    private PanchangNames() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
