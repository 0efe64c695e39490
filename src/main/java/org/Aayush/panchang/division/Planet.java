package org.Aayush.panchang.division;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Hora rulers, declared in Chaldean order (slowest to fastest).
 */
@Getter
@RequiredArgsConstructor
public enum Planet {
    SATURN("Saturn", "Sani", AuspiciousClass.INAUSPICIOUS),
    JUPITER("Jupiter", "Guru", AuspiciousClass.AUSPICIOUS),
    MARS("Mars", "Sevvai", AuspiciousClass.INAUSPICIOUS),
    SUN("Sun", "Suriyan", AuspiciousClass.NEUTRAL),
    VENUS("Venus", "Sukkiran", AuspiciousClass.AUSPICIOUS),
    MERCURY("Mercury", "Budhan", AuspiciousClass.AUSPICIOUS),
    MOON("Moon", "Chandran", AuspiciousClass.AUSPICIOUS);

    /** Chaldean sequence; successive horas advance one step, wrapping after the Moon. */
    public static final List<Planet> CHALDEAN_ORDER = List.of(values());

    private final String englishName;
    private final String tamilName;
    private final AuspiciousClass auspiciousClass;
}
