package org.Aayush.panchang.division;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The eight Gowri Panchangam period names with their fixed classification.
 */
@Getter
@RequiredArgsConstructor
public enum GowriPeriod {
    AMIRDHA("Amirdha", AuspiciousClass.AUSPICIOUS),
    UTHI("Uthi", AuspiciousClass.AUSPICIOUS),
    LAABAM("Laabam", AuspiciousClass.AUSPICIOUS),
    DHANAM("Dhanam", AuspiciousClass.AUSPICIOUS),
    SUGAM("Sugam", AuspiciousClass.AUSPICIOUS),
    SORAM("Soram", AuspiciousClass.INAUSPICIOUS),
    ROGAM("Rogam", AuspiciousClass.INAUSPICIOUS),
    VISHAM("Visham", AuspiciousClass.INAUSPICIOUS);

    private final String displayName;
    private final AuspiciousClass auspiciousClass;
}
