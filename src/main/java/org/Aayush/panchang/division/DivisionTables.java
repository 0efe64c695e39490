package org.Aayush.panchang.division;

import java.util.List;

import static org.Aayush.panchang.division.GowriPeriod.AMIRDHA;
import static org.Aayush.panchang.division.GowriPeriod.DHANAM;
import static org.Aayush.panchang.division.GowriPeriod.LAABAM;
import static org.Aayush.panchang.division.GowriPeriod.ROGAM;
import static org.Aayush.panchang.division.GowriPeriod.SORAM;
import static org.Aayush.panchang.division.GowriPeriod.SUGAM;
import static org.Aayush.panchang.division.GowriPeriod.UTHI;
import static org.Aayush.panchang.division.GowriPeriod.VISHAM;

/**
 * Weekday-indexed tables for the day-division engine. Every table is Sunday first.
 */
final class DivisionTables {

    /** Which of the 8 daylight parts (1-based) is Rahu Kalam. */
    static final int[] RAHU_KALAM_POSITIONS = {8, 2, 7, 5, 6, 4, 3};
    /** Which of the 8 daylight parts (1-based) is Yamagandam. */
    static final int[] YAMAGANDAM_POSITIONS = {5, 4, 3, 2, 1, 7, 6};
    /** Which of the 8 daylight parts (1-based) is Gulikai Kalam. */
    static final int[] GULIKAI_POSITIONS = {7, 6, 5, 4, 3, 2, 1};
    /** Which of the 30 daylight parts (1-based) is Dhurmuhurtham. */
    static final int[] DHURMUHURTHAM_POSITIONS = {27, 17, 7, 15, 23, 17, 1};

    static final List<List<GowriPeriod>> GOWRI_DAY = List.of(
            List.of(UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM, SORAM, VISHAM),
            List.of(AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM, SORAM, VISHAM, UTHI),
            List.of(ROGAM, LAABAM, DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA),
            List.of(LAABAM, DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM),
            List.of(DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM),
            List.of(SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM),
            List.of(SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM)
    );

    static final List<List<GowriPeriod>> GOWRI_NIGHT = List.of(
            List.of(DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM),
            List.of(VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM, SORAM),
            List.of(ROGAM, LAABAM, DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA),
            List.of(SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM),
            List.of(UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM, SORAM, VISHAM),
            List.of(LAABAM, DHANAM, SUGAM, SORAM, VISHAM, UTHI, AMIRDHA, ROGAM),
            List.of(SORAM, VISHAM, UTHI, AMIRDHA, ROGAM, LAABAM, DHANAM, SUGAM)
    );

    /** Lord of the first daylight hora: the weekday's own planet. */
    static final List<Planet> HORA_DAY_RULERS = List.of(
            Planet.SUN, Planet.MOON, Planet.MARS, Planet.MERCURY, Planet.JUPITER, Planet.VENUS, Planet.SATURN
    );

    private DivisionTables() {
    }
}
