package org.Aayush.panchang.testutil;

import org.Aayush.core.geo.Location;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.panchang.ephemeris.EphemerisPort;
import org.Aayush.panchang.ephemeris.RiseSet;
import org.Aayush.panchang.ephemeris.SiderealPositions;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic ephemeris for tests: Sun and Moon move linearly, the Sun rises every day at the same
 * UT hour and stays up for a fixed number of hours regardless of location.
 */
public final class SyntheticEphemeris implements EphemerisPort {
    private final double epochJulianDay;
    private final double sunAtEpoch;
    private final double moonAtEpoch;
    private final double sunDegreesPerDay;
    private final double moonDegreesPerDay;
    private final double sunriseUtHour;
    private final double daylightHours;
    private final AtomicInteger positionCalls = new AtomicInteger();
    private final AtomicInteger riseSetCalls = new AtomicInteger();

    public SyntheticEphemeris(
            double epochJulianDay,
            double sunAtEpoch,
            double moonAtEpoch,
            double sunDegreesPerDay,
            double moonDegreesPerDay,
            double sunriseUtHour,
            double daylightHours
    ) {
        this.epochJulianDay = epochJulianDay;
        this.sunAtEpoch = sunAtEpoch;
        this.moonAtEpoch = moonAtEpoch;
        this.sunDegreesPerDay = sunDegreesPerDay;
        this.moonDegreesPerDay = moonDegreesPerDay;
        this.sunriseUtHour = sunriseUtHour;
        this.daylightHours = daylightHours;
    }

    /**
     * Fixture anchored at sunrise of 2024-01-15 in IST (06:15 local, 00:45 UT), twelve hours of
     * daylight.
     *
     * <p>At sunrise: Sun 270.5 (Thai, Makara), Moon 13.81 (Bharani, Mesha), elongation 103.31
     * (Shukla Navami). Sun moves 1 degree/day and Moon 13 degrees/day, so tithi, nakshatra and yoga
     * each change exactly once before the next sunrise, away from minute sample points.</p>
     */
    public static SyntheticEphemeris chennaiJanuary15() {
        return new SyntheticEphemeris(SUNRISE_2024_01_15, 270.5d, 13.81d, 1.0d, 13.0d, 0.75d, 12.0d);
    }

    /** Julian day of 2024-01-15T00:45:00Z. */
    public static final double SUNRISE_2024_01_15 = 2_460_324.53125d;

    @Override
    public SiderealPositions positionsAt(JulianInstant instant) {
        positionCalls.incrementAndGet();
        double elapsed = instant.getJulianDay() - epochJulianDay;
        return SiderealPositions.of(
                sunAtEpoch + sunDegreesPerDay * elapsed,
                moonAtEpoch + moonDegreesPerDay * elapsed
        );
    }

    @Override
    public RiseSet sunRiseSet(JulianInstant approximateInstant, Location location) {
        riseSetCalls.incrementAndGet();
        double jd = approximateInstant.getJulianDay();
        double utMidnight = Math.floor(jd - 0.5d) + 0.5d;
        double sunrise = utMidnight + sunriseUtHour / 24.0d;
        if (sunrise < jd) {
            sunrise += 1.0d;
        }
        return new RiseSet(JulianInstant.of(sunrise), JulianInstant.of(sunrise + daylightHours / 24.0d));
    }

    public int positionCalls() {
        return positionCalls.get();
    }

    public int riseSetCalls() {
        return riseSetCalls.get();
    }
}
