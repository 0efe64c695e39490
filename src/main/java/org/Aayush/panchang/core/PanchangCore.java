package org.Aayush.panchang.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.geo.Location;
import org.Aayush.core.table.StaticTables;
import org.Aayush.core.time.AstroTime;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.core.time.TimeContext;
import org.Aayush.panchang.classify.ClassificationEngine;
import org.Aayush.panchang.division.DayDivisionEngine;
import org.Aayush.panchang.division.NamedPeriod;
import org.Aayush.panchang.element.AngularElementCalculator;
import org.Aayush.panchang.element.ElementKind;
import org.Aayush.panchang.element.PanchangElement;
import org.Aayush.panchang.element.PanchangNames;
import org.Aayush.panchang.element.RasiPosition;
import org.Aayush.panchang.element.SolarMonth;
import org.Aayush.panchang.ephemeris.EphemerisException;
import org.Aayush.panchang.ephemeris.EphemerisPort;
import org.Aayush.panchang.ephemeris.PositionQuery;
import org.Aayush.panchang.ephemeris.RiseSet;
import org.Aayush.panchang.ephemeris.SiderealPositions;
import org.Aayush.panchang.scan.ElementSegment;
import org.Aayush.panchang.scan.TransitionScanner;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Panchang orchestration entry point.
 *
 * <p>The facade validates input before any ephemeris call, then builds one report. Execution flow:</p>
 * <ul>
 * <li>Validate date, coordinates and UTC offset; reject with {@code P01_*} reason codes.</li>
 * <li>Resolve the sunrise-bounded day: sunrise and sunset searched from local midnight of the civil
 * date, next sunrise searched from the following local midnight.</li>
 * <li>Evaluate sidereal longitudes at sunrise and derive elements, month, rasi, ayana and rutu.</li>
 * <li>Divide daylight and night into the named periods.</li>
 * <li>Run the classifications on the sunrise elements.</li>
 * <li>Scan tithi, nakshatra and yoga transitions from sunrise to next sunrise.</li>
 * </ul>
 *
 * <p>Any ephemeris failure aborts the request with {@code P02_*}; no partial report is returned.
 * The facade holds no mutable state and is safe for concurrent use.</p>
 */
@Slf4j
public final class PanchangCore implements PanchangService {
    public static final String REASON_REQUEST_REQUIRED = "P01_REQUEST_REQUIRED";
    public static final String REASON_DATE_REQUIRED = "P01_DATE_REQUIRED";
    public static final String REASON_DATE_MALFORMED = "P01_DATE_MALFORMED";
    public static final String REASON_DATE_OUT_OF_RANGE = "P01_DATE_OUT_OF_RANGE";
    public static final String REASON_LOCATION_REQUIRED = "P01_LOCATION_REQUIRED";
    public static final String REASON_LATITUDE_OUT_OF_RANGE = "P01_LATITUDE_OUT_OF_RANGE";
    public static final String REASON_LONGITUDE_OUT_OF_RANGE = "P01_LONGITUDE_OUT_OF_RANGE";
    public static final String REASON_UTC_OFFSET_OUT_OF_RANGE = "P01_UTC_OFFSET_OUT_OF_RANGE";
    public static final String REASON_EPHEMERIS_FAILURE = "P02_EPHEMERIS_FAILURE";
    public static final String REASON_EPHEMERIS_UNDEFINED = "P02_EPHEMERIS_UNDEFINED";
    public static final String REASON_REPORT_RENDERING_FAILED = "P03_REPORT_RENDERING_FAILED";

    private final EphemerisPort ephemeris;
    private final PanchangRuntimeConfig config;
    private final Clock clock;
    private final TransitionScanner scanner;

    /**
     * Creates the panchang facade.
     *
     * @param ephemeris position and rise/set collaborator.
     * @param config optional runtime config; defaults apply when {@code null}.
     * @param clock optional clock for {@link #today}; system UTC when {@code null}.
     */
    @Builder
    public PanchangCore(EphemerisPort ephemeris, PanchangRuntimeConfig config, Clock clock) {
        this.ephemeris = Objects.requireNonNull(ephemeris, "ephemeris");
        this.config = (config == null ? PanchangRuntimeConfig.defaults() : config).validate();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.scanner = new TransitionScanner(new GuardedPositions(), this.config.getBoundaryRefinement());
    }

    /**
     * Computes one report from a client request.
     *
     * @throws PanchangCoreException when the request is invalid or the ephemeris fails.
     */
    @Override
    public PanchangReport compute(PanchangRequest request) {
        if (request == null) {
            throw new PanchangCoreException(REASON_REQUEST_REQUIRED, "panchang request must be provided");
        }
        LocalDate civilDate = parseDate(request.getDate());
        double utcOffsetHours = request.getUtcOffsetHours() == null
                ? config.getDefaultUtcOffsetHours()
                : request.getUtcOffsetHours();
        if (request.getLatitude() == null || request.getLongitude() == null) {
            throw new PanchangCoreException(REASON_LOCATION_REQUIRED, "latitude and longitude must be provided");
        }
        Location location = Location.of(request.getLatitude(), request.getLongitude());
        validateCoordinates(location);
        return compute(civilDate, location, utcOffsetHours);
    }

    /**
     * Computes one report for a civil date.
     *
     * @throws PanchangCoreException when the input is invalid or the ephemeris fails.
     */
    @Override
    public PanchangReport compute(LocalDate civilDate, Location location, double utcOffsetHours) {
        validate(civilDate, location, utcOffsetHours);
        TimeContext timeContext = new TimeContext(civilDate, utcOffsetHours);

        RiseSet today = riseSet(timeContext.localMidnight(), location);
        RiseSet tomorrow = riseSet(timeContext.nextLocalMidnight(), location);
        JulianInstant sunrise = today.getSunrise();
        JulianInstant sunset = today.getSunset();
        JulianInstant nextSunrise = tomorrow.getSunrise();
        if (!nextSunrise.isAfter(sunset)) {
            throw undefined("next sunrise " + nextSunrise.getJulianDay()
                    + " does not follow sunset " + sunset.getJulianDay());
        }
        log.debug("Panchang day {} at {}: sunrise={} sunset={} nextSunrise={}",
                civilDate, location, timeContext.label(sunrise), timeContext.label(sunset),
                timeContext.label(nextSunrise));

        SiderealPositions positions = positionsAt(sunrise);
        double sunLongitude = positions.getSunLongitude();
        double moonLongitude = positions.getMoonLongitude();
        PanchangElement tithi = AngularElementCalculator.tithi(sunLongitude, moonLongitude);
        PanchangElement nakshatra = AngularElementCalculator.nakshatra(moonLongitude);
        PanchangElement yoga = AngularElementCalculator.yoga(sunLongitude, moonLongitude);
        PanchangElement karana = AngularElementCalculator.karana(sunLongitude, moonLongitude);
        SolarMonth solarMonth = AngularElementCalculator.solarMonth(sunLongitude);
        RasiPosition sunRasi = AngularElementCalculator.rasi(sunLongitude);
        RasiPosition moonRasi = AngularElementCalculator.rasi(moonLongitude);

        int weekday = timeContext.weekday();
        List<NamedPeriod> gowriDay = DayDivisionEngine.gowriDay(sunrise, sunset, weekday, timeContext);
        List<NamedPeriod> gowriNight = DayDivisionEngine.gowriNight(sunrise, sunset, nextSunrise, weekday, timeContext);
        List<NamedPeriod> gowriAll = new ArrayList<>(gowriDay);
        gowriAll.addAll(gowriNight);

        PanchangReport report = PanchangReport.builder()
                .date(civilDate.toString())
                .location(location)
                .utcOffsetHours(utcOffsetHours)
                .solarMonth(solarMonth)
                .rutu(ClassificationEngine.rutu(solarMonth.getName()))
                .ayana(ClassificationEngine.ayana(sunLongitude))
                .weekday(weekday)
                .weekdayEnglish(StaticTables.at(PanchangNames.WEEKDAYS_ENGLISH, weekday, "weekdaysEnglish"))
                .weekdayTamil(StaticTables.at(PanchangNames.WEEKDAYS_TAMIL, weekday, "weekdaysTamil"))
                .sunrise(timeContext.label(sunrise))
                .sunset(timeContext.label(sunset))
                .nextSunrise(timeContext.label(nextSunrise))
                .sunriseInstant(sunrise)
                .sunsetInstant(sunset)
                .nextSunriseInstant(nextSunrise)
                .tithi(tithi)
                .nakshatra(nakshatra)
                .yoga(yoga)
                .karana(karana)
                .tithiTransitions(scan(ElementKind.TITHI, sunrise, nextSunrise, timeContext))
                .nakshatraTransitions(scan(ElementKind.NAKSHATRA, sunrise, nextSunrise, timeContext))
                .yogaTransitions(scan(ElementKind.YOGA, sunrise, nextSunrise, timeContext))
                .sunRasi(sunRasi)
                .moonRasi(moonRasi)
                .rahuKalam(DayDivisionEngine.rahuKalam(sunrise, sunset, weekday, timeContext))
                .yamagandam(DayDivisionEngine.yamagandam(sunrise, sunset, weekday, timeContext))
                .gulikaiKalam(DayDivisionEngine.gulikaiKalam(sunrise, sunset, weekday, timeContext))
                .dhurmuhurtham(DayDivisionEngine.dhurmuhurtham(sunrise, sunset, weekday, timeContext))
                .gowriDay(gowriDay)
                .gowriNight(gowriNight)
                .nallaNeram(DayDivisionEngine.nallaNeram(gowriAll))
                .hora(DayDivisionEngine.hora(sunrise, sunset, nextSunrise, weekday, timeContext))
                .nokkuNaal(ClassificationEngine.nokkuNaal(nakshatra.getName()))
                .amirthathiYoga(ClassificationEngine.amirthathiYoga(weekday, nakshatra.getNumber()))
                .specialYoga(ClassificationEngine.specialYoga(weekday, nakshatra.getNumber() - 1))
                .chandrashtamam(ClassificationEngine.chandrashtamam(moonRasi.getIndex(), nakshatra.getNumber() - 1))
                .build();

        log.debug("Panchang {} ready: tithi={} nakshatra={} yoga={}",
                civilDate, tithi.getName(), nakshatra.getName(), yoga.getName());
        return report;
    }

    /**
     * Computes the report for the current civil date at the given offset, read from the facade clock.
     */
    @Override
    public PanchangReport today(Location location, Double utcOffsetHours) {
        double offset = utcOffsetHours == null ? config.getDefaultUtcOffsetHours() : utcOffsetHours;
        validateOffset(offset);
        LocalDate civilDate = LocalDate.ofInstant(clock.instant(), AstroTime.toZoneOffset(offset));
        return compute(civilDate, location, offset);
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            throw new PanchangCoreException(REASON_DATE_REQUIRED, "date must be provided as yyyy-MM-dd");
        }
        try {
            return LocalDate.parse(date.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException ex) {
            throw new PanchangCoreException(REASON_DATE_MALFORMED, "invalid date '" + date + "', expected yyyy-MM-dd", ex);
        }
    }

    private void validate(LocalDate civilDate, Location location, double utcOffsetHours) {
        if (civilDate == null) {
            throw new PanchangCoreException(REASON_DATE_REQUIRED, "civil date must be provided");
        }
        if (!config.acceptsYear(civilDate.getYear())) {
            throw new PanchangCoreException(REASON_DATE_OUT_OF_RANGE,
                    "date " + civilDate + " outside supported years "
                            + config.getMinSupportedYear() + "-" + config.getMaxSupportedYear());
        }
        if (location == null) {
            throw new PanchangCoreException(REASON_LOCATION_REQUIRED, "location must be provided");
        }
        validateCoordinates(location);
        validateOffset(utcOffsetHours);
    }

    private void validateCoordinates(Location location) {
        if (!location.hasValidLatitude()) {
            throw new PanchangCoreException(REASON_LATITUDE_OUT_OF_RANGE,
                    "latitude " + location.getLatitude() + " outside [-90, 90]");
        }
        if (!location.hasValidLongitude()) {
            throw new PanchangCoreException(REASON_LONGITUDE_OUT_OF_RANGE,
                    "longitude " + location.getLongitude() + " outside [-180, 180]");
        }
    }

    private void validateOffset(double utcOffsetHours) {
        if (!config.acceptsUtcOffset(utcOffsetHours)) {
            throw new PanchangCoreException(REASON_UTC_OFFSET_OUT_OF_RANGE,
                    "utc offset " + utcOffsetHours + " outside ["
                            + config.getMinUtcOffsetHours() + ", " + config.getMaxUtcOffsetHours() + "]");
        }
    }

    private RiseSet riseSet(JulianInstant approximateInstant, Location location) {
        RiseSet riseSet = callEphemeris("rise/set", () -> ephemeris.sunRiseSet(approximateInstant, location));
        if (riseSet == null || riseSet.getSunrise() == null || riseSet.getSunset() == null) {
            throw undefined("rise/set query returned no result near " + approximateInstant.getJulianDay());
        }
        if (!riseSet.getSunset().isAfter(riseSet.getSunrise())) {
            throw undefined("sunset " + riseSet.getSunset().getJulianDay()
                    + " does not follow sunrise " + riseSet.getSunrise().getJulianDay());
        }
        return riseSet;
    }

    private SiderealPositions positionsAt(JulianInstant instant) {
        SiderealPositions positions = callEphemeris("position", () -> ephemeris.positionsAt(instant));
        if (positions == null) {
            throw undefined("position query returned no result at " + instant.getJulianDay());
        }
        return positions;
    }

    private List<ElementSegment> scan(
            ElementKind kind,
            JulianInstant sunrise,
            JulianInstant nextSunrise,
            TimeContext timeContext
    ) {
        return scanner.scan(kind, sunrise, nextSunrise, timeContext);
    }

    private <T> T callEphemeris(String query, Supplier<T> call) {
        try {
            return call.get();
        } catch (PanchangCoreException ex) {
            throw ex;
        } catch (EphemerisException ex) {
            log.warn("Ephemeris {} query failed ({}): {}", query, ex.getKind(), ex.getMessage());
            throw new PanchangCoreException(REASON_EPHEMERIS_FAILURE,
                    "ephemeris " + query + " query failed (" + ex.getKind() + "): " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            log.warn("Ephemeris {} query failed: {}", query, ex.toString());
            throw new PanchangCoreException(REASON_EPHEMERIS_FAILURE,
                    "ephemeris " + query + " query failed: " + ex, ex);
        }
    }

    private static PanchangCoreException undefined(String message) {
        log.warn("Ephemeris returned an undefined result: {}", message);
        return new PanchangCoreException(REASON_EPHEMERIS_UNDEFINED, message);
    }

    /**
     * Position source handed to the scanner: same failure mapping as direct queries.
     */
    private final class GuardedPositions implements PositionQuery {
        @Override
        public SiderealPositions positionsAt(JulianInstant instant) {
            return PanchangCore.this.positionsAt(instant);
        }
    }
}
