package org.Aayush.panchang.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.core.geo.Location;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.panchang.classify.AmirthathiYoga;
import org.Aayush.panchang.classify.Ayana;
import org.Aayush.panchang.classify.Chandrashtamam;
import org.Aayush.panchang.classify.NokkuNaal;
import org.Aayush.panchang.classify.Rutu;
import org.Aayush.panchang.classify.SpecialYoga;
import org.Aayush.panchang.division.Muhurtham;
import org.Aayush.panchang.division.NamedPeriod;
import org.Aayush.panchang.division.Window;
import org.Aayush.panchang.element.PanchangElement;
import org.Aayush.panchang.element.RasiPosition;
import org.Aayush.panchang.element.SolarMonth;
import org.Aayush.panchang.scan.ElementSegment;

import java.util.List;

/**
 * Complete panchang for one civil date, location and UTC offset.
 *
 * <p>The panchang day runs from sunrise of the civil date to the next sunrise. All elements and
 * classifications are evaluated at sunrise; transition lists cover the whole panchang day.</p>
 */
@Value
@Builder
public class PanchangReport {
    /** Civil date, {@code yyyy-MM-dd}. */
    String date;
    Location location;
    double utcOffsetHours;

    SolarMonth solarMonth;
    Rutu rutu;
    Ayana ayana;

    /** Weekday index, 0 = Sunday. */
    int weekday;
    String weekdayEnglish;
    String weekdayTamil;

    String sunrise;
    String sunset;
    String nextSunrise;
    JulianInstant sunriseInstant;
    JulianInstant sunsetInstant;
    JulianInstant nextSunriseInstant;

    PanchangElement tithi;
    PanchangElement nakshatra;
    PanchangElement yoga;
    PanchangElement karana;

    @Singular("tithiTransition")
    List<ElementSegment> tithiTransitions;
    @Singular("nakshatraTransition")
    List<ElementSegment> nakshatraTransitions;
    @Singular("yogaTransition")
    List<ElementSegment> yogaTransitions;

    RasiPosition sunRasi;
    RasiPosition moonRasi;

    Window rahuKalam;
    Window yamagandam;
    Window gulikaiKalam;
    Muhurtham dhurmuhurtham;

    @Singular("gowriDayPeriod")
    List<NamedPeriod> gowriDay;
    @Singular("gowriNightPeriod")
    List<NamedPeriod> gowriNight;
    /** Auspicious Gowri periods of day and night, in time order. */
    @Singular("nallaNeramPeriod")
    List<NamedPeriod> nallaNeram;
    /** Day horas 1-12 followed by night horas 13-24. */
    @Singular("horaPeriod")
    List<NamedPeriod> hora;

    NokkuNaal nokkuNaal;
    AmirthathiYoga amirthathiYoga;
    SpecialYoga specialYoga;
    Chandrashtamam chandrashtamam;
}
