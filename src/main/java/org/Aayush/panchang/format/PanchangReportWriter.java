package org.Aayush.panchang.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.panchang.core.PanchangCore;
import org.Aayush.panchang.core.PanchangCoreException;
import org.Aayush.panchang.core.PanchangReport;
import org.Aayush.panchang.division.NamedPeriod;
import org.Aayush.panchang.division.Window;
import org.Aayush.panchang.element.PanchangElement;
import org.Aayush.panchang.scan.ElementSegment;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link PanchangReport} as JSON or Markdown.
 *
 * <p>JSON property names are the snake_case form of the report's fields and form the stable
 * contract for transport layers. Instances are immutable and thread-safe.</p>
 */
@Slf4j
public final class PanchangReportWriter {
    private final ObjectMapper objectMapper;

    public PanchangReportWriter() {
        this(defaultObjectMapper());
    }

    /**
     * Creates a writer over a caller-configured mapper.
     */
    public PanchangReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Returns the mapper settings used for report JSON.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Renders the report in the requested format.
     *
     * @throws PanchangCoreException with {@code P03_REPORT_RENDERING_FAILED} when JSON serialization fails.
     */
    public String write(PanchangReport report, ResponseFormat format) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(format, "format");
        switch (format) {
            case JSON:
                return toJson(report);
            case MARKDOWN:
                return toMarkdown(report);
            default:
                throw new IllegalArgumentException("unsupported format: " + format);
        }
    }

    /**
     * Serializes the report to pretty-printed snake_case JSON.
     */
    public String toJson(PanchangReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            log.warn("Report JSON rendering failed for {}: {}", report.getDate(), ex.getOriginalMessage());
            throw new PanchangCoreException(PanchangCore.REASON_REPORT_RENDERING_FAILED,
                    "failed to render panchang report for " + report.getDate() + " as JSON", ex);
        }
    }

    /**
     * Renders the report as Markdown.
     */
    public String toMarkdown(PanchangReport report) {
        StringBuilder out = new StringBuilder(2048);
        out.append("# Tamil Panchang for ").append(report.getDate()).append("\n\n");
        out.append(String.format(Locale.ROOT, "**Location:** %.4f, %.4f\n",
                report.getLocation().getLatitude(), report.getLocation().getLongitude()));
        out.append("**Timezone:** UTC").append(formatOffset(report.getUtcOffsetHours())).append("\n\n");

        out.append("## Panchang Elements\n\n");
        bullet(out, "Weekday", report.getWeekdayEnglish() + " (" + report.getWeekdayTamil() + ")");
        bullet(out, "Tamil Month", report.getSolarMonth().getName()
                + " (" + report.getRutu().getDisplayName() + ", " + report.getAyana().getDisplayName() + ")");
        bullet(out, "Tithi", element(report.getTithi())
                + " - " + report.getTithi().getPaksha().getDisplayName());
        bullet(out, "Nakshatra", element(report.getNakshatra()));
        bullet(out, "Yoga", element(report.getYoga()));
        bullet(out, "Karana", element(report.getKarana()));
        bullet(out, "Sun Rasi", report.getSunRasi().getName());
        bullet(out, "Moon Rasi", report.getMoonRasi().getName());
        out.append('\n');

        out.append("## Transitions\n\n");
        transitions(out, "Tithi", report.getTithiTransitions());
        transitions(out, "Nakshatra", report.getNakshatraTransitions());
        transitions(out, "Yoga", report.getYogaTransitions());
        out.append('\n');

        out.append("## Sun Timings\n\n");
        bullet(out, "Sunrise", report.getSunrise());
        bullet(out, "Sunset", report.getSunset());
        out.append('\n');

        out.append("## Inauspicious Timings\n\n");
        out.append("*Avoid these periods for important activities, new ventures, or auspicious events:*\n\n");
        bullet(out, "Rahu Kalam", window(report.getRahuKalam()));
        bullet(out, "Yamagandam", window(report.getYamagandam()));
        bullet(out, "Gulikai Kalam", window(report.getGulikaiKalam()));
        bullet(out, "Dhurmuhurtham", window(report.getDhurmuhurtham().getWindow())
                + " (muhurtham " + report.getDhurmuhurtham().getIndex() + ")");
        out.append('\n');

        out.append("## Nalla Neram\n\n");
        for (NamedPeriod period : report.getNallaNeram()) {
            bullet(out, period.getName(), window(period.getWindow()));
        }
        out.append('\n');

        out.append("## Special Yoga\n\n");
        bullet(out, report.getSpecialYoga().getName(), report.getSpecialYoga().getSeverity()
                + " - " + report.getSpecialYoga().getDescription());
        bullet(out, "Amirthathi Yoga", report.getAmirthathiYoga().getName()
                + " (" + report.getAmirthathiYoga().getAuspiciousClass().name().toLowerCase(Locale.ROOT) + ")");
        bullet(out, report.getNokkuNaal().getLabel(), report.getNokkuNaal().getGuidance());
        out.append('\n');

        out.append("## Chandrashtamam\n\n");
        out.append("- ").append(report.getChandrashtamam().getDescription()).append('\n');
        return out.toString();
    }

    private static void transitions(StringBuilder out, String label, List<ElementSegment> segments) {
        StringBuilder line = new StringBuilder();
        for (ElementSegment segment : segments) {
            if (line.length() > 0) {
                line.append("; ");
            }
            line.append(segment.getElement().getName())
                    .append(' ')
                    .append(segment.getStartTime())
                    .append(" - ")
                    .append(segment.getEndTime());
        }
        bullet(out, label, line.toString());
    }

    private static void bullet(StringBuilder out, String label, String value) {
        out.append("- **").append(label).append(":** ").append(value).append('\n');
    }

    private static String element(PanchangElement element) {
        return String.format(Locale.ROOT, "%s (#%d, %.2f%% remaining)",
                element.getName(), element.getNumber(), element.getRemainingPercent());
    }

    private static String window(Window window) {
        return window.getStartTime() + " - " + window.getEndTime();
    }

    private static String formatOffset(double hours) {
        int totalMinutes = (int) Math.round(Math.abs(hours) * 60.0d);
        return String.format(Locale.ROOT, "%s%02d:%02d", hours < 0 ? "-" : "+", totalMinutes / 60, totalMinutes % 60);
    }
}
