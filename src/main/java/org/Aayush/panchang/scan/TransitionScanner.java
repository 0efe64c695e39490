package org.Aayush.panchang.scan;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.time.AstroTime;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.core.time.TimeContext;
import org.Aayush.panchang.element.ElementKind;
import org.Aayush.panchang.element.PanchangElement;
import org.Aayush.panchang.ephemeris.PositionQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the ordered timeline of one element kind over an interval by fixed-step sampling.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Evaluate the element at the interval start and open a segment there.</li>
 * <li>Advance in steps of one minute ({@code 1/1440} day) while strictly before the interval end.</li>
 * <li>On a change of element number, close the open segment at the detecting sample (or at the
 * bisected crossing when refinement is enabled) and open the next one.</li>
 * <li>Close the last segment at the interval end.</li>
 * </ul>
 *
 * <p>Segments are contiguous: each segment's end is the next one's start, and together they cover
 * the interval exactly. Instances are immutable and thread-safe.</p>
 */
@Slf4j
public final class TransitionScanner {
    /** Fixed sampling step: one minute. */
    public static final double STEP_DAYS = 1.0d / AstroTime.MINUTES_PER_DAY;

    private static final double BISECTION_RESOLUTION_DAYS = 1.0d / AstroTime.SECONDS_PER_DAY;

    private final PositionQuery positions;
    private final BoundaryRefinement refinement;

    /**
     * Creates a scanner with the one-minute baseline (no refinement).
     */
    public TransitionScanner(PositionQuery positions) {
        this(positions, BoundaryRefinement.NONE);
    }

    /**
     * Creates a scanner.
     *
     * @param positions sidereal position source.
     * @param refinement boundary placement mode.
     */
    public TransitionScanner(PositionQuery positions, BoundaryRefinement refinement) {
        this.positions = Objects.requireNonNull(positions, "positions");
        this.refinement = Objects.requireNonNull(refinement, "refinement");
    }

    /**
     * Scans {@code [start, end]} for one element kind.
     *
     * @param kind element kind to track.
     * @param start interval start, usually sunrise.
     * @param end interval end, usually next sunrise.
     * @param timeContext civil reference used for the time-of-day labels.
     * @return immutable list of at least one segment, in time order.
     */
    public List<ElementSegment> scan(ElementKind kind, JulianInstant start, JulianInstant end, TimeContext timeContext) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(timeContext, "timeContext");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("scan interval must be non-empty: " + start + " .. " + end);
        }

        List<ElementSegment> segments = new ArrayList<>();
        PanchangElement current = evaluate(kind, start);
        JulianInstant segmentStart = start;
        JulianInstant previousSample = start;

        // Offsets are recomputed from the start to avoid accumulating step error.
        for (long step = 1; ; step++) {
            JulianInstant sample = start.plusDays(step * STEP_DAYS);
            if (!sample.isBefore(end)) {
                break;
            }
            PanchangElement observed = evaluate(kind, sample);
            if (!observed.sameUnit(current)) {
                JulianInstant boundary = sample;
                PanchangElement next = observed;
                if (refinement == BoundaryRefinement.BISECTION) {
                    boundary = bisect(kind, current, previousSample, sample);
                    next = evaluate(kind, boundary);
                }
                segments.add(segment(current, segmentStart, boundary, timeContext));
                current = next;
                segmentStart = boundary;
            }
            previousSample = sample;
        }
        segments.add(segment(current, segmentStart, end, timeContext));

        log.debug("{} scan produced {} segment(s) over {} day(s)", kind, segments.size(), start.daysUntil(end));
        return Collections.unmodifiableList(segments);
    }

    /**
     * Finds the first instant in {@code (matching, differing]} whose element differs from
     * {@code tracked}, to one-second resolution.
     */
    private JulianInstant bisect(ElementKind kind, PanchangElement tracked, JulianInstant matching, JulianInstant differing) {
        JulianInstant low = matching;
        JulianInstant high = differing;
        while (low.daysUntil(high) > BISECTION_RESOLUTION_DAYS) {
            JulianInstant mid = low.plusDays(low.daysUntil(high) / 2.0d);
            if (evaluate(kind, mid).sameUnit(tracked)) {
                low = mid;
            } else {
                high = mid;
            }
        }
        return high;
    }

    private PanchangElement evaluate(ElementKind kind, JulianInstant instant) {
        return kind.evaluate(positions.positionsAt(instant));
    }

    private static ElementSegment segment(
            PanchangElement element,
            JulianInstant start,
            JulianInstant end,
            TimeContext timeContext
    ) {
        return ElementSegment.builder()
                .element(element)
                .start(start)
                .end(end)
                .startTime(timeContext.label(start))
                .endTime(timeContext.label(end))
                .build();
    }
}
