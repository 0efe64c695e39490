package org.Aayush.panchang.element;

import lombok.Builder;
import lombok.Value;

/**
 * One evaluated tithi, nakshatra, yoga or karana.
 *
 * <p>Two elements of the same kind denote the same unit when their {@code number} is equal; the
 * transition scanner relies on that.</p>
 */
@Value
@Builder
public class PanchangElement {
    /** Element family. */
    ElementKind kind;
    /** 1-based ordinal within the element's cycle. */
    int number;
    /** Name from the element's ordered table. */
    String name;
    /** Fortnight; only set for tithi. */
    Paksha paksha;
    /** Share of the current unit still to run, in percent rounded to two decimals. */
    double remainingPercent;

    /**
     * Returns {@code true} when both elements denote the same unit of the same kind.
     */
    public boolean sameUnit(PanchangElement other) {
        return other != null && kind == other.kind && number == other.number;
    }
}
