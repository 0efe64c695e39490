package org.Aayush.panchang.division;

import lombok.Builder;
import lombok.Value;

/**
 * Window carrying a period identity, used for Gowri Panchangam and Hora entries.
 */
@Value
@Builder
public class NamedPeriod {
    /** 1-based position in its list (1-8 for Gowri, 1-24 for Hora). */
    int index;
    String name;
    /** Tamil name; equal to {@code name} when the period is already named in Tamil. */
    String localName;
    AuspiciousClass auspiciousClass;
    Window window;

    public boolean isAuspicious() {
        return auspiciousClass == AuspiciousClass.AUSPICIOUS;
    }
}
