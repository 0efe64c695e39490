package org.Aayush.panchang.element;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lunar fortnight.
 */
@Getter
@RequiredArgsConstructor
public enum Paksha {
    /** Waxing half, tithis 1-15. */
    SHUKLA("Shukla Paksha"),
    /** Waning half, tithis 16-30. */
    KRISHNA("Krishna Paksha");

    /** Display form, also the JSON value. */
    @JsonValue
    private final String displayName;
}
