package org.Aayush.panchang.classify;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The six seasons, two solar months each.
 */
@Getter
@RequiredArgsConstructor
public enum Rutu {
    VASANTHA("Vasantha Rutu", "Spring"),
    GRISHMA("Grishma Rutu", "Summer"),
    VARSHA("Varsha Rutu", "Monsoon"),
    SHARAD("Sharad Rutu", "Autumn"),
    HEMANTHA("Hemantha Rutu", "Pre-winter"),
    SHISHIRA("Shishira Rutu", "Winter");

    /** Display form, also the JSON value. */
    @JsonValue
    private final String displayName;
    private final String englishName;
}
