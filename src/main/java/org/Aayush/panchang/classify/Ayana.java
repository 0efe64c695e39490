package org.Aayush.panchang.classify;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Solar half-year.
 */
@Getter
@RequiredArgsConstructor
public enum Ayana {
    /** Sun's northward course: sidereal longitude in [270, 360) or [0, 90). */
    UTTARAYANA("Uttarayana"),
    /** Sun's southward course: sidereal longitude in [90, 270). */
    DAKSHINAYANA("Dakshinayana");

    /** Display form, also the JSON value. */
    @JsonValue
    private final String displayName;
}
