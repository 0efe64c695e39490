package org.Aayush.panchang.element;

import lombok.Value;

/**
 * Sidereal sign occupied by a body.
 */
@Value
public class RasiPosition {
    /** Sidereal longitude rounded to two decimals. */
    double longitude;
    /** 0-based sign index, Mesha = 0. */
    int index;
    String name;
}
