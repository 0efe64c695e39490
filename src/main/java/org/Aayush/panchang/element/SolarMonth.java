package org.Aayush.panchang.element;

import lombok.Value;

/**
 * Tamil solar month: the 30 degree sign the Sun occupies.
 */
@Value
public class SolarMonth {
    /** 0-based index, Chithirai = 0. */
    int index;
    String name;
}
