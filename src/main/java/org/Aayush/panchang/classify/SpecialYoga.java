package org.Aayush.panchang.classify;

import lombok.Value;

/**
 * Special yoga resolved for one weekday and nakshatra.
 */
@Value
public class SpecialYoga {
    SpecialYogaType type;
    String name;
    String severity;
    String description;
    String color;
}
