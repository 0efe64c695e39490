package org.Aayush.panchang.format;

/**
 * Output formats for a rendered panchang report.
 */
public enum ResponseFormat {
    /** Human-readable report with section headings. */
    MARKDOWN,
    /** Structured snake_case JSON of the full report. */
    JSON
}
