package org.Aayush.panchang.scan;

/**
 * How the transition scanner places a boundary once a change is detected between two samples.
 */
public enum BoundaryRefinement {
    /** Boundary is the first differing one-minute sample. */
    NONE,
    /** Boundary is bisected between the last matching and first differing sample, to one second. */
    BISECTION
}
