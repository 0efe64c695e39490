package org.Aayush.panchang.element;

import org.Aayush.panchang.ephemeris.SiderealPositions;

/**
 * Angular panchang elements that can be evaluated from a pair of sidereal longitudes.
 */
public enum ElementKind {
    TITHI {
        @Override
        public PanchangElement evaluate(SiderealPositions positions) {
            return AngularElementCalculator.tithi(positions.getSunLongitude(), positions.getMoonLongitude());
        }
    },
    NAKSHATRA {
        @Override
        public PanchangElement evaluate(SiderealPositions positions) {
            return AngularElementCalculator.nakshatra(positions.getMoonLongitude());
        }
    },
    YOGA {
        @Override
        public PanchangElement evaluate(SiderealPositions positions) {
            return AngularElementCalculator.yoga(positions.getSunLongitude(), positions.getMoonLongitude());
        }
    },
    KARANA {
        @Override
        public PanchangElement evaluate(SiderealPositions positions) {
            return AngularElementCalculator.karana(positions.getSunLongitude(), positions.getMoonLongitude());
        }
    };

    /**
     * Evaluates this element at the given positions.
     */
    public abstract PanchangElement evaluate(SiderealPositions positions);
}
