package com.phototrack.photo;

import org.apache.commons.imaging.common.RationalNumber;

/**
 * Decimal degrees as EXIF degree/minute/second rationals.
 * Seconds keep two decimals, truncated: deg/1 min/1 (sec*100)/100.
 */
public final class Sexagesimal {

    private Sexagesimal() {
    }

    public static RationalNumber[] toRationals(double decimalDegrees) {
        double value = Math.abs(decimalDegrees);
        int degrees = (int) value;
        double minutesExact = (value - degrees) * 60;
        int minutes = (int) minutesExact;
        double seconds = (minutesExact - minutes) * 60;
        return new RationalNumber[]{
            new RationalNumber(degrees, 1),
            new RationalNumber(minutes, 1),
            new RationalNumber((int) (seconds * 100), 100)
        };
    }

    public static RationalNumber altitude(double meters) {
        return new RationalNumber((int) (Math.abs(meters) * 100), 100);
    }
}
