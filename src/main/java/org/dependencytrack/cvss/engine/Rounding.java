package org.dependencytrack.cvss.engine;

public final class Rounding {

    private static final long SCALE = 10_000_000_000L;
    private static final long TENTH = SCALE / 10;

    private Rounding() {
    }

    /**
     * Rounds up to one decimal place, i.e. {@code ceil(x * 10) / 10}.
     * <p>
     * The input is first rounded to ten decimal places, which absorbs floating point noise
     * only, so that {@code 1.1 * 3} yields {@code 3.3} and not {@code 3.4} while
     * {@code 4.000001} still yields {@code 4.1}.
     *
     * @param value The value to round
     * @return The smallest multiple of {@code 0.1} that is greater than or equal to {@code value}
     */
    public static double roundUp(final double value) {
        final long intInput = Math.round(value * SCALE);
        if (intInput % TENTH == 0) {
            return intInput / (double) SCALE;
        }

        return (Math.floorDiv(intInput, TENTH) + 1) / 10.0;
    }

}
