package com.rackplay.solver;

/**
 * Per-request knobs of {@link RackOptimizer#optimize(String, OptimizeOptions)}.
 *
 * @param noDiscard penalize every leftover tile
 * @param commonOnly only offer words the frequency list considers common
 * @param shortWordOverride admit every two and three letter word when {@code commonOnly} is set
 * @param minZipf the Zipf threshold of the common word filter, 0 to use the configured one
 * @param currentLongest the longest word to beat, 0 when nobody has played yet
 * @param currentMost the word count to beat, 0 when nobody has played yet
 * @param verifyOnline check the chosen words against the online dictionary
 */
public record OptimizeOptions(
        boolean noDiscard,
        boolean commonOnly,
        boolean shortWordOverride,
        double minZipf,
        int currentLongest,
        int currentMost,
        boolean verifyOnline) {

    public static final OptimizeOptions DEFAULT = new OptimizeOptions(false, false, false, 0, 0, 0, false);

    public OptimizeOptions withNoDiscard(final boolean noDiscard) {
        return new OptimizeOptions(
                noDiscard, commonOnly, shortWordOverride, minZipf, currentLongest, currentMost, verifyOnline);
    }

    public OptimizeOptions withCommonOnly(final boolean shortWordOverride, final double minZipf) {
        return new OptimizeOptions(noDiscard, true, shortWordOverride, minZipf, currentLongest, currentMost, verifyOnline);
    }

    public OptimizeOptions withThresholds(final int currentLongest, final int currentMost) {
        return new OptimizeOptions(
                noDiscard, commonOnly, shortWordOverride, minZipf, currentLongest, currentMost, verifyOnline);
    }

    public OptimizeOptions withVerifyOnline(final boolean verifyOnline) {
        return new OptimizeOptions(
                noDiscard, commonOnly, shortWordOverride, minZipf, currentLongest, currentMost, verifyOnline);
    }
}
