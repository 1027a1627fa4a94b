package com.rackplay.solver.play;

import com.google.common.base.Preconditions;
import com.rackplay.common.config.RackplayConfig.LeftoverPolicy;

/**
 * The rules a play is scored under.
 *
 * @param noDiscard whether every leftover tile is penalized, instead of all but the most valuable one
 * @param currentLongest the longest word length to beat for the longest word bonus
 * @param currentMost the word count to beat for the most words bonus
 * @param longestBonus the points of the longest word bonus
 * @param mostBonus the points of the most words bonus
 * @param leftoverPolicy what to do with a play that leaves nothing to discard
 */
public record PlayParameters(
        boolean noDiscard,
        int currentLongest,
        int currentMost,
        int longestBonus,
        int mostBonus,
        LeftoverPolicy leftoverPolicy) {

    /** A threshold that can never be beaten. */
    public static final int NO_BONUS = Integer.MAX_VALUE;

    public static final PlayParameters DEFAULT =
            new PlayParameters(false, NO_BONUS, NO_BONUS, 0, 0, LeftoverPolicy.ALLOW_EMPTY);

    public PlayParameters {
        Preconditions.checkArgument(longestBonus >= 0, "longestBonus must not be negative");
        Preconditions.checkArgument(mostBonus >= 0, "mostBonus must not be negative");
        Preconditions.checkNotNull(leftoverPolicy, "leftoverPolicy");
    }

    /** Maps the "nobody has scored yet" value 0 to {@link #NO_BONUS}. */
    public static int threshold(final int value) {
        return value <= 0 ? NO_BONUS : value;
    }

    public PlayParameters withNoDiscard(final boolean noDiscard) {
        return new PlayParameters(
                noDiscard, this.currentLongest, this.currentMost, this.longestBonus, this.mostBonus, this.leftoverPolicy);
    }

    public PlayParameters withThresholds(final int currentLongest, final int currentMost) {
        return new PlayParameters(
                this.noDiscard, currentLongest, currentMost, this.longestBonus, this.mostBonus, this.leftoverPolicy);
    }

    public PlayParameters withBonuses(final int longestBonus, final int mostBonus) {
        return new PlayParameters(
                this.noDiscard, this.currentLongest, this.currentMost, longestBonus, mostBonus, this.leftoverPolicy);
    }

    public PlayParameters withLeftoverPolicy(final LeftoverPolicy leftoverPolicy) {
        return new PlayParameters(
                this.noDiscard, this.currentLongest, this.currentMost, this.longestBonus, this.mostBonus, leftoverPolicy);
    }
}
