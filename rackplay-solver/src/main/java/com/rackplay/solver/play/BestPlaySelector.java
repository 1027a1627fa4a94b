package com.rackplay.solver.play;

import com.rackplay.common.config.RackplayConfig.LeftoverPolicy;
import com.rackplay.common.tile.TileTable;
import com.rackplay.solver.candidate.Candidate;
import com.rackplay.solver.rack.RackCounts;
import com.rackplay.solver.rack.RackLedger;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Picks the set of non-overlapping candidates with the highest total score.
 *
 * <p>The search decides for each candidate, in order, whether to lay it or not. A branch is cut as
 * soon as its score, plus the value of every tile still on the rack, plus every bonus, cannot beat
 * the best play found so far. That bound never underestimates a completion, so the result is exact.
 */
public final class BestPlaySelector {

    private static final Comparator<Candidate> ORDER = (a, b) -> {
        int result = Double.compare(b.density(), a.density());
        if (result == 0) {
            result = Integer.compare(b.score(), a.score());
        }
        if (result == 0) {
            result = Integer.compare(b.length(), a.length());
        }
        return result;
    };

    private final TileTable table;

    @Inject
    public BestPlaySelector(final TileTable table) {
        this.table = table;
    }

    public BestPlay choose(final List<Candidate> candidates, final RackCounts rack, final PlayParameters params) {
        final List<Candidate> ordered = new ArrayList<>(candidates);
        ordered.sort(ORDER);
        final var search = new Search(ordered, new RackLedger(rack, this.table), params);
        search.visit(0);
        return search.best == null ? BestPlay.empty(rack, this.table) : search.best;
    }

    private static final class Search {

        private final List<Candidate> candidates;
        private final RackLedger ledger;
        private final PlayParameters params;
        private final int maxBonus;

        private final List<Candidate> words = new ArrayList<>();
        private int baseScore = 0;
        private int longest = 0;

        private @Nullable BestPlay best = null;

        private Search(final List<Candidate> candidates, final RackLedger ledger, final PlayParameters params) {
            this.candidates = candidates;
            this.ledger = ledger;
            this.params = params;
            this.maxBonus = params.longestBonus() + params.mostBonus();
        }

        private void visit(final int index) {
            final var bound = this.baseScore + this.ledger.remainingValue() + this.maxBonus;
            if (this.best != null && bound <= this.best.totalScore()) {
                return;
            }

            if (index == this.candidates.size()) {
                this.evaluate();
                return;
            }

            final var candidate = this.candidates.get(index);
            if (this.ledger.fits(candidate.usage())) {
                this.ledger.apply(candidate.usage(), RackLedger.Direction.COMMIT);
                this.words.add(candidate);
                final var previousLongest = this.longest;
                this.longest = Math.max(this.longest, candidate.length());
                this.baseScore += candidate.score();

                this.visit(index + 1);

                this.baseScore -= candidate.score();
                this.longest = previousLongest;
                this.words.remove(this.words.size() - 1);
                this.ledger.apply(candidate.usage(), RackLedger.Direction.ROLLBACK);
            }

            this.visit(index + 1);
        }

        private void evaluate() {
            final var remainingCount = this.ledger.totalRemainingCount();
            if (!this.params.noDiscard()
                    && remainingCount == 0
                    && this.params.leftoverPolicy() == LeftoverPolicy.REQUIRE_DISCARD) {
                return;
            }

            final var remainingValue = this.ledger.remainingValue();
            final var leftovers = this.ledger.listRemainingTiles();
            final int penalty;
            final String discard;
            if (this.params.noDiscard()) {
                penalty = remainingValue;
                discard = null;
            } else {
                discard = this.ledger.bestDiscardCandidate();
                penalty = discard == null ? remainingValue : remainingValue - this.ledger.pointsOf(discard);
                if (discard != null) {
                    leftovers.remove(discard);
                }
            }

            final var bonus = new BestPlay.Bonus(
                    this.longest > this.params.currentLongest() ? this.params.longestBonus() : 0,
                    this.words.size() > this.params.currentMost() ? this.params.mostBonus() : 0);
            final var total = Math.max(this.baseScore - penalty, 0) + bonus.total();

            if (this.best == null || total > this.best.totalScore()) {
                this.best = new BestPlay(
                        this.words,
                        this.baseScore,
                        penalty,
                        discard,
                        leftovers,
                        this.longest,
                        this.words.size(),
                        bonus,
                        total);
            }
        }
    }
}
