package com.rackplay.solver.rack;

import com.google.common.base.Preconditions;
import com.rackplay.common.tile.TileTable;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The mutable tile counts of one search. Tiles are taken when a word is committed and handed back
 * on rollback; a ledger is owned by a single search and never shared.
 *
 * <p>Slots are ordered singles first, then digraphs, each in the order of the {@link RackCounts}.
 */
public final class RackLedger {

    private static final int NO_SLOT = -1;

    private final String[] tokens;
    private final boolean[] digraph;
    private final int[] points;
    private final int[] counts;
    private final TObjectIntMap<String> slots;

    public RackLedger(final RackCounts rack, final TileTable table) {
        final int size = rack.singles().size() + rack.digraphs().size();
        this.tokens = new String[size];
        this.digraph = new boolean[size];
        this.points = new int[size];
        this.counts = new int[size];
        this.slots = new TObjectIntHashMap<>(Math.max(size, 1), 0.5F, NO_SLOT);
        int slot = 0;
        for (final var entry : rack.singles().entrySet()) {
            this.register(slot++, entry, false, table);
        }
        for (final var entry : rack.digraphs().entrySet()) {
            this.register(slot++, entry, true, table);
        }
    }

    private void register(
            final int slot, final Map.Entry<String, Integer> entry, final boolean digraph, final TileTable table) {
        Preconditions.checkArgument(entry.getValue() >= 0, "Negative count for %s", entry.getKey());
        this.tokens[slot] = entry.getKey();
        this.digraph[slot] = digraph;
        this.points[slot] = table.points(entry.getKey());
        this.counts[slot] = entry.getValue();
        this.slots.put(entry.getKey(), slot);
    }

    public enum Direction {
        /** Take the tiles off the rack. */
        COMMIT,
        /** Put the tiles back. */
        ROLLBACK
    }

    public int slots() {
        return this.tokens.length;
    }

    public String token(final int slot) {
        return this.tokens[slot];
    }

    public boolean isDigraph(final int slot) {
        return this.digraph[slot];
    }

    public int points(final int slot) {
        return this.points[slot];
    }

    public int count(final int slot) {
        return this.counts[slot];
    }

    public void take(final int slot) {
        Preconditions.checkState(this.counts[slot] > 0, "No %s tile left to take", this.tokens[slot]);
        this.counts[slot]--;
    }

    public void restore(final int slot) {
        this.counts[slot]++;
    }

    /** The summed points of every tile still on the rack. */
    public int remainingValue() {
        int total = 0;
        for (int i = 0; i < this.counts.length; i++) {
            total += this.points[i] * this.counts[i];
        }
        return total;
    }

    public int totalRemainingCount() {
        int total = 0;
        for (final var count : this.counts) {
            total += count;
        }
        return total;
    }

    public List<String> listRemainingTiles() {
        final List<String> tiles = new ArrayList<>();
        for (int i = 0; i < this.counts.length; i++) {
            for (int j = 0; j < this.counts[i]; j++) {
                tiles.add(this.tokens[i]);
            }
        }
        return tiles;
    }

    /** The most valuable tile still on the rack, the first one in slot order on ties. */
    public @Nullable String bestDiscardCandidate() {
        String best = null;
        int bestPoints = Integer.MIN_VALUE;
        for (int i = 0; i < this.counts.length; i++) {
            if (this.counts[i] > 0 && this.points[i] > bestPoints) {
                bestPoints = this.points[i];
                best = this.tokens[i];
            }
        }
        return best;
    }

    public int pointsOf(final String token) {
        final var slot = this.slots.get(token);
        return slot == NO_SLOT ? 0 : this.points[slot];
    }

    public boolean fits(final TileUsage usage) {
        return this.fits(usage.singles()) && this.fits(usage.digraphs());
    }

    private boolean fits(final Map<String, Integer> counts) {
        for (final var entry : counts.entrySet()) {
            final var slot = this.slots.get(entry.getKey());
            if (slot == NO_SLOT || this.counts[slot] < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    public void apply(final TileUsage usage, final Direction direction) {
        this.apply(usage.singles(), direction);
        this.apply(usage.digraphs(), direction);
    }

    private void apply(final Map<String, Integer> counts, final Direction direction) {
        for (final var entry : counts.entrySet()) {
            final var slot = this.slots.get(entry.getKey());
            Preconditions.checkState(slot != NO_SLOT, "Tile %s is not on this rack", entry.getKey());
            if (direction == Direction.COMMIT) {
                Preconditions.checkState(
                        this.counts[slot] >= entry.getValue(),
                        "Cannot take %s %s tiles, only %s left",
                        entry.getValue(),
                        entry.getKey(),
                        this.counts[slot]);
                this.counts[slot] -= entry.getValue();
            } else {
                this.counts[slot] += entry.getValue();
            }
        }
    }
}
