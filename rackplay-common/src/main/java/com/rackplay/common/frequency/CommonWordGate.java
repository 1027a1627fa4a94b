package com.rackplay.common.frequency;

import com.google.common.base.Preconditions;

/** Decides whether a plain word is common enough to be offered as a candidate. */
public sealed interface CommonWordGate {

    CommonWordGate ANY = Any.INSTANCE;

    boolean admits(final String word);

    enum Mode {
        /** The Zipf score must reach the threshold. */
        ZIPF,
        /** The rank must be within the top K. */
        RANK,
        EITHER,
        BOTH
    }

    enum Any implements CommonWordGate {
        INSTANCE;

        @Override
        public boolean admits(final String word) {
            return true;
        }
    }

    /**
     * Admits a word if its lemma is frequent enough. Two and three letter words may bypass the lookup
     * since short common words are often missing from frequency lists. Unknown lemmas are rejected.
     */
    record Frequency(
            FrequencyCorpus corpus,
            Lemmatizer lemmatizer,
            Mode mode,
            double minZipf,
            int topK,
            boolean shortWordOverride)
            implements CommonWordGate {

        public Frequency {
            Preconditions.checkNotNull(corpus, "corpus");
            Preconditions.checkNotNull(lemmatizer, "lemmatizer");
            Preconditions.checkNotNull(mode, "mode");
        }

        @Override
        public boolean admits(final String word) {
            if (this.shortWordOverride && word.length() >= 2 && word.length() <= 3) {
                return true;
            }
            final var entry = this.corpus.lookup(this.lemmatizer.lemma(word)).orElse(null);
            if (entry == null) {
                return false;
            }
            final var frequent = entry.zipf() >= this.minZipf;
            final var ranked = entry.rank() <= this.topK;
            return switch (this.mode) {
                case ZIPF -> frequent;
                case RANK -> ranked;
                case EITHER -> frequent || ranked;
                case BOTH -> frequent && ranked;
            };
        }
    }
}
