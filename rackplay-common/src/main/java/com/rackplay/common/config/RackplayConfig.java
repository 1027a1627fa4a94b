package com.rackplay.common.config;

import com.rackplay.common.frequency.CommonWordGate;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

public record RackplayConfig(
        GameConfig game, DictionaryConfig dictionary, FrequencyConfig frequency, OracleConfig oracle) {

    public RackplayConfig {
        game = Objects.requireNonNullElseGet(game, GameConfig::new);
        dictionary = Objects.requireNonNullElseGet(dictionary, DictionaryConfig::new);
        frequency = Objects.requireNonNullElseGet(frequency, FrequencyConfig::new);
        oracle = Objects.requireNonNullElseGet(oracle, OracleConfig::new);
    }

    public RackplayConfig() {
        this(null, null, null, null);
    }

    public enum LeftoverPolicy {
        /** A play that uses every tile is scored even when a discard is expected. */
        ALLOW_EMPTY,
        /** A play must leave at least one tile to discard when discarding is allowed. */
        REQUIRE_DISCARD
    }

    public record GameConfig(
            int maxWordLength,
            int minWordLength,
            @Nullable Integer longestWordBonus,
            @Nullable Integer mostWordsBonus,
            @Nullable LeftoverPolicy leftoverPolicy) {

        public GameConfig {
            if (maxWordLength <= 0) {
                maxWordLength = 10;
            }
            if (minWordLength <= 0) {
                minWordLength = 2;
            }
            longestWordBonus = Math.max(0, Objects.requireNonNullElse(longestWordBonus, 10));
            mostWordsBonus = Math.max(0, Objects.requireNonNullElse(mostWordsBonus, 10));
            leftoverPolicy = Objects.requireNonNullElse(leftoverPolicy, LeftoverPolicy.ALLOW_EMPTY);
        }

        public GameConfig() {
            this(10, 2, 10, 10, LeftoverPolicy.ALLOW_EMPTY);
        }
    }

    public record DictionaryConfig(
            @Nullable String wordList, @Nullable String tileTable, @Nullable String frequencyList) {

        public DictionaryConfig() {
            this(null, null, null);
        }
    }

    public record FrequencyConfig(CommonWordGate.@Nullable Mode mode, double minZipf, int topK) {

        public FrequencyConfig {
            mode = Objects.requireNonNullElse(mode, CommonWordGate.Mode.ZIPF);
            if (minZipf <= 0) {
                minZipf = 3.8;
            }
            if (topK <= 0) {
                topK = 10_000;
            }
        }

        public FrequencyConfig() {
            this(CommonWordGate.Mode.ZIPF, 3.8, 10_000);
        }
    }

    public record OracleConfig(@Nullable String endpoint, int timeoutSeconds, int maxRefinements) {

        public static final String FREE_DICTIONARY_ENDPOINT = "https://api.dictionaryapi.dev/api/v2/entries/en/";

        public OracleConfig {
            endpoint = Objects.requireNonNullElse(endpoint, FREE_DICTIONARY_ENDPOINT);
            if (timeoutSeconds <= 0) {
                timeoutSeconds = 8;
            }
            if (maxRefinements <= 0) {
                maxRefinements = 5;
            }
        }

        public OracleConfig() {
            this(FREE_DICTIONARY_ENDPOINT, 8, 5);
        }
    }
}
