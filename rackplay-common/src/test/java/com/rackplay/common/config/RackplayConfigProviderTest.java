package com.rackplay.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackplay.common.frequency.CommonWordGate;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class RackplayConfigProviderTest {

    @TempDir
    Path directory;

    @Test
    void missing_file_gives_defaults() {
        final var config = new RackplayConfigProvider(this.directory).get();
        assertThat(config.game().maxWordLength()).isEqualTo(10);
        assertThat(config.game().minWordLength()).isEqualTo(2);
        assertThat(config.game().longestWordBonus()).isEqualTo(10);
        assertThat(config.game().mostWordsBonus()).isEqualTo(10);
        assertThat(config.game().leftoverPolicy()).isEqualTo(RackplayConfig.LeftoverPolicy.ALLOW_EMPTY);
        assertThat(config.dictionary().wordList()).isNull();
        assertThat(config.frequency().mode()).isEqualTo(CommonWordGate.Mode.ZIPF);
        assertThat(config.oracle().endpoint()).isEqualTo(RackplayConfig.OracleConfig.FREE_DICTIONARY_ENDPOINT);
        assertThat(config.oracle().maxRefinements()).isEqualTo(5);
    }

    @Test
    void partial_file_keeps_defaults_for_missing_fields() throws IOException {
        Files.writeString(this.directory.resolve(RackplayConfigProvider.FILE_NAME), """
                {
                  "game": { "maxWordLength": 8, "mostWordsBonus": 0, "leftoverPolicy": "REQUIRE_DISCARD" },
                  "dictionary": { "wordList": "words.txt" },
                  "frequency": { "mode": "BOTH", "topK": 500 }
                }
                """);

        final var config = new RackplayConfigProvider(this.directory).get();
        assertThat(config.game().maxWordLength()).isEqualTo(8);
        assertThat(config.game().minWordLength()).isEqualTo(2);
        assertThat(config.game().longestWordBonus()).isEqualTo(10);
        assertThat(config.game().mostWordsBonus()).isZero();
        assertThat(config.game().leftoverPolicy()).isEqualTo(RackplayConfig.LeftoverPolicy.REQUIRE_DISCARD);
        assertThat(config.dictionary().wordList()).isEqualTo("words.txt");
        assertThat(config.frequency().mode()).isEqualTo(CommonWordGate.Mode.BOTH);
        assertThat(config.frequency().minZipf()).isEqualTo(3.8);
        assertThat(config.frequency().topK()).isEqualTo(500);
        assertThat(config.oracle().timeoutSeconds()).isEqualTo(8);
    }

    @Test
    void frequency_section_defaults_a_missing_mode() {
        final var frequency = new RackplayConfig.FrequencyConfig(null, 0, 0);
        assertThat(frequency.mode()).isEqualTo(CommonWordGate.Mode.ZIPF);
        assertThat(frequency.minZipf()).isEqualTo(3.8);
        assertThat(frequency.topK()).isEqualTo(10_000);
    }

    @Test
    void malformed_file_is_rejected() throws IOException {
        Files.writeString(this.directory.resolve(RackplayConfigProvider.FILE_NAME), "{ \"game\": [");
        assertThatThrownBy(() -> new RackplayConfigProvider(this.directory).get())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(RackplayConfigProvider.FILE_NAME);
    }
}
