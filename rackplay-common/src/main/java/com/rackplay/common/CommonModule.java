package com.rackplay.common;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.rackplay.common.config.RackplayConfig;
import com.rackplay.common.config.RackplayConfigProvider;
import com.rackplay.common.factory.ObjectBinder;
import com.rackplay.common.factory.ObjectModule;
import com.rackplay.common.frequency.FrequencyCorpus;
import com.rackplay.common.lifecycle.ExecutorWithLifecycle;
import com.rackplay.common.oracle.FreeDictionaryOracle;
import com.rackplay.common.oracle.WordOracle;
import com.rackplay.common.tile.TileTable;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Provider;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

public final class CommonModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(RackplayConfig.class).toProv(RackplayConfigProvider.class);
        binder.bind(TileTable.class).toProv(TileTableProvider.class);
        binder.bind(FrequencyCorpus.class).toProv(FrequencyCorpusProvider.class);
        binder.bind(OkHttpClient.class).toProv(OkHttpClientProvider.class);
        binder.bind(WordOracle.class).toProv(WordOracleProvider.class);
        binder.bind(Executor.class).named("work").toImpl(ExecutorWithLifecycle.class);
    }

    private static final class TileTableProvider implements Provider<TileTable> {

        private final RackplayConfig config;
        private final Path directory;

        @Inject
        public TileTableProvider(final RackplayConfig config, final @Named("directory") Path directory) {
            this.config = config;
            this.directory = directory;
        }

        @Override
        public TileTable get() {
            final var file = this.config.dictionary().tileTable();
            return file == null ? TileTable.defaults() : TileTable.load(this.directory.resolve(file));
        }
    }

    private static final class FrequencyCorpusProvider implements Provider<FrequencyCorpus> {

        private final RackplayConfig config;
        private final Path directory;

        @Inject
        public FrequencyCorpusProvider(final RackplayConfig config, final @Named("directory") Path directory) {
            this.config = config;
            this.directory = directory;
        }

        @Override
        public FrequencyCorpus get() {
            final var file = this.config.dictionary().frequencyList();
            return file == null ? FrequencyCorpus.EMPTY : FrequencyCorpus.load(this.directory.resolve(file));
        }
    }

    private static final class OkHttpClientProvider implements Provider<OkHttpClient> {

        private final RackplayConfig config;

        @Inject
        public OkHttpClientProvider(final RackplayConfig config) {
            this.config = config;
        }

        @Override
        public OkHttpClient get() {
            final var timeout = Duration.ofSeconds(this.config.oracle().timeoutSeconds());
            return new OkHttpClient.Builder()
                    .connectTimeout(timeout)
                    .readTimeout(timeout)
                    .callTimeout(timeout)
                    .dispatcher(new Dispatcher(Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                            .setDaemon(true)
                            .setNameFormat("rackplay-okhttp-%d")
                            .build())))
                    .build();
        }
    }

    private static final class WordOracleProvider implements Provider<WordOracle> {

        private final RackplayConfig config;
        private final OkHttpClient http;

        @Inject
        public WordOracleProvider(final RackplayConfig config, final OkHttpClient http) {
            this.config = config;
            this.http = http;
        }

        @Override
        public WordOracle get() {
            return new FreeDictionaryOracle(this.http, HttpUrl.get(this.config.oracle().endpoint()));
        }
    }
}
