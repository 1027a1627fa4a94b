package com.rackplay.solver;

import com.rackplay.common.config.RackplayConfig;
import com.rackplay.common.factory.ObjectBinder;
import com.rackplay.common.factory.ObjectModule;
import com.rackplay.common.frequency.Lemmatizer;
import com.rackplay.solver.dictionary.Dictionary;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Provider;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SolverModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(Dictionary.class).toProv(DictionaryProvider.class);
        binder.bind(Lemmatizer.class).toInst(Lemmatizer.IDENTITY);
        binder.bind(RackOptimizer.class).toImpl(RackOptimizerImpl.class);
    }

    private static final class DictionaryProvider implements Provider<Dictionary> {

        private static final Logger LOGGER = LoggerFactory.getLogger(DictionaryProvider.class);

        private final RackplayConfig config;
        private final Path directory;

        @Inject
        public DictionaryProvider(final RackplayConfig config, final @Named("directory") Path directory) {
            this.config = config;
            this.directory = directory;
        }

        @Override
        public Dictionary get() {
            final var file = this.config.dictionary().wordList();
            if (file == null) {
                LOGGER.warn("No word list configured, every rack will come back empty");
                return Dictionary.EMPTY;
            }
            return Dictionary.load(this.directory.resolve(file));
        }
    }
}
