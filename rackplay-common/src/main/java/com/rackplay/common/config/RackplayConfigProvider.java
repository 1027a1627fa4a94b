package com.rackplay.common.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Provider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RackplayConfigProvider implements Provider<RackplayConfig> {

    public static final String FILE_NAME = "rackplay.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(RackplayConfigProvider.class);

    private final Path directory;

    @Inject
    public RackplayConfigProvider(final @Named("directory") Path directory) {
        this.directory = directory;
    }

    @Override
    public RackplayConfig get() {
        final var file = this.directory.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            LOGGER.info("No {} found in {}, using defaults", FILE_NAME, this.directory.toAbsolutePath());
            return new RackplayConfig();
        }
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final var config = new Gson().fromJson(reader, RackplayConfig.class);
            return config == null ? new RackplayConfig() : config;
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        } catch (final JsonParseException e) {
            throw new IllegalStateException("Malformed configuration file " + file, e);
        }
    }
}
