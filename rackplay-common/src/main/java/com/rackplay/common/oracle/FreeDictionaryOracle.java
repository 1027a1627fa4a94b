package com.rackplay.common.oracle;

import com.google.common.base.Preconditions;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.rackplay.common.lifecycle.LifecycleListener;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks words against a Free Dictionary style endpoint, where {@code GET <endpoint>/<word>} answers
 * 200 with a JSON array of entries, or 404 when the word is unknown.
 */
public final class FreeDictionaryOracle implements WordOracle, LifecycleListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(FreeDictionaryOracle.class);

    private final OkHttpClient http;
    private final HttpUrl endpoint;
    private final Map<String, CompletableFuture<Status>> cache = new ConcurrentHashMap<>();

    public FreeDictionaryOracle(final OkHttpClient http, final HttpUrl endpoint) {
        this.http = Preconditions.checkNotNull(http, "http");
        this.endpoint = Preconditions.checkNotNull(endpoint, "endpoint");
    }

    @Override
    public CompletableFuture<OracleVerdict> checkBatch(final List<String> words) {
        final Set<String> unique = new LinkedHashSet<>();
        for (final var word : words) {
            final var normalized = word.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        final List<String> order = new ArrayList<>(unique);
        final List<CompletableFuture<Boolean>> lookups = new ArrayList<>();
        for (final var word : order) {
            lookups.add(this.isValid(word));
        }
        return CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    final Set<String> valid = new HashSet<>();
                    final Set<String> invalid = new HashSet<>();
                    for (int i = 0; i < order.size(); i++) {
                        (lookups.get(i).join() ? valid : invalid).add(order.get(i));
                    }
                    return new OracleVerdict(valid, invalid);
                });
    }

    /** Looks up a single normalized word, sharing the in-flight request with concurrent callers. */
    public CompletableFuture<Boolean> isValid(final String word) {
        final var pending = this.cache.computeIfAbsent(word, this::fetch);
        return pending.thenApply(status -> {
            if (status == Status.UNAVAILABLE) {
                // Only definitive answers are kept, a later call may succeed
                this.cache.remove(word, pending);
            }
            return status != Status.NOT_FOUND;
        });
    }

    @Override
    public void onRackplayExit() {
        this.cache.clear();
    }

    private CompletableFuture<Status> fetch(final String word) {
        final var future = new CompletableFuture<Status>();
        final var url = this.endpoint.newBuilder().addPathSegment(word).build();
        final var request = new Request.Builder().url(url).get().build();
        this.http.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(final Call call, final IOException e) {
                LOGGER.warn("Dictionary lookup of {} failed, assuming it is valid: {}", word, e.toString());
                future.complete(Status.UNAVAILABLE);
            }

            @Override
            public void onResponse(final Call call, final Response response) {
                try (response) {
                    future.complete(classify(word, response));
                } catch (final RuntimeException | IOException e) {
                    LOGGER.warn("Unreadable dictionary response for {}, assuming it is valid", word, e);
                    future.complete(Status.UNAVAILABLE);
                }
            }
        });
        return future;
    }

    private static Status classify(final String word, final Response response) throws IOException {
        if (response.code() == 404) {
            return Status.NOT_FOUND;
        }
        if (!response.isSuccessful()) {
            LOGGER.warn("Dictionary lookup of {} answered {}, assuming it is valid", word, response.code());
            return Status.UNAVAILABLE;
        }
        final var body = response.body();
        if (body == null) {
            return Status.NOT_FOUND;
        }
        try {
            final var json = JsonParser.parseString(body.string());
            return json.isJsonArray() && !json.getAsJsonArray().isEmpty() ? Status.FOUND : Status.NOT_FOUND;
        } catch (final JsonParseException e) {
            LOGGER.warn("Malformed dictionary response for {}, assuming it is valid", word);
            return Status.UNAVAILABLE;
        }
    }

    private enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }
}
