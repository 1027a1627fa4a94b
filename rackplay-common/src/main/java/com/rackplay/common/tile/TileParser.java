package com.rackplay.common.tile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for the textual tile notation, where digraph tiles are written in parentheses, e.g.
 * {@code (qu)o(th)}.
 */
public final class TileParser {

    private static final Pattern CARD = Pattern.compile("\\([a-z]+\\)|[a-z]", Pattern.CASE_INSENSITIVE);

    private TileParser() {}

    /** Splits raw tile text into tokens, keeping the parentheses around digraphs. */
    public static List<String> parse(final CharSequence raw) {
        final List<String> tokens = new ArrayList<>();
        final var matcher = CARD.matcher(raw);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /** Splits raw tile text into normalized tokens. */
    public static List<String> parseNormalized(final CharSequence raw) {
        return parse(raw).stream().map(TileParser::normalize).toList();
    }

    /** Strips parentheses and lowercases the token. */
    public static String normalize(final String token) {
        return token.replace("(", "").replace(")", "").toLowerCase(Locale.ROOT);
    }

    public static String display(final String token) {
        return token.length() > 1 ? "(" + token + ")" : token;
    }

    public static String display(final List<String> tokens) {
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(display(token));
        }
        return builder.toString();
    }

    public static String plain(final List<String> tokens) {
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(normalize(token));
        }
        return builder.toString();
    }
}
