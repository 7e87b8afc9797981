package com.example.structdiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location inside a compared structure.
 * <p>
 * In text mode the path renders as {@code a.b[2].c} using the configured delimiter; in token mode it is
 * the raw list of keys ({@code String}) and indices ({@code Integer}) so that it can index back into
 * the original structure. A path never mixes the two modes.
 * <p>
 * Token paths are equal when their tokens are; text paths when their text and delimiter are.
 */
public final class DiffPath {

    /** Index token used while measuring similarity. */
    public static final String WILDCARD = "*";

    private final boolean tokenMode;
    private final String delimiter;
    private final String text;
    private final List<Object> tokens;

    private DiffPath(boolean tokenMode, String delimiter, String text, List<Object> tokens) {
        this.tokenMode = tokenMode;
        this.delimiter = delimiter;
        this.text = text;
        this.tokens = tokens;
    }

    public static DiffPath root(ComparisonOptions options) {
        return new DiffPath(options.isArrayPath(), options.getDelimiter(), "", List.of());
    }

    public static DiffPath ofText(String text, String delimiter) {
        return new DiffPath(false, delimiter, text, List.of());
    }

    public static DiffPath ofTokens(Object... tokens) {
        List<Object> list = new ArrayList<>();
        Collections.addAll(list, tokens);
        return new DiffPath(true, ".", "", Collections.unmodifiableList(list));
    }

    public DiffPath appendKey(String key) {
        if (tokenMode) return withToken(key);
        return new DiffPath(false, delimiter, text.isEmpty() ? key : text + delimiter + key, tokens);
    }

    public DiffPath appendIndex(int index) {
        if (tokenMode) return withToken(index);
        return new DiffPath(false, delimiter, text + "[" + index + "]", tokens);
    }

    public DiffPath appendWildcard() {
        if (tokenMode) return withToken(WILDCARD);
        return new DiffPath(false, delimiter, text + "[" + WILDCARD + "]", tokens);
    }

    private DiffPath withToken(Object token) {
        List<Object> next = new ArrayList<>(tokens.size() + 1);
        next.addAll(tokens);
        next.add(token);
        return new DiffPath(true, delimiter, "", Collections.unmodifiableList(next));
    }

    public boolean isTokenMode() { return tokenMode; }

    public boolean isRoot() { return tokenMode ? tokens.isEmpty() : text.isEmpty(); }

    /** Rendered text; only meaningful in text mode. */
    public String asText() {
        if (tokenMode) throw new IllegalStateException("Path is in token mode: " + tokens);
        return text;
    }

    /** Raw key/index tokens; only meaningful in token mode. */
    public List<Object> asTokens() {
        if (!tokenMode) throw new IllegalStateException("Path is in text mode: " + text);
        return tokens;
    }

    /** External form: the text, or the token list. */
    @JsonValue
    public Object value() {
        return tokenMode ? tokens : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffPath)) return false;
        DiffPath other = (DiffPath) o;
        if (tokenMode != other.tokenMode) return false;
        return tokenMode
                ? tokens.equals(other.tokens)
                : text.equals(other.text) && delimiter.equals(other.delimiter);
    }

    @Override
    public int hashCode() {
        return tokenMode ? Objects.hash(true, tokens) : Objects.hash(false, text, delimiter);
    }

    @Override
    public String toString() {
        return tokenMode ? tokens.toString() : text;
    }
}
