package com.example.structdiff.model;

import lombok.Builder;
import lombok.Value;

/**
 * Comparison options, all optional.
 * <p>
 * Immutable; derive variants with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ComparisonOptions {

    /** Require the same numeric representation (integral vs floating point). */
    @Builder.Default
    boolean strict = true;

    /** Minimum share of equal entries for two containers in a sequence to be aligned. */
    @Builder.Default
    double similarity = 0.8;

    @Builder.Default
    String delimiter = ".";

    /** Numbers within this distance are equal. */
    @Builder.Default
    double numericTolerance = 0.0;

    /** Trim strings before comparing. */
    @Builder.Default
    boolean strip = false;

    /** Report paths as key/index token lists instead of delimited strings. */
    @Builder.Default
    boolean arrayPath = false;

    /** Align sequences by subsequence matching; otherwise compare them position by position. */
    @Builder.Default
    boolean useLcs = true;

    /** Optional, consulted before the default comparison at every node. */
    CustomComparator comparator;

    public static ComparisonOptions defaults() {
        return ComparisonOptions.builder().build();
    }

    public ComparisonOptions withSimilarity(double value) {
        return toBuilder().similarity(value).build();
    }

    public ComparisonOptions withComparator(CustomComparator value) {
        return toBuilder().comparator(value).build();
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public ComparisonOptions validate() {
        if (Double.isNaN(similarity) || similarity <= 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be in (0, 1], got " + similarity);
        }
        if (Double.isNaN(numericTolerance) || Double.isInfinite(numericTolerance) || numericTolerance < 0.0) {
            throw new IllegalArgumentException("numericTolerance must be >= 0, got " + numericTolerance);
        }
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        return this;
    }
}
