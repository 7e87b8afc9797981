package com.example.structdiff.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied comparison hook, consulted before the default rules at every compared node and for
 * every added or removed map key. It must be free of side effects: it is invoked many times per diff.
 * Exceptions thrown here abort the diff.
 */
@FunctionalInterface
public interface CustomComparator {

    /**
     * @param path  location being compared
     * @param left  value in the original structure, {@code null} when the key is absent there
     * @param right value in the target structure, {@code null} when the key is absent there
     */
    Verdict compare(DiffPath path, JsonNode left, JsonNode right);
}
