package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.DiffPath;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Similarity of one element pair, measured one child at a time so that each nested equality check can
 * run as its own job.
 * <p>
 * Two maps score the share of keys, over the union of both key sets, whose values are equal; two
 * sequences the share of positions, over the longer length. Any other pair is similar only when equal.
 */
final class Similarity {

    private final DiffPath path;
    private final JsonNode left;
    private final JsonNode right;
    private final boolean measureOnly;
    private final boolean containers;

    private List<Check> checks;
    private int total;
    private int next;
    private int same;
    private Boolean similar;
    private double score;

    private record Check(DiffPath path, JsonNode left, JsonNode right) {}

    /**
     * @param measureOnly only compute the score: no custom comparator on the pair itself, no shared answers
     */
    Similarity(DiffPath path, JsonNode left, JsonNode right, boolean measureOnly) {
        this.path = path;
        this.left = left;
        this.right = right;
        this.measureOnly = measureOnly;
        this.containers = (left.isObject() && right.isObject()) || (left.isArray() && right.isArray());
    }

    /** @return whether the pair is similar, or {@code null} while a nested equality check is pending */
    Boolean advance(DiffRun run, ValueComparator values) {
        if (similar != null) return similar;
        if (checks == null) {
            Boolean early = start(run, values);
            if (early != null) {
                similar = early;
                score = early ? 1.0 : 0.0;
                return similar;
            }
        }
        while (next < checks.size()) {
            Check check = checks.get(next++);
            Boolean equal = run.equal(check.path(), check.left(), check.right(), this::count);
            if (equal == null) return null;
            count(equal);
        }
        similar = finish(run);
        return similar;
    }

    boolean isSimilar() { return similar; }

    double score() { return score; }

    private Boolean start(DiffRun run, ValueComparator values) {
        checks = new ArrayList<>();
        if (!containers) {
            checks.add(new Check(path, left, right));
            total = 1;
            return null;
        }

        if (!measureOnly) {
            Optional<List<ChangeEntry>> custom = values.custom(path, left, right, run.options());
            if (custom.isPresent()) return custom.get().isEmpty();
            Boolean known = run.knownSimilar(left, right);
            if (known != null) return known;
        }

        if (left.isObject()) {
            Set<String> union = new TreeSet<>();
            left.fieldNames().forEachRemaining(union::add);
            right.fieldNames().forEachRemaining(union::add);
            total = union.size();
            for (String key : union) {
                if (left.has(key) && right.has(key)) {
                    checks.add(new Check(path.appendKey(key), left.get(key), right.get(key)));
                }
            }
        } else {
            total = Math.max(left.size(), right.size());
            int shortest = Math.min(left.size(), right.size());
            for (int i = 0; i < shortest; i++) {
                checks.add(new Check(path.appendIndex(i), left.get(i), right.get(i)));
            }
        }
        return null;
    }

    private void count(boolean equal) {
        if (equal) same++;
    }

    private boolean finish(DiffRun run) {
        score = total == 0 ? 1.0 : (double) same / total;
        if (!containers) return same == total;

        boolean result = score >= run.options().getSimilarity();
        if (!measureOnly) {
            run.rememberSimilar(left, right, result);
            // every key or position equal is exactly an empty diff
            run.rememberEqual(left, right, same == total);
        }
        return result;
    }
}
