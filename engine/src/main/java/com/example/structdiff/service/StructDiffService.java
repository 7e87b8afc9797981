package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.CustomComparator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for structural diffs.
 * <p>
 * Inputs may be {@link JsonNode} trees or plain Java values (maps, lists, scalars, beans), which are
 * converted with the configured {@link ObjectMapper}. A Java {@code null} is the JSON null.
 */
@Slf4j
@Service
public class StructDiffService {

    /** Similarities tried by {@link #bestDiff}, in order of preference. */
    static final double[] BEST_DIFF_SIMILARITIES = {0.3, 0.5, 0.8};

    private final ObjectMapper mapper;
    private final ComparisonOptions defaults;
    private final StructuralDiffer differ = new StructuralDiffer();

    public StructDiffService(ObjectMapper mapper, ComparisonOptions defaults) {
        this.mapper = mapper;
        this.defaults = defaults.validate();
    }

    public ComparisonOptions defaults() { return defaults; }

    /* ========== DIFF ========== */

    public List<ChangeEntry> diff(Object left, Object right) {
        return diff(left, right, defaults);
    }

    public List<ChangeEntry> diff(Object left, Object right, ComparisonOptions options) {
        return differ.diff(toTree(left), toTree(right), options);
    }

    public List<ChangeEntry> diff(Object left, Object right, ComparisonOptions options, CustomComparator comparator) {
        return diff(left, right, options.withComparator(comparator));
    }

    /* ========== BEST DIFF ========== */

    public List<ChangeEntry> bestDiff(Object left, Object right) {
        return bestDiff(left, right, defaults);
    }

    public List<ChangeEntry> bestDiff(Object left, Object right, ComparisonOptions options, CustomComparator comparator) {
        return bestDiff(left, right, options.withComparator(comparator));
    }

    /**
     * Runs the diff at each similarity of {@link #BEST_DIFF_SIMILARITIES}, every other option unchanged,
     * and keeps the smallest result. On a tie the lower similarity wins.
     */
    public List<ChangeEntry> bestDiff(Object left, Object right, ComparisonOptions options) {
        options.validate();
        JsonNode l = toTree(left);
        JsonNode r = toTree(right);

        List<ChangeEntry> best = null;
        double bestSimilarity = 0;
        for (double similarity : BEST_DIFF_SIMILARITIES) {
            List<ChangeEntry> candidate = differ.diff(l, r, options.withSimilarity(similarity));
            log.debug("Best diff candidate at similarity {}: {} changes", similarity, countChanges(candidate));
            if (best == null || countChanges(candidate) < countChanges(best)) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        log.debug("Best diff kept similarity {} with {} changes", bestSimilarity, countChanges(best));
        return best;
    }

    /** Score used to rank candidate diffs: the number of change entries. */
    public static int countChanges(List<ChangeEntry> changes) {
        return changes.size();
    }

    private JsonNode toTree(Object value) {
        if (value instanceof JsonNode) return (JsonNode) value;
        return mapper.valueToTree(value);
    }
}
