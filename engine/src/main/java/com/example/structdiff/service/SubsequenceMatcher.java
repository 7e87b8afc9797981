package com.example.structdiff.service;

import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.example.structdiff.model.IndexPair;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Longest common subsequence of two sequences under a similarity relation instead of strict equality.
 * <p>
 * Two elements are similar when they are equal under the comparison rules, or when both are maps
 * (or both sequences) and the share of equal entries reaches {@link ComparisonOptions#getSimilarity()}.
 * Time and space are O(n·m) in the sequence lengths.
 * <p>
 * The traceback starts from the last elements. When skipping the left element and skipping the right
 * element keep the same length, it skips the left one, so among equally long alignments the earlier
 * left elements stay matched: {@code [1,2]} against {@code [2,1]} pairs the two {@code 1}s and
 * diffs as {@code +[0] 2, -[2] 2}.
 */
public class SubsequenceMatcher {

    private final StructuralDiffer differ;
    private final ValueComparator values;

    public SubsequenceMatcher(StructuralDiffer differ, ValueComparator values) {
        this.differ = differ;
        this.values = values;
    }

    /**
     * @return aligned pairs, strictly increasing on both sides
     */
    public List<IndexPair> match(DiffPath path, ArrayNode left, ArrayNode right, ComparisonOptions options) {
        Alignment alignment = new Alignment(path, left, right, pairs -> List.of());
        differ.run(List.of(Frame.resume(alignment)), options);
        return alignment.pairs;
    }

    public boolean similar(DiffPath path, JsonNode left, JsonNode right, ComparisonOptions options) {
        return measure(new Similarity(path, left, right, false), options).isSimilar();
    }

    /** Share of equal entries: keys over the union of both key sets, or positions over the longer length. */
    double score(DiffPath path, JsonNode left, JsonNode right, ComparisonOptions options) {
        return measure(new Similarity(path, left, right, true), options).score();
    }

    private Similarity measure(Similarity similarity, ComparisonOptions options) {
        differ.run(List.of(Frame.resume(run -> similarity.advance(run, values) == null ? null : List.<Frame>of())), options);
        return similarity;
    }

    /** Plans {@code then(pairs)} once every element pair has been measured. */
    Frame.Step align(DiffPath path, ArrayNode left, ArrayNode right, Function<List<IndexPair>, List<Frame>> then) {
        return new Alignment(path, left, right, then);
    }

    private final class Alignment implements Frame.Step {

        private final DiffPath element;
        private final ArrayNode left;
        private final ArrayNode right;
        private final Function<List<IndexPair>, List<Frame>> then;
        private final boolean[][] similar;

        private int i;
        private int j;
        private Similarity cell;
        private List<IndexPair> pairs = List.of();

        private Alignment(DiffPath path, ArrayNode left, ArrayNode right,
                          Function<List<IndexPair>, List<Frame>> then) {
            this.element = path.appendWildcard();
            this.left = left;
            this.right = right;
            this.then = then;
            this.similar = new boolean[left.size()][right.size()];
        }

        @Override
        public List<Frame> resume(DiffRun run) {
            int n = left.size();
            int m = right.size();
            while (m > 0 && i < n) {
                if (cell == null) cell = new Similarity(element, left.get(i), right.get(j), false);
                Boolean result = cell.advance(run, values);
                if (result == null) return null;

                similar[i][j] = result;
                cell = null;
                if (++j == m) {
                    j = 0;
                    i++;
                }
            }
            pairs = traceback(n, m);
            return then.apply(pairs);
        }

        private List<IndexPair> traceback(int n, int m) {
            int[][] length = new int[n + 1][m + 1];
            for (int a = 1; a <= n; a++) {
                for (int b = 1; b <= m; b++) {
                    length[a][b] = similar[a - 1][b - 1]
                            ? length[a - 1][b - 1] + 1
                            : Math.max(length[a - 1][b], length[a][b - 1]);
                }
            }

            List<IndexPair> found = new ArrayList<>(length[n][m]);
            int a = n;
            int b = m;
            while (a > 0 && b > 0 && length[a][b] > 0) {
                if (similar[a - 1][b - 1]) {
                    found.add(new IndexPair(a - 1, b - 1));
                    a--;
                    b--;
                } else if (length[a][b - 1] > length[a - 1][b]) {
                    b--;
                } else {
                    a--;
                }
            }
            Collections.reverse(found);
            return found;
        }
    }
}
