package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * State of one diff call: a stack of jobs, each with its own frame stack.
 * <p>
 * Similarity checks and linear candidates run as nested jobs on top of the job that asked for them,
 * so nesting in the input grows these stacks and never the call stack. Without a custom comparator
 * the equality of two subtrees does not depend on where they sit, and answers are kept per node pair
 * until the call returns.
 */
final class DiffRun {

    private final StructuralDiffer differ;
    private final ComparisonOptions options;
    private final boolean memo;
    private final Deque<Job> jobs = new ArrayDeque<>();
    private final Map<JsonNode, Map<JsonNode, Boolean>> equal = new IdentityHashMap<>();
    private final Map<JsonNode, Map<JsonNode, Boolean>> similar = new IdentityHashMap<>();

    DiffRun(StructuralDiffer differ, ComparisonOptions options) {
        this.differ = differ;
        this.options = options;
        this.memo = options.getComparator() == null;
    }

    ComparisonOptions options() { return options; }

    List<ChangeEntry> execute(List<Frame> initial) {
        Job root = new Job(false, null);
        pushAll(root.frames, initial);
        jobs.push(root);

        while (!jobs.isEmpty()) {
            Job job = jobs.peek();
            if (job.frames.isEmpty() || (job.probe && !job.out.isEmpty())) {
                jobs.pop();
                if (job.done != null) job.done.accept(job.out);
                continue;
            }
            Frame frame = job.frames.pop();
            List<Frame> next = differ.process(frame, this, job.out);
            if (next == null) job.frames.push(frame);
            else pushAll(job.frames, next);
        }
        return root.out;
    }

    /**
     * Schedules {@code frames} as a job that runs before the current one continues. A probe job stops
     * as soon as it has produced a change, so {@code done} only learns whether its list is empty.
     */
    void spawn(List<Frame> frames, boolean probe, Consumer<List<ChangeEntry>> done) {
        Job job = new Job(probe, done);
        pushAll(job.frames, frames);
        jobs.push(job);
    }

    /**
     * Whether the diff of two values at {@code path} is empty.
     *
     * @return the answer when already known, otherwise {@code null}; a probe job is then scheduled and
     *         reports to {@code done}
     */
    Boolean equal(DiffPath path, JsonNode left, JsonNode right, Consumer<Boolean> done) {
        Boolean known = knownEqual(left, right);
        if (known != null) return known;

        spawn(List.of(Frame.compare(path, left, right)), true, out -> {
            rememberEqual(left, right, out.isEmpty());
            done.accept(out.isEmpty());
        });
        return null;
    }

    Boolean knownEqual(JsonNode left, JsonNode right) {
        if (!memo) return null;
        if (left == right) return Boolean.TRUE;
        return lookup(equal, left, right);
    }

    void rememberEqual(JsonNode left, JsonNode right, boolean value) {
        if (memo) equal.computeIfAbsent(left, k -> new IdentityHashMap<>()).put(right, value);
    }

    Boolean knownSimilar(JsonNode left, JsonNode right) {
        return memo ? lookup(similar, left, right) : null;
    }

    void rememberSimilar(JsonNode left, JsonNode right, boolean value) {
        if (memo) similar.computeIfAbsent(left, k -> new IdentityHashMap<>()).put(right, value);
    }

    private static Boolean lookup(Map<JsonNode, Map<JsonNode, Boolean>> cache, JsonNode left, JsonNode right) {
        Map<JsonNode, Boolean> row = cache.get(left);
        return row == null ? null : row.get(right);
    }

    private static void pushAll(Deque<Frame> stack, List<Frame> frames) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            stack.push(frames.get(i));
        }
    }

    private static final class Job {
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final List<ChangeEntry> out = new ArrayList<>();
        private final boolean probe;
        private final Consumer<List<ChangeEntry>> done;

        private Job(boolean probe, Consumer<List<ChangeEntry>> done) {
            this.probe = probe;
            this.done = done;
        }
    }
}
