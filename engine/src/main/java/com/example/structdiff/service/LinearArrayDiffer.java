package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional sequence diff, linear in the array length. Arrays of different lengths are aligned both
 * from the front and from the back; the candidate with fewer changes wins, the front one on a tie.
 */
@Slf4j
class LinearArrayDiffer implements ArrayDiffStrategy {

    @Override
    public List<Frame> plan(DiffPath path, ArrayNode left, ArrayNode right, ComparisonOptions options) {
        if (left.size() == right.size() || left.isEmpty() || right.isEmpty()) {
            return forwards(path, left, right);
        }
        return List.of(Frame.resume(new Candidates(path, left, right)));
    }

    /** Runs both alignments as nested jobs, then emits the smaller result. */
    private final class Candidates implements Frame.Step {

        private final DiffPath path;
        private final ArrayNode left;
        private final ArrayNode right;
        private List<ChangeEntry> front;
        private List<ChangeEntry> back;

        private Candidates(DiffPath path, ArrayNode left, ArrayNode right) {
            this.path = path;
            this.left = left;
            this.right = right;
        }

        @Override
        public List<Frame> resume(DiffRun run) {
            if (front == null) {
                run.spawn(forwards(path, left, right), false, out -> front = out);
                return null;
            }
            if (back == null) {
                run.spawn(backwards(path, left, right), false, out -> back = out);
                return null;
            }
            log.debug("Linear diff at '{}': {} changes forwards, {} backwards", path, front.size(), back.size());
            return List.of(Frame.emit(front.size() > back.size() ? back : front));
        }
    }

    /** Shared prefix compared in place, remaining tail added or removed. */
    List<Frame> forwards(DiffPath path, ArrayNode left, ArrayNode right) {
        int min = Math.min(left.size(), right.size());
        List<Frame> frames = new ArrayList<>();

        for (int i = 0; i < min; i++) {
            frames.add(Frame.compare(path.appendIndex(i), left.get(i), right.get(i)));
        }
        for (int i = left.size() - 1; i >= min; i--) {
            frames.add(Frame.removeElement(path.appendIndex(i), left.get(i)));
        }
        for (int i = min; i < right.size(); i++) {
            frames.add(Frame.addElement(path.appendIndex(i), right.get(i)));
        }
        return frames;
    }

    /** Shared suffix compared in place, remaining head added or removed. */
    List<Frame> backwards(DiffPath path, ArrayNode left, ArrayNode right) {
        int shiftLeft = Math.max(right.size() - left.size(), 0);
        int shiftRight = Math.max(left.size() - right.size(), 0);
        int end = Math.max(left.size(), right.size());
        List<Frame> frames = new ArrayList<>();

        for (int i = Math.max(shiftLeft, shiftRight); i < end; i++) {
            int leftIndex = i - shiftLeft;
            frames.add(Frame.compare(path.appendIndex(leftIndex), left.get(leftIndex), right.get(i - shiftRight)));
        }
        for (int i = 0; i < shiftLeft; i++) {
            frames.add(Frame.addElement(path.appendIndex(i), right.get(i)));
        }
        for (int i = shiftRight - 1; i >= 0; i--) {
            frames.add(Frame.removeElement(path.appendIndex(i), left.get(i)));
        }
        return frames;
    }
}
