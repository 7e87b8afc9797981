package com.example.structdiff.service;

import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.example.structdiff.model.IndexPair;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Order-preserving sequence diff built on {@link SubsequenceMatcher}. Aligned elements are compared
 * in place (at their original index); the gaps between aligned elements become removals and
 * additions, indexed by position in the array as it is being edited. Planning waits until the
 * matcher has measured every element pair.
 */
class SubsequenceArrayDiffer implements ArrayDiffStrategy {

    private final SubsequenceMatcher matcher;

    SubsequenceArrayDiffer(SubsequenceMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public List<Frame> plan(DiffPath path, ArrayNode left, ArrayNode right, ComparisonOptions options) {
        List<Frame> frames = new ArrayList<>();
        if (left.isEmpty() && right.isEmpty()) return frames;

        if (left.isEmpty()) {
            for (int i = 0; i < right.size(); i++) {
                frames.add(Frame.addElement(path.appendIndex(i), right.get(i)));
            }
            return frames;
        }
        if (right.isEmpty()) {
            for (int i = left.size() - 1; i >= 0; i--) {
                frames.add(Frame.removeElement(path.appendIndex(i), left.get(i)));
            }
            return frames;
        }

        return List.of(Frame.resume(matcher.align(path, left, right, links -> walk(path, left, right, links))));
    }

    private List<Frame> walk(DiffPath path, ArrayNode left, ArrayNode right, List<IndexPair> links) {
        List<Frame> frames = new ArrayList<>();
        for (IndexPair pair : links) {
            frames.add(Frame.compare(path.appendIndex(pair.left()), left.get(pair.left()), right.get(pair.right())));
        }

        List<IndexPair> walk = new ArrayList<>(links);
        walk.add(new IndexPair(left.size(), right.size()));

        int lastLeft = -1;
        int lastRight = -1;
        for (IndexPair pair : walk) {
            // tail first, so that earlier positions stay valid
            for (int i = pair.left() - lastLeft - 2; i >= 0; i--) {
                frames.add(Frame.removeElement(path.appendIndex(lastRight + i + 1), left.get(lastLeft + i + 1)));
            }
            for (int i = 0; i <= pair.right() - lastRight - 2; i++) {
                frames.add(Frame.addElement(path.appendIndex(lastRight + i + 1), right.get(lastRight + i + 1)));
            }
            lastLeft = pair.left();
            lastRight = pair.right();
        }
        return frames;
    }
}
