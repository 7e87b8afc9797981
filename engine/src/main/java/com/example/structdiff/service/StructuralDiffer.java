package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.example.structdiff.model.IndexPair;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Structural comparison of two JSON trees.
 * <p>
 * The traversal runs on explicit stacks rather than the call stack (see {@link DiffRun}), so the
 * depth of the input does not bound it, arrays included. Changes come out in document order; inside
 * a map that is removed keys, then the common keys (recursively), then added keys, each group sorted
 * by key.
 * <p>
 * Instances hold no per-call state and may be shared.
 */
public class StructuralDiffer {

    private final ValueComparator values;
    private final SubsequenceMatcher matcher;
    private final ArrayDiffStrategy subsequence;
    private final ArrayDiffStrategy linear;

    public StructuralDiffer() {
        this(new ValueComparator());
    }

    public StructuralDiffer(ValueComparator values) {
        this.values = values;
        this.matcher = new SubsequenceMatcher(this, values);
        this.subsequence = new SubsequenceArrayDiffer(matcher);
        this.linear = new LinearArrayDiffer();
    }

    public List<ChangeEntry> diff(JsonNode left, JsonNode right, ComparisonOptions options) {
        options.validate();
        return diff(DiffPath.root(options), left, right, options);
    }

    /** Diff rooted at {@code path}; options are assumed valid. */
    public List<ChangeEntry> diff(DiffPath path, JsonNode left, JsonNode right, ComparisonOptions options) {
        return run(List.of(Frame.compare(path, orNull(left), orNull(right))), options);
    }

    /** Order-preserving diff of two sequences, regardless of {@link ComparisonOptions#isUseLcs()}. */
    public List<ChangeEntry> diffArraySubsequence(ArrayNode left, ArrayNode right, ComparisonOptions options) {
        options.validate();
        return run(subsequence.plan(DiffPath.root(options), left, right, options), options);
    }

    /** Positional diff of two sequences, regardless of {@link ComparisonOptions#isUseLcs()}. */
    public List<ChangeEntry> diffArrayLinear(ArrayNode left, ArrayNode right, ComparisonOptions options) {
        options.validate();
        return run(linear.plan(DiffPath.root(options), left, right, options), options);
    }

    public List<IndexPair> match(ArrayNode left, ArrayNode right, ComparisonOptions options) {
        options.validate();
        return matcher.match(DiffPath.root(options), left, right, options);
    }

    List<ChangeEntry> run(List<Frame> initial, ComparisonOptions options) {
        return new DiffRun(this, options).execute(initial);
    }

    /** @return the frames to push in place of {@code frame}, or {@code null} to resume it later */
    List<Frame> process(Frame frame, DiffRun run, List<ChangeEntry> out) {
        ComparisonOptions options = run.options();
        return switch (frame.kind()) {
            case COMPARE -> compare(frame.path(), frame.left(), frame.right(), run, out);
            case EMIT -> {
                out.addAll(frame.entries());
                yield List.of();
            }
            case REMOVE_KEY -> {
                out.addAll(values.custom(frame.path(), frame.left(), null, options)
                        .orElseGet(() -> List.of(ChangeEntry.remove(frame.path(), frame.left()))));
                yield List.of();
            }
            case ADD_KEY -> {
                out.addAll(values.custom(frame.path(), null, frame.right(), options)
                        .orElseGet(() -> List.of(ChangeEntry.add(frame.path(), frame.right()))));
                yield List.of();
            }
            case REMOVE_ELEMENT -> removeElement(frame.path(), frame.left());
            case ADD_ELEMENT -> addElement(frame.path(), frame.right());
            case RESUME -> frame.step().resume(run);
        };
    }

    private List<Frame> compare(DiffPath path, JsonNode left, JsonNode right, DiffRun run, List<ChangeEntry> out) {
        ComparisonOptions options = run.options();
        Optional<List<ChangeEntry>> custom = values.custom(path, left, right, options);
        if (custom.isPresent()) {
            out.addAll(custom.get());
            return List.of();
        }
        if (Boolean.TRUE.equals(run.knownEqual(left, right))) return List.of();

        if (left.isNull() && right.isNull()) return List.of();
        if (left.isNull() || right.isNull() || !values.comparable(left, right, options)) {
            out.add(ChangeEntry.modify(path, left, right));
            return List.of();
        }

        return switch (left.getNodeType()) {
            case ARRAY -> (options.isUseLcs() ? subsequence : linear)
                    .plan(path, (ArrayNode) left, (ArrayNode) right, options);
            case OBJECT -> planObject(path, (ObjectNode) left, (ObjectNode) right);
            case BINARY, BOOLEAN, NULL, NUMBER, STRING -> {
                if (!values.equal(left, right, options)) out.add(ChangeEntry.modify(path, left, right));
                yield List.of();
            }
            case MISSING, POJO -> {
                values.reportUnsupported(path, left, right);
                if (!left.equals(right)) out.add(ChangeEntry.modify(path, left, right));
                yield List.of();
            }
        };
    }

    private List<Frame> planObject(DiffPath path, ObjectNode left, ObjectNode right) {
        TreeSet<String> deleted = new TreeSet<>();
        TreeSet<String> common = new TreeSet<>();
        TreeSet<String> added = new TreeSet<>();

        Iterator<String> it = left.fieldNames();
        while (it.hasNext()) {
            String key = it.next();
            if (right.has(key)) common.add(key);
            else deleted.add(key);
        }
        it = right.fieldNames();
        while (it.hasNext()) {
            String key = it.next();
            if (!left.has(key)) added.add(key);
        }

        List<Frame> frames = new ArrayList<>(deleted.size() + common.size() + added.size());
        for (String key : deleted) frames.add(Frame.removeKey(path.appendKey(key), left.get(key)));
        for (String key : common) frames.add(Frame.compare(path.appendKey(key), left.get(key), right.get(key)));
        for (String key : added) frames.add(Frame.addKey(path.appendKey(key), right.get(key)));
        return frames;
    }

    /** A non-empty map leaves key by key, then as an empty map. */
    private List<Frame> removeElement(DiffPath path, JsonNode value) {
        if (!value.isObject() || value.isEmpty()) {
            return List.of(Frame.emit(ChangeEntry.remove(path, value)));
        }
        ObjectNode emptied = JsonNodeFactory.instance.objectNode();
        return List.of(Frame.compare(path, value, emptied), Frame.emit(ChangeEntry.remove(path, emptied)));
    }

    /** A non-empty map arrives as an empty map, then key by key. */
    private List<Frame> addElement(DiffPath path, JsonNode value) {
        if (!value.isObject() || value.isEmpty()) {
            return List.of(Frame.emit(ChangeEntry.add(path, value)));
        }
        ObjectNode empty = JsonNodeFactory.instance.objectNode();
        return List.of(Frame.emit(ChangeEntry.add(path, empty)), Frame.compare(path, empty, value));
    }

    private static JsonNode orNull(JsonNode value) {
        return value == null ? NullNode.getInstance() : value;
    }
}
