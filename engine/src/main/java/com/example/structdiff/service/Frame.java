package com.example.structdiff.service;

import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.DiffPath;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Unit of work on the {@link StructuralDiffer} stack. Frames are processed in the order they were
 * planned, which is the order the changes appear in the result.
 */
record Frame(Kind kind, DiffPath path, JsonNode left, JsonNode right, List<ChangeEntry> entries, Step step) {

    enum Kind {
        /** Compare two values at a path. */
        COMPARE,
        /** Append ready-made changes. */
        EMIT,
        /** Map key present only on the left. */
        REMOVE_KEY,
        /** Map key present only on the right. */
        ADD_KEY,
        /** Sequence element dropped by an array strategy. */
        REMOVE_ELEMENT,
        /** Sequence element inserted by an array strategy. */
        ADD_ELEMENT,
        /** Planning that waits on nested jobs of the same {@link DiffRun}. */
        RESUME
    }

    /**
     * Work that needs the result of nested comparisons before it can plan its frames. It schedules
     * them with {@link DiffRun#spawn} and is resumed once they are done.
     */
    interface Step {

        /** @return the frames replacing this step, or {@code null} after scheduling a nested job */
        List<Frame> resume(DiffRun run);
    }

    static Frame compare(DiffPath path, JsonNode left, JsonNode right) {
        return new Frame(Kind.COMPARE, path, left, right, List.of(), null);
    }

    static Frame emit(List<ChangeEntry> entries) {
        return new Frame(Kind.EMIT, null, null, null, entries, null);
    }

    static Frame emit(ChangeEntry entry) {
        return emit(List.of(entry));
    }

    static Frame removeKey(DiffPath path, JsonNode value) {
        return new Frame(Kind.REMOVE_KEY, path, value, null, List.of(), null);
    }

    static Frame addKey(DiffPath path, JsonNode value) {
        return new Frame(Kind.ADD_KEY, path, null, value, List.of(), null);
    }

    static Frame removeElement(DiffPath path, JsonNode value) {
        return new Frame(Kind.REMOVE_ELEMENT, path, value, null, List.of(), null);
    }

    static Frame addElement(DiffPath path, JsonNode value) {
        return new Frame(Kind.ADD_ELEMENT, path, null, value, List.of(), null);
    }

    static Frame resume(Step step) {
        return new Frame(Kind.RESUME, null, null, null, List.of(), step);
    }
}
