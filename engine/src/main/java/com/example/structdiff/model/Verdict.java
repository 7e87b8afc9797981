package com.example.structdiff.model;

import java.util.List;
import java.util.Objects;

/** Outcome of a {@link CustomComparator}. */
public final class Verdict {

    public enum Kind {
        /** Values are equal: no change. */
        EQUAL,
        /** Values differ: one modification with both sides. */
        NOT_EQUAL,
        /** Use the supplied changes verbatim. */
        REPLACE,
        /** No opinion: fall back to the default comparison. */
        DEFER
    }

    private static final Verdict EQUAL = new Verdict(Kind.EQUAL, List.of());
    private static final Verdict NOT_EQUAL = new Verdict(Kind.NOT_EQUAL, List.of());
    private static final Verdict DEFER = new Verdict(Kind.DEFER, List.of());

    private final Kind kind;
    private final List<ChangeEntry> changes;

    private Verdict(Kind kind, List<ChangeEntry> changes) {
        this.kind = kind;
        this.changes = changes;
    }

    public static Verdict equal() { return EQUAL; }

    public static Verdict notEqual() { return NOT_EQUAL; }

    public static Verdict defer() { return DEFER; }

    public static Verdict of(boolean equal) { return equal ? EQUAL : NOT_EQUAL; }

    public static Verdict replace(List<ChangeEntry> changes) {
        return new Verdict(Kind.REPLACE, List.copyOf(Objects.requireNonNull(changes, "changes")));
    }

    public Kind kind() { return kind; }

    /** Replacement changes; empty unless {@link Kind#REPLACE}. */
    public List<ChangeEntry> changes() { return changes; }

    @Override
    public String toString() {
        return kind == Kind.REPLACE ? "REPLACE" + changes : kind.name();
    }
}
