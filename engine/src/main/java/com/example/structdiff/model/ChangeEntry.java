package com.example.structdiff.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One atomic change. {@link ChangeOp#ADD} carries only the new value, {@link ChangeOp#REMOVE} only the
 * old value, {@link ChangeOp#MODIFY} both.
 * <p>
 * Serialised as {@code ["+", path, value]}, {@code ["-", path, value]} or
 * {@code ["~", path, oldValue, newValue]}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChangeEntry {

    ChangeOp op;
    DiffPath path;
    JsonNode oldValue;
    JsonNode newValue;

    public static ChangeEntry add(DiffPath path, JsonNode value) {
        return new ChangeEntry(ChangeOp.ADD, path, null, orNull(value));
    }

    public static ChangeEntry remove(DiffPath path, JsonNode value) {
        return new ChangeEntry(ChangeOp.REMOVE, path, orNull(value), null);
    }

    /** A {@code null} side is recorded as JSON null. */
    public static ChangeEntry modify(DiffPath path, JsonNode oldValue, JsonNode newValue) {
        return new ChangeEntry(ChangeOp.MODIFY, path, orNull(oldValue), orNull(newValue));
    }

    /** The single value of an add or remove. */
    public JsonNode getValue() {
        return switch (op) {
            case ADD -> newValue;
            case REMOVE -> oldValue;
            case MODIFY -> throw new IllegalStateException("A modification has two values: " + this);
        };
    }

    /** Same change seen from the other side: add and remove swap, modifications swap their values. */
    public ChangeEntry inverse() {
        return new ChangeEntry(op.inverse(), path, newValue, oldValue);
    }

    @JsonValue
    public List<Object> toList() {
        List<Object> out = new ArrayList<>(4);
        out.add(op.symbol());
        out.add(path.value());
        if (op == ChangeOp.MODIFY) {
            out.add(oldValue);
            out.add(newValue);
        } else {
            out.add(getValue());
        }
        return out;
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    private static JsonNode orNull(JsonNode value) {
        return value == null ? NullNode.getInstance() : value;
    }
}
