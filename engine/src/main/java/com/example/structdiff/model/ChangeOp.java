package com.example.structdiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of change, with its external symbol. */
public enum ChangeOp {
    ADD("+"),
    REMOVE("-"),
    MODIFY("~");

    private final String symbol;

    ChangeOp(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() { return symbol; }

    public ChangeOp inverse() {
        return switch (this) {
            case ADD -> REMOVE;
            case REMOVE -> ADD;
            case MODIFY -> MODIFY;
        };
    }

    public static ChangeOp fromSymbol(String symbol) {
        for (ChangeOp op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown change symbol: " + symbol);
    }
}
