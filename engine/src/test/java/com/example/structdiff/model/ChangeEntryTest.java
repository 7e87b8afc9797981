package com.example.structdiff.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.structdiff.JsonSupport.json;
import static com.example.structdiff.JsonSupport.tree;
import static org.junit.jupiter.api.Assertions.*;

class ChangeEntryTest {

    private final DiffPath path = DiffPath.ofText("a.b", ".");

    @Test
    void serializesAddAndRemoveAsTriples() {
        assertEquals(json("['+','a.b',45]"), tree(ChangeEntry.add(path, json("45"))));
        assertEquals(json("['-','a.b',{'x':[1]}]"), tree(ChangeEntry.remove(path, json("{'x':[1]}"))));
    }

    @Test
    void serializesModifyAsQuad() {
        assertEquals(json("['~','a.b','45','63']"), tree(ChangeEntry.modify(path, json("'45'"), json("'63'"))));
    }

    @Test
    void missingSideIsJsonNull() {
        ChangeEntry entry = ChangeEntry.modify(path, null, json("1"));
        assertTrue(entry.getOldValue().isNull());
        assertEquals(json("['~','a.b',null,1]"), tree(entry));
    }

    @Test
    void tokenPathSerializesAsList() {
        ChangeEntry entry = ChangeEntry.modify(DiffPath.ofTokens("a", 1), json("2"), json("3"));
        assertEquals(json("['~',['a',1],2,3]"), tree(entry));
        assertEquals(List.of("a", 1), entry.getPath().asTokens());
    }

    @Test
    void inverseSwapsDirection() {
        ChangeEntry add = ChangeEntry.add(path, json("1"));
        assertEquals(ChangeEntry.remove(path, json("1")), add.inverse());

        ChangeEntry modify = ChangeEntry.modify(path, json("1"), json("2"));
        assertEquals(ChangeEntry.modify(path, json("2"), json("1")), modify.inverse());
        assertEquals(modify, modify.inverse().inverse());
    }

    @Test
    void singleValueAccessor() {
        assertEquals(json("7"), ChangeEntry.add(path, json("7")).getValue());
        assertEquals(json("7"), ChangeEntry.remove(path, json("7")).getValue());
        assertThrows(IllegalStateException.class, () -> ChangeEntry.modify(path, json("1"), json("2")).getValue());
    }

    @Test
    void opSymbols() {
        assertEquals(ChangeOp.ADD, ChangeOp.fromSymbol("+"));
        assertEquals(ChangeOp.REMOVE, ChangeOp.fromSymbol("-"));
        assertEquals(ChangeOp.MODIFY, ChangeOp.fromSymbol("~"));
        assertThrows(IllegalArgumentException.class, () -> ChangeOp.fromSymbol("?"));
    }
}
