package com.example.structdiff.service;

import com.example.structdiff.JsonSupport;
import com.example.structdiff.model.ChangeEntry;
import com.example.structdiff.model.ChangeOp;
import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.CustomComparator;
import com.example.structdiff.model.Verdict;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.structdiff.JsonSupport.json;
import static com.example.structdiff.JsonSupport.tree;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class StructDiffServiceTest {

    private StructDiffService service;

    @BeforeEach
    void setUp() {
        service = new StructDiffService(new ObjectMapper(), ComparisonOptions.defaults());
    }

    @Test
    void bestDiffAlignsSimilarArrayElements() {
        JsonNode left = json("{'x':[{'a':1,'c':3,'e':5},{'y':3}]}");
        JsonNode right = json("{'x':[{'a':1,'b':2,'e':5}]}");

        assertEquals(json("[['-','x[0].c',3],['+','x[0].b',2],['-','x[1].y',3],['-','x[1]',{}]]"),
                tree(service.bestDiff(left, right)));
        assertEquals(10, service.diff(left, right).size());
    }

    @Test
    void bestDiffIsNeverLargerThanTheDefaultDiff() {
        JsonNode left = json("{'x':[{'a':1,'c':3,'e':5},{'y':3}],'z':[{'k':1,'l':2},{'m':3}]}");
        JsonNode right = json("{'x':[{'a':1,'b':2,'e':5}],'z':[{'m':3},{'k':1,'l':3}]}");

        List<ChangeEntry> best = service.bestDiff(left, right);
        List<ChangeEntry> plain = service.diff(left, right, ComparisonOptions.defaults().withSimilarity(0.8));

        assertTrue(StructDiffService.countChanges(best) <= StructDiffService.countChanges(plain));
    }

    @Test
    void bestDiffKeepsTheOtherOptions() {
        ComparisonOptions options = ComparisonOptions.builder().arrayPath(true).similarity(0.9).build();
        List<ChangeEntry> changes = service.bestDiff(json("{'x':[{'a':1,'c':3}]}"), json("{'x':[{'a':1,'c':4}]}"), options);

        assertEquals(1, changes.size());
        assertEquals(List.of("x", 0, "c"), changes.get(0).getPath().asTokens());
    }

    @Test
    void bestDiffPassesTheComparatorThrough() {
        CustomComparator ignoreC = (path, l, r) -> path.toString().endsWith(".c") ? Verdict.equal() : Verdict.defer();
        assertTrue(service.bestDiff(json("{'x':[{'a':1,'c':3}]}"), json("{'x':[{'a':1,'c':4}]}"),
                ComparisonOptions.defaults(), ignoreC).isEmpty());
    }

    @Test
    void diffOfAValueWithItselfIsEmpty() {
        JsonNode value = json("{'a':[1,2,{'b':[{'c':null}]}],'d':{'e':'f','g':2.5}}");
        assertTrue(service.diff(value, value).isEmpty());
        assertTrue(service.bestDiff(value, value).isEmpty());
        assertTrue(service.diff(value, value, ComparisonOptions.builder().useLcs(false).strict(false).build()).isEmpty());
    }

    @Test
    void reversedDiffHasTheSameMagnitude() {
        JsonNode a = json("{'a':1,'b':[1,2,3],'c':{'d':1}}");
        JsonNode b = json("{'b':[1,3,4],'c':{'d':2},'e':5}");

        List<ChangeEntry> forward = service.diff(a, b);
        List<ChangeEntry> backward = service.diff(b, a);

        assertEquals(json("[['-','a',1],['-','b[1]',2],['+','b[2]',4],['~','c.d',1,2],['+','e',5]]"), tree(forward));
        assertEquals(forward.size(), backward.size());
        assertEquals(count(forward, ChangeOp.ADD), count(backward, ChangeOp.REMOVE));
        assertEquals(count(forward, ChangeOp.REMOVE), count(backward, ChangeOp.ADD));
        assertEquals(count(forward, ChangeOp.MODIFY), count(backward, ChangeOp.MODIFY));
        assertEquals(json("['~','c.d',2,1]"), tree(forward.get(3).inverse()));
        assertTrue(backward.contains(forward.get(3).inverse()));
    }

    @Test
    void toleranceBoundary() {
        ComparisonOptions options = ComparisonOptions.builder().numericTolerance(0.5).build();
        assertTrue(service.diff(json("{'v':10.0}"), json("{'v':10.5}"), options).isEmpty());
        assertTrue(service.diff(json("{'v':10.5}"), json("{'v':10.0}"), options).isEmpty());
        assertEquals(1, service.diff(json("{'v':10.0}"), json("{'v':10.5000001}"), options).size());
    }

    @Test
    void toleranceAcrossRepresentationsNeedsLooseTyping() {
        ComparisonOptions options = ComparisonOptions.builder().numericTolerance(0.5).build();
        assertEquals(1, service.diff(json("{'v':10}"), json("{'v':10.5}"), options).size());
        assertTrue(service.diff(json("{'v':10}"), json("{'v':10.5}"), options.toBuilder().strict(false).build()).isEmpty());
    }

    @Test
    void tokenPathsIndexBackIntoTheInput() {
        ComparisonOptions options = ComparisonOptions.builder().arrayPath(true).useLcs(false).build();
        List<ChangeEntry> changes = service.diff(json("{'a':[1,2]}"), json("{'a':[1,3]}"), options);

        assertEquals(1, changes.size());
        assertEquals(ChangeOp.MODIFY, changes.get(0).getOp());
        assertEquals(List.of("a", 1), changes.get(0).getPath().asTokens());
        assertEquals(json("[['~',['a',1],2,3]]"), tree(changes));
    }

    @Test
    void tokenPathsWithSubsequenceAlignment() {
        ComparisonOptions options = ComparisonOptions.builder().arrayPath(true).build();
        assertEquals(json("[['-',['a',1],2],['+',['a',1],3]]"),
                tree(service.diff(json("{'a':[1,2]}"), json("{'a':[1,3]}"), options)));
    }

    @Test
    void plainJavaValuesAreConverted() {
        Map<String, Object> left = new LinkedHashMap<>();
        left.put("name", "a");
        left.put("tags", List.of("x", "y"));
        Map<String, Object> right = Map.of("name", "b", "tags", List.of("x", "y", "z"));

        assertEquals(json("[['~','name','a','b'],['+','tags[2]','z']]"), tree(service.diff(left, right)));
        assertEquals(json("[['~','',null,1]]"), tree(service.diff(null, 1)));
    }

    @Test
    void defaultsComeFromTheConstructor() {
        StructDiffService slashed = new StructDiffService(JsonSupport.MAPPER,
                ComparisonOptions.builder().delimiter("/").build());
        assertEquals(json("[['~','a/b',1,2]]"), tree(slashed.diff(json("{'a':{'b':1}}"), json("{'a':{'b':2}}"))));
        assertEquals("/", slashed.defaults().getDelimiter());
    }

    @Test
    void invalidOptionsAreRejectedUpFront() {
        CustomComparator comparator = mock(CustomComparator.class);
        ComparisonOptions badSimilarity = ComparisonOptions.builder().similarity(1.5).comparator(comparator).build();
        ComparisonOptions badTolerance = ComparisonOptions.builder().numericTolerance(-1).comparator(comparator).build();

        assertThrows(IllegalArgumentException.class, () -> service.diff(json("{}"), json("{}"), badSimilarity));
        assertThrows(IllegalArgumentException.class, () -> service.bestDiff(json("{}"), json("{}"), badTolerance));
        assertThrows(IllegalArgumentException.class,
                () -> new StructDiffService(new ObjectMapper(), ComparisonOptions.builder().similarity(0).build()));
        verifyNoInteractions(comparator);
    }

    private static long count(List<ChangeEntry> changes, ChangeOp op) {
        return changes.stream().filter(c -> c.getOp() == op).count();
    }
}
