package com.labelsel.selector;

import com.labelsel.labels.MapLabels;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.labelsel.selector.SelectorNode.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation rules for every node kind, with particular attention to absent labels.
 */
public class SelectorEvaluatorTest {

    private final SelectorEvaluator evaluator = new SelectorEvaluator();

    private boolean evaluate(SelectorNode node, Map<String, String> labels) {
        return evaluator.evaluate(node, new MapLabels(labels));
    }

    // ============================================================
    // Leaf nodes
    // ============================================================

    @Test
    public void testEquals() {
        assertTrue(evaluate(eq("role", "db"), Map.of("role", "db")));
        assertFalse(evaluate(eq("role", "db"), Map.of("role", "web")));
        assertFalse(evaluate(eq("role", "db"), Map.of()));
        assertTrue(evaluate(eq("role", ""), Map.of("role", "")));
        assertFalse(evaluate(eq("role", ""), Map.of()));
    }

    @Test
    public void testNotEquals() {
        assertFalse(evaluate(ne("role", "db"), Map.of("role", "db")));
        assertTrue(evaluate(ne("role", "db"), Map.of("role", "web")));
        assertTrue(evaluate(ne("role", "db"), Map.of()));
    }

    @Test
    public void testAbsentLabelIsNotEqualForBothOperators() {
        Map<String, String> noLabels = Map.of();
        boolean equals = evaluate(eq("k", "v"), noLabels);
        boolean notEquals = evaluate(ne("k", "v"), noLabels);

        assertFalse(equals);
        assertTrue(notEquals);
        // Absence resolves towards "not equal" for both operators.
        assertEquals(evaluate(not(eq("k", "v")), noLabels), notEquals);
        assertFalse(evaluate(in("k", "v"), noLabels));
        assertTrue(evaluate(notIn("k", "v"), noLabels));
    }

    @Test
    public void testIn() {
        assertTrue(evaluate(in("tier", "a", "b"), Map.of("tier", "a")));
        assertTrue(evaluate(in("tier", "a", "b"), Map.of("tier", "b")));
        assertFalse(evaluate(in("tier", "a", "b"), Map.of("tier", "c")));
        assertFalse(evaluate(in("tier", "a", "b"), Map.of()));
        assertFalse(evaluate(in("tier"), Map.of("tier", "a")));
    }

    @Test
    public void testNotIn() {
        assertFalse(evaluate(notIn("tier", "a", "b"), Map.of("tier", "a")));
        assertTrue(evaluate(notIn("tier", "a", "b"), Map.of("tier", "c")));
        assertTrue(evaluate(notIn("tier", "a", "b"), Map.of()));
        assertTrue(evaluate(notIn("tier"), Map.of("tier", "a")));
    }

    @Test
    public void testHas() {
        assertTrue(evaluate(has("env"), Map.of("env", "prod")));
        assertTrue(evaluate(has("env"), Map.of("env", "")));
        assertFalse(evaluate(has("env"), Map.of("role", "db")));
    }

    @Test
    public void testAll() {
        assertTrue(evaluate(all(), Map.of()));
        assertTrue(evaluate(all(), Map.of("a", "b")));
    }

    // ============================================================
    // Composite nodes
    // ============================================================

    static Stream<Arguments> negationCases() {
        List<SelectorNode> nodes = List.of(
                eq("a", "1"), ne("a", "1"), in("a", "1", "2"), notIn("a", "1"), has("a"), all(),
                and(has("a"), eq("b", "2")), or(has("a"), eq("b", "2")));
        List<Map<String, String>> labelSets = List.of(
                Map.of(), Map.of("a", "1"), Map.of("a", "3"), Map.of("b", "2"), Map.of("a", "1", "b", "2"));
        return nodes.stream().flatMap(node -> labelSets.stream().map(labels -> Arguments.of(node, labels)));
    }

    @ParameterizedTest
    @MethodSource("negationCases")
    public void testNotNegatesOperand(SelectorNode node, Map<String, String> labels) {
        assertEquals(!evaluate(node, labels), evaluate(not(node), labels));
    }

    @Test
    public void testAnd() {
        SelectorNode node = and(eq("a", "1"), has("b"));
        assertTrue(evaluate(node, Map.of("a", "1", "b", "x")));
        assertFalse(evaluate(node, Map.of("a", "1")));
        assertFalse(evaluate(node, Map.of("b", "x")));
        assertTrue(evaluate(and(has("a")), Map.of("a", "1")));
    }

    @Test
    public void testOr() {
        SelectorNode node = or(eq("a", "1"), has("b"));
        assertTrue(evaluate(node, Map.of("a", "1")));
        assertTrue(evaluate(node, Map.of("b", "x")));
        assertFalse(evaluate(node, Map.of("a", "2")));
        assertFalse(evaluate(or(has("a")), Map.of()));
    }

    @Test
    public void testCompositeScenario() {
        SelectorNode node = and(eq("a", "1"), or(has("b"), not(eq("c", "2"))));
        assertTrue(evaluate(node, Map.of("a", "1", "c", "3")));
        assertFalse(evaluate(node, Map.of("a", "2")));
        assertFalse(evaluate(node, Map.of("a", "1", "c", "2")));
        assertTrue(evaluate(node, Map.of("a", "1", "b", "", "c", "2")));
    }

    // ============================================================
    // Short-circuit
    // ============================================================

    @Test
    public void testAndStopsAtFirstFalse() {
        CountingLabels labels = new CountingLabels(Map.of("f2", "x"));
        assertFalse(evaluator.evaluate(and(has("f1"), has("f2"), has("f3")), labels));
        assertEquals(List.of("f1"), labels.lookups());
    }

    @Test
    public void testAndEvaluatesInOrderUntilFalse() {
        CountingLabels labels = new CountingLabels(Map.of("f1", "x"));
        assertFalse(evaluator.evaluate(and(has("f1"), has("f2"), has("f3")), labels));
        assertEquals(List.of("f1", "f2"), labels.lookups());
    }

    @Test
    public void testOrStopsAtFirstTrue() {
        CountingLabels labels = new CountingLabels(Map.of("f2", "x"));
        assertTrue(evaluator.evaluate(or(has("f1"), has("f2"), has("f3")), labels));
        assertEquals(List.of("f1", "f2"), labels.lookups());
    }

    @Test
    public void testNullNodeRejected() {
        assertThrows(NullPointerException.class, () -> evaluate(null, Map.of()));
    }
}
