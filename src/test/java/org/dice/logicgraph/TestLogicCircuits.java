package org.dice.logicgraph;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang.StringUtils;
import org.dice.logicgraph.graph.GateType;
import org.dice.logicgraph.graph.Graph;
import org.dice.logicgraph.graph.GraphNode;
import org.dice.logicgraph.graph.UnboundInputException;
import org.dice.logicgraph.parsing.ExpressionSyntaxException;
import org.dice.logicgraph.parsing.ParserErrors;
import org.dice.logicgraph.parsing.WhitespaceMode;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestLogicCircuits {

    private static final String[] IDENTIFIERS = {"A", "B", "x", "in1", "10", "Signal42"};

    @Test
    public void parsesAndForAnyIdentifiers() {
        for(String a : IDENTIFIERS){
            for(String b : IDENTIFIERS){
                GraphNode output = LogicCircuits.parseInput(a + "." + b).getOutput();
                assertEquals(GateType.AND, output.getGateType());
                assertEquals(a, output.getLeft().getIdentity());
                assertEquals(b, output.getRight().getIdentity());
                assertTrue(output.getLeft().isInput());
                assertTrue(output.getRight().isInput());
            }
        }
    }

    @Test
    public void parsesNandForAnyIdentifiers() {
        for(String a : IDENTIFIERS){
            for(String b : IDENTIFIERS){
                GraphNode output = LogicCircuits.parseInput("!(" + a + "." + b + ")").getOutput();
                assertEquals(GateType.NAND, output.getGateType());
                assertEquals(a, output.getLeft().getIdentity());
                assertEquals(b, output.getRight().getIdentity());
            }
        }
    }

    @Test
    public void sameOperandTwiceIsOneInput() {
        Graph graph = LogicCircuits.parseInput("A.A");
        assertSame(graph.getOutput().getLeft(), graph.getOutput().getRight());
        assertEquals(2, graph.size());
    }

    @Test
    public void evaluatesDocumentedExamples() {
        assertTrue(LogicCircuits.evaluate(LogicCircuits.parseInput("A.B"), ImmutableMap.of("A", true, "B", true)));
        assertFalse(LogicCircuits.evaluate(LogicCircuits.parseInput("A.B"), ImmutableMap.of("A", true, "B", false)));
        assertFalse(LogicCircuits.evaluate(LogicCircuits.parseInput("!(A.B)"), ImmutableMap.of("A", true, "B", true)));
        assertTrue(LogicCircuits.evaluate(LogicCircuits.parseInput("!(A.B)"), ImmutableMap.of("A", false, "B", true)));
    }

    @Test
    public void evaluatesCircuitExample() {
        // !(C.D).!(!(A.B).C)
        Graph graph = LogicCircuits.parseInput("!(C.D).!(!(A.B).C)");
        assertTrue(LogicCircuits.evaluate(graph, ImmutableMap.of("A", true, "B", true, "C", true, "D", false)));
        assertFalse(LogicCircuits.evaluate(graph, ImmutableMap.of("A", true, "B", true, "C", true, "D", true)));
        assertFalse(LogicCircuits.evaluate(graph, ImmutableMap.of("A", false, "B", true, "C", true, "D", false)));
    }

    @Test
    public void rejectsMalformedInput() {
        assertSyntaxError("", ParserErrors.EmptyExpression);
        assertSyntaxError("A.", ParserErrors.MissingOperand);
        assertSyntaxError("!(A.B", ParserErrors.MissingRightParen);
        assertSyntaxError("A.B.C", ParserErrors.TrailingCharacters);
    }

    @Test
    public void reportsUnboundInputByName() {
        try {
            LogicCircuits.evaluate(LogicCircuits.parseInput("A.B"), ImmutableMap.of("A", true));
            fail("Expected unbound input");
        } catch (UnboundInputException e) {
            assertEquals("B", e.getInputName());
        }
    }

    @Test
    public void appliesConfiguration() {
        LogicGraphConfig strict = LogicGraphConfig.defaults().withStrictGrammar(true);
        assertSyntaxError("!(!(A.B).C)", ParserErrors.NestingNotAllowed, strict);

        LogicGraphConfig ignoreSpaces = LogicGraphConfig.defaults().withWhitespaceMode(WhitespaceMode.IGNORE);
        assertEquals(GateType.NAND, LogicCircuits.parseInput("! ( A . B )", ignoreSpaces).getOutput().getGateType());

        LogicGraphConfig commutative = LogicGraphConfig.defaults().withCommutative(true);
        Graph graph = LogicCircuits.parseInput("!(A.B).!(B.A)", commutative);
        assertSame(graph.getOutput().getLeft(), graph.getOutput().getRight());
    }

    @Test
    public void handlesNestingUpToConfiguredDepth() {
        int depth = LogicGraphConfig.defaults().getMaxDepth();
        Graph graph = LogicCircuits.parseInput(nested(depth));
        assertEquals(depth + 2, graph.size());
        // each level negates the one below it while B is true
        assertTrue(LogicCircuits.evaluate(graph, ImmutableMap.of("A", true, "B", true)));
        assertTrue(LogicCircuits.evaluate(graph, ImmutableMap.of("A", false, "B", false)));
        assertFalse(LogicCircuits.evaluate(LogicCircuits.parseInput(nested(depth - 1)), ImmutableMap.of("A", true, "B", true)));
    }

    @Test
    public void deepInputFailsWithSyntaxError() {
        assertSyntaxError(nested(4000), ParserErrors.NestingTooDeep);
        assertSyntaxError(nested(20000), ParserErrors.NestingTooDeep);
        assertSyntaxError(nested(11), ParserErrors.NestingTooDeep, LogicGraphConfig.defaults().withMaxDepth(10));
        assertEquals(12, LogicCircuits.parseInput(nested(10), LogicGraphConfig.defaults().withMaxDepth(10)).size());
    }

    @Test
    public void eachCallBuildsAnIndependentGraph() {
        Graph first = LogicCircuits.parseInput("!(A.B)");
        Graph second = LogicCircuits.parseInput("!(A.B)");
        assertFalse(first.getOutput() == second.getOutput());
        assertEquals(first.getOutput().getIdentity(), second.getOutput().getIdentity());
    }

    private static String nested(int depth){
        return StringUtils.repeat("!(", depth) + "A" + StringUtils.repeat(".B)", depth);
    }

    private void assertSyntaxError(String input, ParserErrors expected){
        assertSyntaxError(input, expected, LogicGraphConfig.defaults());
    }

    private void assertSyntaxError(String input, ParserErrors expected, LogicGraphConfig config){
        try {
            LogicCircuits.parseInput(input, config);
            fail(String.format("Expected %s for \"%s\"", expected, StringUtils.abbreviate(input, 40)));
        } catch (ExpressionSyntaxException e) {
            assertEquals(expected, e.getError());
        }
    }
}
