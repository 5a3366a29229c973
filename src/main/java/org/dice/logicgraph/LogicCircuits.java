package org.dice.logicgraph;

import com.google.common.base.Preconditions;
import org.dice.logicgraph.graph.Graph;
import org.dice.logicgraph.graph.GraphBuilder;
import org.dice.logicgraph.graph.GraphEvaluator;
import org.dice.logicgraph.parsing.Lexer;
import org.dice.logicgraph.parsing.RecursiveDescentParser;
import org.dice.logicgraph.parsing.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Entry points: parse an expression such as {@code !(C.D).!(!(A.B).C)} into a logic circuit
 * {@link Graph}, and evaluate a graph for a set of input values.
 * <pre>
 *     Graph graph = LogicCircuits.parseInput("!(A.B)");
 *     boolean out = LogicCircuits.evaluate(graph, ImmutableMap.of("A", true, "B", false)); // true
 * </pre>
 */
public final class LogicCircuits {

    private static final Logger Log = LoggerFactory.getLogger( LogicCircuits.class );

    private static final GraphEvaluator EVALUATOR = new GraphEvaluator();
    private static final LogicGraphConfig DEFAULT_CONFIG = LogicGraphConfig.load();

    private LogicCircuits() {
    }

    /**
     * Parses with the settings from {@link LogicGraphConfig#load()}, read once per class load.
     *
     * @throws org.dice.logicgraph.parsing.ExpressionSyntaxException if the expression is malformed
     */
    public static Graph parseInput(String expression) {
        return parseInput(expression, DEFAULT_CONFIG);
    }

    public static Graph parseInput(String expression, LogicGraphConfig config) {
        Preconditions.checkNotNull(config, "config must not be null");

        Expression ast = parse(expression, config);
        if(Log.isDebugEnabled()){
            Log.debug("Parsed \"{}\" as {}", expression, ast.render());
        }
        return new GraphBuilder(config.isCommutative()).build(ast);
    }

    public static Expression parse(String expression, LogicGraphConfig config) {
        RecursiveDescentParser parser = new RecursiveDescentParser(
                new Lexer(expression, config.getWhitespaceMode()), config.isStrictGrammar(), config.getMaxDepth());
        return parser.parse();
    }

    /**
     * @throws org.dice.logicgraph.graph.UnboundInputException if an input of the graph is missing from the assignment
     */
    public static boolean evaluate(Graph graph, Map<String, Boolean> assignment) {
        return EVALUATOR.evaluate(graph, assignment);
    }
}
