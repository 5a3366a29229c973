package org.dice.logicgraph.graph;

import com.google.common.base.Preconditions;
import org.dice.logicgraph.parsing.ast.Expression;
import org.dice.logicgraph.parsing.ast.operands.Input;
import org.dice.logicgraph.parsing.ast.operators.And;
import org.dice.logicgraph.parsing.ast.operators.BinaryOperator;
import org.dice.logicgraph.parsing.ast.operators.Nand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a parsed {@link Expression} into a {@link Graph}, creating one node per distinct input
 * name and one node per distinct gate key. Repeated subexpressions share a single node.
 * <p>
 * Operands are always resolved before the gate that uses them is created, so the result is acyclic.
 * The memo lives only for the duration of one {@link #build} call.
 */
public class GraphBuilder {

    private static final Logger Log = LoggerFactory.getLogger( GraphBuilder.class );

    private final boolean commutative;

    public GraphBuilder() {
        this(false);
    }

    /**
     * @param commutative when true {@code A.B} and {@code B.A} share one node
     */
    public GraphBuilder(boolean commutative) {
        this.commutative = commutative;
    }

    public Graph build(Expression ast) {
        Preconditions.checkNotNull(ast, "expression must not be null");

        Memo memo = new Memo();
        GraphNode output = resolve(ast, memo);
        Graph graph = new Graph(memo.created, output);
        if(Log.isDebugEnabled()){
            Log.debug("Built graph for {} with {} nodes ({} inputs)", ast.render(), graph.size(), memo.inputs.size());
        }
        return graph;
    }

    private GraphNode resolve(Expression expression, Memo memo) {
        if(expression instanceof Input){
            return resolveInput(((Input) expression).getName(), memo);
        }
        if(expression instanceof Nand){
            return resolveGate(GateType.NAND, (BinaryOperator) expression, memo);
        }
        if(expression instanceof And){
            return resolveGate(GateType.AND, (BinaryOperator) expression, memo);
        }
        throw new IllegalArgumentException(String.format("Unsupported expression type %s", expression.getClass().getName()));
    }

    private GraphNode resolveInput(String name, Memo memo) {
        GraphNode node = memo.inputs.get(name);
        if(node == null){
            node = GraphNode.input(name);
            memo.inputs.put(name, node);
            memo.add(node);
        }
        return node;
    }

    private GraphNode resolveGate(GateType gateType, BinaryOperator operator, Memo memo) {
        GraphNode left = resolve(operator.getLeft(), memo);
        GraphNode right = resolve(operator.getRight(), memo);

        GateKey key = GateKey.of(gateType, left, right, commutative);
        GraphNode node = memo.gates.get(key);
        if(node == null){
            node = GraphNode.gate(gateType, left, right);
            memo.gates.put(key, node);
            memo.add(node);
        }
        return node;
    }

    private static class Memo {
        private final Map<String, GraphNode> inputs = new HashMap<String, GraphNode>();
        private final Map<GateKey, GraphNode> gates = new HashMap<GateKey, GraphNode>();
        private final List<GraphNode> created = new ArrayList<GraphNode>();

        private void add(GraphNode node){
            created.add(node);
            if(Log.isTraceEnabled()){
                Log.trace("Created node {}", node);
            }
        }
    }
}
