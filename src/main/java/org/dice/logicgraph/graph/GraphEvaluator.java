package org.dice.logicgraph.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Evaluates a {@link Graph} against an assignment of input names to boolean values.
 * <p>
 * Each call keeps its own memo keyed by node, so every node is computed at most once per call and
 * one graph can be evaluated from several threads at the same time.
 */
public class GraphEvaluator {

    private static final Logger Log = LoggerFactory.getLogger( GraphEvaluator.class );

    /**
     * @return the value of the graph's output node
     * @throws UnboundInputException if an input of the graph has no (or a null) value in the assignment
     */
    public boolean evaluate(Graph graph, Map<String, Boolean> assignment) {
        Preconditions.checkNotNull(graph, "graph must not be null");
        Preconditions.checkNotNull(assignment, "assignment must not be null");

        boolean result = evaluate(graph.getOutput(), assignment, new IdentityHashMap<GraphNode, Boolean>());
        if(Log.isDebugEnabled()){
            Log.debug("Evaluated {} to {}", graph.getOutput().getIdentity(), result);
        }
        return result;
    }

    /**
     * @return the value of every node in the graph keyed by node identity, in creation order
     */
    public ImmutableMap<String, Boolean> evaluateAll(Graph graph, Map<String, Boolean> assignment) {
        Preconditions.checkNotNull(graph, "graph must not be null");
        Preconditions.checkNotNull(assignment, "assignment must not be null");

        Map<GraphNode, Boolean> memo = new IdentityHashMap<GraphNode, Boolean>();
        ImmutableMap.Builder<String, Boolean> values = ImmutableMap.builder();
        for(GraphNode node : graph.getNodes()){
            values.put(node.getIdentity(), evaluate(node, assignment, memo));
        }
        return values.build();
    }

    private boolean evaluate(GraphNode node, Map<String, Boolean> assignment, Map<GraphNode, Boolean> memo) {
        Boolean cached = memo.get(node);
        if(cached != null){
            return cached;
        }

        boolean value;
        if(node.isInput()){
            Boolean assigned = assignment.get(node.getIdentity());
            if(assigned == null){
                throw new UnboundInputException(node.getIdentity());
            }
            value = assigned;
        }
        else{
            boolean left = evaluate(node.getLeft(), assignment, memo);
            boolean right = evaluate(node.getRight(), assignment, memo);
            value = node.getGateType().apply(left, right);
        }
        memo.put(node, value);
        return value;
    }
}
