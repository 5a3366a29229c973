package org.dice.logicgraph.graph;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.NoSuchElementException;

/**
 * An immutable directed acyclic graph of input and gate nodes with one designated output node.
 * Nodes are kept in creation order, which lists every operand before the gates that use it.
 * The lookup by identity is built on first use.
 */
public final class Graph {

    private final ImmutableList<GraphNode> nodes;
    private final GraphNode output;
    private final Supplier<ImmutableMap<String, GraphNode>> byIdentity;

    Graph(Collection<GraphNode> nodes, GraphNode output) {
        this.nodes = ImmutableList.copyOf(nodes);
        this.output = Preconditions.checkNotNull(output);
        Preconditions.checkArgument(!this.nodes.isEmpty() && this.nodes.get(this.nodes.size() - 1) == output,
                "output node must be the last node created");
        this.byIdentity = Suppliers.memoize(new Supplier<ImmutableMap<String, GraphNode>>() {
            @Override
            public ImmutableMap<String, GraphNode> get() {
                ImmutableMap.Builder<String, GraphNode> builder = ImmutableMap.builder();
                for(GraphNode node : Graph.this.nodes){
                    builder.put(node.getIdentity(), node);
                }
                return builder.build();
            }
        });
    }

    public GraphNode getOutput() {
        return output;
    }

    public ImmutableList<GraphNode> getNodes() {
        return nodes;
    }

    public ImmutableList<GraphNode> getGates() {
        ImmutableList.Builder<GraphNode> gates = ImmutableList.builder();
        for(GraphNode node : nodes){
            if(!node.isInput()){
                gates.add(node);
            }
        }
        return gates.build();
    }

    public ImmutableSortedSet<String> getInputNames() {
        ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
        for(GraphNode node : nodes){
            if(node.isInput()){
                names.add(node.getIdentity());
            }
        }
        return names.build();
    }

    /**
     * @return each gate mapped to its first and second operand
     */
    public ImmutableListMultimap<GraphNode, GraphNode> getEdges() {
        ImmutableListMultimap.Builder<GraphNode, GraphNode> edges = ImmutableListMultimap.builder();
        for(GraphNode node : nodes){
            edges.putAll(node, node.getOperands());
        }
        return edges.build();
    }

    public boolean hasNode(String identity) {
        return byIdentity.get().containsKey(identity);
    }

    public GraphNode getNode(String identity) {
        GraphNode node = byIdentity.get().get(identity);
        if(node == null){
            throw new NoSuchElementException(String.format("No node exists with the identity '%s'", identity));
        }
        return node;
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Graph with %d nodes and output: [%s]", nodes.size(), output.getIdentity()));
        sb.append("\n\nEdges:\n");
        for(GraphNode node : nodes){
            if(node.isInput()){
                sb.append('\t').append(node).append("\t-->\tNo Edges\n");
            }
            else{
                for(GraphNode operand : node.getOperands()){
                    sb.append('\t').append(node).append("\t-->\t").append(operand).append('\n');
                }
            }
        }
        return sb.toString();
    }
}
