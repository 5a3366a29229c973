package org.dice.logicgraph.graph;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

/**
 * A node of a logic circuit graph: either a named input or a gate wired to two operand nodes.
 * <p>
 * Nodes are only created by {@link GraphBuilder}, which creates at most one node per canonical
 * key, so nodes compare by object identity. A gate's identity string spells out its whole
 * subexpression and is only built when first asked for.
 */
public final class GraphNode {

    private final Supplier<String> identity;
    private final GateType gateType;
    private final ImmutableList<GraphNode> operands;

    private GraphNode(Supplier<String> identity, GateType gateType, ImmutableList<GraphNode> operands) {
        this.identity = identity;
        this.gateType = gateType;
        this.operands = operands;
    }

    static GraphNode input(String name){
        return new GraphNode(Suppliers.ofInstance(name), null, ImmutableList.<GraphNode>of());
    }

    static GraphNode gate(final GateType gateType, final GraphNode left, final GraphNode right){
        Preconditions.checkNotNull(gateType);
        Supplier<String> identity = Suppliers.memoize(new Supplier<String>() {
            @Override
            public String get() {
                return String.format("%s(%s,%s)", gateType.name(), left.getIdentity(), right.getIdentity());
            }
        });
        return new GraphNode(identity, gateType, ImmutableList.of(left, right));
    }

    /**
     * @return the input name, or {@code AND(left,right)} / {@code NAND(left,right)} over the operand identities
     */
    public String getIdentity() {
        return identity.get();
    }

    public boolean isInput() {
        return gateType == null;
    }

    /**
     * @return the gate operator, null for input nodes
     */
    public GateType getGateType() {
        return gateType;
    }

    /**
     * @return first and second operand of a gate, empty for input nodes
     */
    public ImmutableList<GraphNode> getOperands() {
        return operands;
    }

    public GraphNode getLeft() {
        Preconditions.checkState(!isInput(), "input node %s has no operands", getIdentity());
        return operands.get(0);
    }

    public GraphNode getRight() {
        Preconditions.checkState(!isInput(), "input node %s has no operands", getIdentity());
        return operands.get(1);
    }

    @Override
    public String toString() {
        return isInput() ? String.format("Input: [%s]", getIdentity()) : String.format("%s Gate: [%s]", gateType, getIdentity());
    }
}
