package org.dice.logicgraph.graph;

/**
 * Canonical key of a gate: operator plus its two operand nodes. Operands are already unique
 * within a build, so they are compared by reference and the key stays the same size however
 * deep the subexpression is.
 */
final class GateKey {

    private final GateType gateType;
    private final GraphNode first;
    private final GraphNode second;
    private final boolean commutative;

    private GateKey(GateType gateType, GraphNode first, GraphNode second, boolean commutative) {
        this.gateType = gateType;
        this.first = first;
        this.second = second;
        this.commutative = commutative;
    }

    static GateKey of(GateType gateType, GraphNode left, GraphNode right, boolean commutative){
        return new GateKey(gateType, left, right, commutative);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GateKey other = (GateKey) o;
        if(gateType != other.gateType || commutative != other.commutative){
            return false;
        }
        if(first == other.first && second == other.second){
            return true;
        }
        return commutative && first == other.second && second == other.first;
    }

    @Override
    public int hashCode() {
        int a = System.identityHashCode(first);
        int b = System.identityHashCode(second);
        // symmetric in the operands when order does not matter
        int operands = commutative ? a + b : 31 * a + b;
        return 31 * gateType.ordinal() + operands;
    }

    @Override
    public String toString() {
        return String.format("%s(%s,%s)", gateType, first, second);
    }
}
