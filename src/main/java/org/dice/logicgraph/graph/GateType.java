package org.dice.logicgraph.graph;

/**
 * The two primitive gates a circuit is built from.
 */
public enum GateType {
    AND {
        @Override
        public boolean apply(boolean a, boolean b) {
            return a && b;
        }
    },
    NAND {
        @Override
        public boolean apply(boolean a, boolean b) {
            return !(a && b);
        }
    };

    public abstract boolean apply(boolean a, boolean b);
}
