package org.dice.logicgraph.graph;

/**
 * Thrown when a graph is evaluated against an assignment that has no value for one of its inputs.
 */
public class UnboundInputException extends IllegalArgumentException {

    private final String inputName;

    public UnboundInputException(String inputName) {
        super(String.format("No value assigned to input '%s'", inputName));
        this.inputName = inputName;
    }

    public String getInputName() {
        return inputName;
    }
}
