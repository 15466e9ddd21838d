package org.spacompose.network;

/**
 * A labelled object of fixed dimensionality that ports point at.
 * <p>
 * A node created while a network scope is open is added to the innermost network.
 */
public class Node {

    private final String label;
    private final int dimensions;

    /**
     * @param label      The node label, may be {@code null}.
     * @param dimensions The node's dimensionality (must be positive).
     */
    public Node(String label, int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Node dimensions must be positive, got " + dimensions);
        }
        this.label = label;
        this.dimensions = dimensions;
        NetworkContext.current().ifPresent(network -> network.addNode(this));
    }

    public String getLabel() {
        return label;
    }

    public int getDimensions() {
        return dimensions;
    }

    @Override
    public String toString() {
        return "<Node \"" + label + "\" (" + dimensions + "D)>";
    }
}
