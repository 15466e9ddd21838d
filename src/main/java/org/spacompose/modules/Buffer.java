package org.spacompose.modules;

import org.spacompose.module.Module;
import org.spacompose.network.Node;
import org.spacompose.vocab.Vocabulary;

/**
 * A module holding one vector, exposed as both its {@code "default"} input and output.
 * <p>
 * Without an explicit vocabulary the ports declare only their dimensionality; they are bound to
 * the parent's shared vocabulary of that dimensionality when the buffer is registered.
 */
public class Buffer extends Module {

    private final Node state;

    /**
     * @param label      The label, or {@code null} to take the registered name.
     * @param dimensions The dimensionality of the stored vector.
     */
    public Buffer(String label, int dimensions) {
        super(label);
        this.state = createState(dimensions);
        addInput("default", state, dimensions);
        addOutput("default", state, dimensions);
    }

    /**
     * @param label      The label, or {@code null} to take the registered name.
     * @param vocabulary The vocabulary of the stored vector.
     */
    public Buffer(String label, Vocabulary vocabulary) {
        super(label);
        this.state = createState(vocabulary.dimensions());
        addInput("default", state, vocabulary);
        addOutput("default", state, vocabulary);
    }

    private Node createState(int dimensions) {
        Node[] created = new Node[1];
        build(() -> created[0] = new Node("state", dimensions));
        return created[0];
    }

    public Node getState() {
        return state;
    }
}
