package org.spacompose.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A composable network: a container of nodes, connections and nested networks with a
 * construction scope.
 * <p>
 * Networks created while another network's scope is open are nested in it, independently of
 * any name they may later be given. The scope is closed through {@link #exit(Throwable)}, which
 * tells {@link #onExit(Throwable)} whether construction failed.
 *
 * <pre>
 * Network model = new Network("model");
 * model.build(() -&gt; {
 *     Network inner = new Network("inner");   // nested in model
 * });
 * </pre>
 */
public class Network {

    private String label;
    private final Long seed;
    private final List<Network> networks = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();

    /**
     * Creates a network nested in the innermost open scope, if any.
     *
     * @param label The label, may be {@code null}.
     */
    public Network(String label) {
        this(label, null, null);
    }

    /**
     * @param label          The label, may be {@code null}.
     * @param seed           The seed for random sources created by this network, or {@code null}.
     * @param addToContainer {@code true} to require nesting in the innermost open scope,
     *                       {@code false} to never nest, {@code null} to nest when a scope is open.
     * @throws IllegalStateException if {@code addToContainer} is {@code true} and no scope is open.
     */
    public Network(String label, Long seed, Boolean addToContainer) {
        this.label = label;
        this.seed = seed;
        boolean add = addToContainer == null ? NetworkContext.depth() > 0 : addToContainer;
        if (add) {
            NetworkContext.current()
                    .orElseThrow(() -> new IllegalStateException(
                            "Network " + this + " must be created inside the scope of a containing network."))
                    .networks.add(this);
        }
    }

    /**
     * Runs {@code body} with this network's scope open.
     * <p>
     * If {@code body} throws, the scope is closed with that exception in flight and the exception
     * is rethrown unchanged. A failure while closing is attached to it as suppressed.
     *
     * @param body The construction code.
     */
    public void build(Runnable body) {
        enter();
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            try {
                exit(e);
            } catch (RuntimeException | Error closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        exit(null);
    }

    /**
     * Opens this network's construction scope.
     */
    public void enter() {
        NetworkContext.push(this);
    }

    /**
     * Closes this network's construction scope.
     *
     * @param inFlight The exception that aborted construction, or {@code null} on a clean close.
     * @throws IllegalStateException if this network is not the innermost open scope. Scopes still
     *                               open inside it are closed along with it.
     */
    public void exit(Throwable inFlight) {
        NetworkContext.pop(this);
        onExit(inFlight);
    }

    /**
     * Hook invoked after the scope has been closed.
     *
     * @param inFlight The exception that aborted construction, or {@code null} on a clean close.
     */
    protected void onExit(Throwable inFlight) {
    }

    void addNode(Node node) {
        nodes.add(node);
    }

    /**
     * Records a connection in this network.
     *
     * @param pre  The source object.
     * @param post The target object.
     * @return The recorded connection.
     */
    public Connection connect(Object pre, Object post) {
        Connection connection = new Connection(pre, post);
        connections.add(connection);
        return connection;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Long getSeed() {
        return seed;
    }

    /**
     * @return The directly nested networks in creation order.
     */
    public List<Network> getNetworks() {
        return Collections.unmodifiableList(networks);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + " " + (label == null ? "(unlabeled)" : "\"" + label + "\"") + ">";
    }
}
