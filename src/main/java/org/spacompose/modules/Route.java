package org.spacompose.modules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spacompose.module.Module;
import org.spacompose.module.Port;
import org.spacompose.network.Connection;
import org.spacompose.vocab.Vocabulary;

import java.util.Optional;

/**
 * Connects an output of one sibling module to an input of another.
 * <p>
 * The endpoints are paths resolved through the parent, so they are only looked up once the
 * route itself is registered; the sibling modules must be registered before it. Both ports
 * must carry the same vocabulary.
 */
public class Route extends Module {

    private static final Logger LOG = LoggerFactory.getLogger(Route.class);

    private final String source;
    private final String target;
    private Connection connection;

    /**
     * @param label  The label, or {@code null} to take the registered name.
     * @param source Path of the output to read, e.g. {@code "vision"} or {@code "vision.default"}.
     * @param target Path of the input to drive.
     */
    public Route(String label, String source, String target) {
        super(label);
        this.source = source;
        this.target = target;
    }

    @Override
    protected void onAdd(Module parent) {
        Port out = parent.getModuleOutput(source);
        Port in = parent.getModuleInput(target);

        if (out.binding().dimensions() != in.binding().dimensions()) {
            throw new VocabularyMismatchException(source, target,
                    "dimensions " + out.binding().dimensions() + " and " + in.binding().dimensions() + " differ");
        }
        Optional<Vocabulary> outVocab = out.binding().vocabulary();
        Optional<Vocabulary> inVocab = in.binding().vocabulary();
        if (outVocab.isPresent() && inVocab.isPresent() && outVocab.get() != inVocab.get()) {
            throw new VocabularyMismatchException(source, target, "the ports use different vocabularies");
        }

        connection = parent.connect(out.target(), in.target());
        LOG.debug("Routed '{}' to '{}' in {}", source, target, parent);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    /**
     * @return The connection recorded in the parent, or empty until the route is registered.
     */
    public Optional<Connection> getConnection() {
        return Optional.ofNullable(connection);
    }
}
